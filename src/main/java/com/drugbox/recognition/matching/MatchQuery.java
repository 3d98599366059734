package com.drugbox.recognition.matching;

import com.drugbox.recognition.rules.NormalizationEngine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalized views of one region's text, shared by all match algorithms.
 *
 * @param normalized whole text normalized as one string
 * @param lines      each line normalized on its own
 * @param tokens     distinct tokens of {@code normalized}, in reading order
 */
public record MatchQuery(String normalized, List<String> lines, List<String> tokens) {

    public MatchQuery {
        lines = List.copyOf(lines);
        tokens = List.copyOf(tokens);
    }

    public static MatchQuery of(String rawText, NormalizationEngine normalizer) {
        String normalized = normalizer.normalize(rawText);
        List<String> lines = normalizer.normalizeLines(rawText);
        Set<String> tokens = new LinkedHashSet<>();
        if (!normalized.isEmpty()) {
            tokens.addAll(List.of(normalized.split(" ")));
        }
        return new MatchQuery(normalized, lines, new ArrayList<>(tokens));
    }

    public boolean isEmpty() {
        return normalized.isEmpty();
    }

    /**
     * Key used for memoizing results: the whole text plus its line structure.
     */
    public String cacheKey() {
        return String.join("\n", lines) + "\u0000" + normalized;
    }

    /**
     * Strings worth comparing against a key of {@code keyTokenCount} tokens: the whole text,
     * each line, and every run of {@code keyTokenCount} consecutive tokens.
     */
    public Set<String> comparisonStrings(int keyTokenCount) {
        Set<String> out = new LinkedHashSet<>();
        out.add(normalized);
        out.addAll(lines);
        for (int i = 0; i + keyTokenCount <= tokens.size(); i++) {
            out.add(String.join(" ", tokens.subList(i, i + keyTokenCount)));
        }
        out.remove("");
        return out;
    }
}
