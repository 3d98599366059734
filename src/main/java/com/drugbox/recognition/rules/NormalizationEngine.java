package com.drugbox.recognition.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Turns raw box text into the key form used for catalog lookup.
 *
 * <p>Characters are folded to plain ASCII letters first (Turkish dotless i and
 * accented Latin letters included), then the rules run in priority order, then the
 * result is lower-cased with whitespace collapsed.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules = new CopyOnWriteArrayList<>();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        addRules(rules);
    }

    public void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> merged = new ArrayList<>(rules);
        merged.addAll(newRules);
        merged.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        rules.clear();
        rules.addAll(merged);
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = foldCharacters(text);
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isDebugEnabled() && !before.equals(result)) {
                log.debug("normalize.rule rule={} before='{}' after='{}'", rule.getName(), before, result);
            }
        }
        return WHITESPACE.matcher(result.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    /**
     * Normalizes each non-blank line on its own, dropping lines that normalize to nothing.
     */
    public List<String> normalizeLines(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String normalized = normalize(line);
            if (!normalized.isEmpty() && !lines.contains(normalized)) {
                lines.add(normalized);
            }
        }
        return lines;
    }

    /**
     * Folds Turkish and accented letters to their unaccented lower-case form.
     */
    public static String foldCharacters(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(switch (c) {
                case 'ı', 'İ', 'I' -> 'i';
                case 'ş', 'Ş' -> 's';
                case 'ğ', 'Ğ' -> 'g';
                case 'ç', 'Ç' -> 'c';
                case 'ö', 'Ö' -> 'o';
                case 'ü', 'Ü' -> 'u';
                default -> c;
            });
        }
        String decomposed = Normalizer.normalize(sb.toString(), Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
