package com.drugbox.recognition.similarity;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-overlap similarity: |intersection| / |union| of whitespace tokens.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int minTokenLength;

    public JaccardSimilarity() {
        this(1);
    }

    /**
     * @param minTokenLength tokens shorter than this are ignored on both sides
     */
    public JaccardSimilarity(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        Set<String> a = tokenize(s1);
        Set<String> b = tokenize(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String token : a) {
            if (b.contains(token)) {
                common++;
            }
        }
        return (double) common / (a.size() + b.size() - common);
    }

    @Override
    public String getName() {
        return "token-overlap";
    }

    public Set<String> tokenize(String s) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(s.trim())) {
            if (token.length() >= minTokenLength) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
