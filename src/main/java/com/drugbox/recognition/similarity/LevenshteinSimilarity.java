package com.drugbox.recognition.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / max(len1, len2)}.
 *
 * <p>The raw distance is exposed as well because text recovery bounds candidates by
 * the ratio of distance to token length rather than by similarity.</p>
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance(s1, s2) / maxLength);
    }

    @Override
    public String getName() {
        return "edit-distance";
    }

    /**
     * Wagner-Fischer distance keeping only two rows of the shorter string.
     */
    public static int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String swap = s1;
            s1 = s2;
            s2 = swap;
        }
        int m = s1.length();
        int n = s2.length();
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }
        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            char c2 = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == c2 ? 0 : 1;
                curr[i] = Math.min(Math.min(curr[i - 1] + 1, prev[i] + 1), prev[i - 1] + cost);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[m];
    }
}
