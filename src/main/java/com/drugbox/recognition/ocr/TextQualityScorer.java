package com.drugbox.recognition.ocr;

import java.util.regex.Pattern;

/**
 * Heuristic quality of recognized text in [0, 1]: the mean of character density (share of
 * letters and digits among non-space characters) and the share of tokens that look like
 * real words or strengths.
 */
public class TextQualityScorer {

    private static final Pattern WORD = Pattern.compile("\\p{L}{3,}");
    private static final Pattern STRENGTH =
            Pattern.compile("\\d+(?:[.,]\\d+)?(?:mg|mcg|g|ml|iu|%)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public double score(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        int nonSpace = 0;
        int alnum = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                nonSpace++;
                if (Character.isLetterOrDigit(c)) {
                    alnum++;
                }
            }
        }
        String[] tokens = WHITESPACE.split(text.trim());
        int recognized = 0;
        for (String token : tokens) {
            String bare = token.replaceAll("^[\\p{Punct}]+|[\\p{Punct}&&[^%]]+$", "");
            if (WORD.matcher(bare).matches() || STRENGTH.matcher(bare).matches()) {
                recognized++;
            }
        }
        double density = (double) alnum / nonSpace;
        double tokenRatio = (double) recognized / tokens.length;
        return 0.5 * density + 0.5 * tokenRatio;
    }
}
