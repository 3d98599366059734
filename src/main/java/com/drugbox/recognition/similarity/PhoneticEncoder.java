package com.drugbox.recognition.similarity;

import java.util.Locale;

/**
 * Consonant-skeleton phonetic code tolerant of OCR glyph confusion.
 *
 * <p>Input is expected to be normalized already (lower case, diacritics folded).
 * Glyphs that OCR commonly confuses are folded first, then each token is reduced
 * to its first letter plus Soundex consonant classes with vowels dropped and
 * repeats collapsed. Tokens are joined with a single space.</p>
 */
public class PhoneticEncoder {

    private static final int MAX_CODE_DIGITS = 8;

    /**
     * Replaces glyph sequences that recognition engines mistake for one another.
     */
    public String foldConfusables(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        String lower = text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            char next = i + 1 < lower.length() ? lower.charAt(i + 1) : '\0';
            if (c == 'r' && next == 'n') {
                sb.append('m');
                i++;
            } else if (c == 'v' && next == 'v') {
                sb.append('w');
                i++;
            } else {
                sb.append(switch (c) {
                    case '0' -> 'o';
                    case '1', '|', '!' -> 'l';
                    case '5', '$' -> 's';
                    case '8' -> 'b';
                    case '6' -> 'g';
                    default -> c;
                });
            }
        }
        return sb.toString();
    }

    /**
     * Phonetic code of the whole text, one code per token.
     */
    public String encode(String text) {
        String folded = foldConfusables(text).trim();
        if (folded.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String token : folded.split("\\s+")) {
            String code = encodeToken(token);
            if (!code.isEmpty()) {
                if (out.length() > 0) {
                    out.append(' ');
                }
                out.append(code);
            }
        }
        return out.toString();
    }

    private String encodeToken(String token) {
        int start = 0;
        while (start < token.length() && !Character.isLetter(token.charAt(start))) {
            start++;
        }
        if (start == token.length()) {
            return "";
        }
        char first = token.charAt(start);
        StringBuilder code = new StringBuilder().append(first);
        char last = classOf(first);
        int digits = 0;
        for (int i = start + 1; i < token.length() && digits < MAX_CODE_DIGITS; i++) {
            char cls = classOf(token.charAt(i));
            if (cls == '0') {
                // vowels separate repeated classes, h/w/y do not
                if (isVowel(token.charAt(i))) {
                    last = '0';
                }
                continue;
            }
            if (cls != last) {
                code.append(cls);
                digits++;
            }
            last = cls;
        }
        return code.toString();
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }

    private static char classOf(char c) {
        return switch (c) {
            case 'b', 'f', 'p', 'v' -> '1';
            case 'c', 'g', 'j', 'k', 'q', 's', 'x', 'z' -> '2';
            case 'd', 't' -> '3';
            case 'l' -> '4';
            case 'm', 'n' -> '5';
            case 'r' -> '6';
            default -> '0';
        };
    }
}
