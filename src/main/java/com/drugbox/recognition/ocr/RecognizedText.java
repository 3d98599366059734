package com.drugbox.recognition.ocr;

/**
 * Raw output of a text recognition service.
 *
 * @param text       recognized text, lines separated by newlines
 * @param confidence service confidence in [0, 1], or -1 when the service reports none
 */
public record RecognizedText(String text, double confidence) {

    public static final double UNKNOWN = -1.0;

    public RecognizedText {
        text = text != null ? text : "";
        if (confidence != UNKNOWN && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, or UNKNOWN");
        }
    }

    public static RecognizedText of(String text) {
        return new RecognizedText(text, UNKNOWN);
    }
}
