package com.drugbox.recognition.ocr;

/**
 * Failure reported by a {@link TextRecognitionService}.
 */
public class TextRecognitionException extends RuntimeException {

    public enum Kind {
        /** Service down or overloaded; worth retrying. */
        SERVICE_UNAVAILABLE,
        /** Call took too long; worth retrying. */
        TIMEOUT,
        /** The crop cannot be read at all; retrying will not help. */
        INVALID_INPUT
    }

    private final Kind kind;

    public TextRecognitionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TextRecognitionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind != Kind.INVALID_INPUT;
    }
}
