package com.drugbox.recognition.ocr;

import com.drugbox.recognition.core.model.FailureKind;

/**
 * Text extraction for one region gave up. Contained to that region.
 */
public class ExtractionFailureException extends RuntimeException {

    private final String regionId;
    private final FailureKind kind;
    private final int attempts;

    public ExtractionFailureException(String regionId, FailureKind kind, int attempts, String message,
                                      Throwable cause) {
        super(message, cause);
        this.regionId = regionId;
        this.kind = kind;
        this.attempts = attempts;
    }

    public String getRegionId() {
        return regionId;
    }

    /**
     * {@link FailureKind#TIMEOUT} when the last attempt timed out, otherwise
     * {@link FailureKind#EXTRACTION}.
     */
    public FailureKind getKind() {
        return kind;
    }

    public int getAttempts() {
        return attempts;
    }
}
