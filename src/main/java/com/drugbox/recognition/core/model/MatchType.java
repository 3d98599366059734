package com.drugbox.recognition.core.model;

/**
 * Confidence band of a match candidate.
 */
public enum MatchType {
    /** Normalized text equals a catalog key; confidence is exactly 100. */
    EXACT,
    /** Confidence at or above 80. */
    HIGH,
    /** Confidence at or above 60. */
    MEDIUM,
    /** Confidence between 1 and 59. */
    LOW,
    /** Nothing matched. */
    NO_MATCH;

    public static final int HIGH_FLOOR = 80;
    public static final int MEDIUM_FLOOR = 60;

    /**
     * Maps a non-exact confidence onto its band.
     */
    public static MatchType forConfidence(int confidence) {
        if (confidence >= HIGH_FLOOR) {
            return HIGH;
        }
        if (confidence >= MEDIUM_FLOOR) {
            return MEDIUM;
        }
        return confidence > 0 ? LOW : NO_MATCH;
    }

    /**
     * Whether {@code confidence} lies inside this band.
     */
    public boolean admits(int confidence) {
        return switch (this) {
            case EXACT -> confidence == 100;
            case HIGH -> confidence >= HIGH_FLOOR && confidence <= 100;
            case MEDIUM -> confidence >= MEDIUM_FLOOR && confidence < HIGH_FLOOR;
            case LOW -> confidence > 0 && confidence < MEDIUM_FLOOR;
            case NO_MATCH -> confidence == 0;
        };
    }
}
