package com.drugbox.recognition.core.model;

/**
 * How a region's text was reconstructed.
 */
public enum RecoveryMethod {
    /** Completed against catalog names by edit distance or prefix. */
    DICTIONARY_COMPLETION,
    /** Dictionary completion confirmed by an independent visual match. */
    VISUAL_CROSS_REFERENCE,
    /** No reconstruction applied or none succeeded. */
    NONE
}
