package com.drugbox.recognition.core.model;

/**
 * Physical state of a detected box, estimated from its crop.
 */
public enum BoxCondition {
    /** Sharp print, full contrast. */
    PERFECT,
    /** Readable with minor wear or glare. */
    WORN,
    /** Partially unreadable; text recovery is attempted. */
    DAMAGED,
    /** Little usable print left. */
    SEVERELY_DAMAGED;

    public boolean isDamaged() {
        return this == DAMAGED || this == SEVERELY_DAMAGED;
    }
}
