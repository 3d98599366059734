package com.drugbox.recognition.detection;

import com.drugbox.recognition.core.model.BoundingBox;

import java.util.Objects;

/**
 * A raw box proposal before filtering and suppression.
 */
public record Proposal(BoundingBox box, double confidence) {

    public Proposal {
        Objects.requireNonNull(box, "box is required");
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
