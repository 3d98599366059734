package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;

/**
 * Weight of each feature type in the combined visual similarity.
 * Weights must be non-negative and sum to 1.0.
 */
public record FeatureWeights(double layout, double color, double edge, double shape) {

    private static final double TOLERANCE = 0.001;

    public FeatureWeights {
        if (layout < 0 || color < 0 || edge < 0 || shape < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = layout + color + edge + shape;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got: " + sum);
        }
    }

    /**
     * Layout 0.35, color 0.30, edge 0.20, shape 0.15.
     */
    public static FeatureWeights defaults() {
        return new FeatureWeights(0.35, 0.30, 0.20, 0.15);
    }

    public double weightOf(FeatureType type) {
        return switch (type) {
            case TEXT_LAYOUT -> layout;
            case COLOR_HISTOGRAM -> color;
            case EDGE -> edge;
            case SHAPE -> shape;
        };
    }
}
