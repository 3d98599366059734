package com.drugbox.recognition.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Numeric descriptor of one feature type for one image.
 *
 * @param type       feature kind
 * @param values     descriptor values; defensive copies are made on the way in and out
 * @param confidence how trustworthy the extraction was, in [0, 1]
 */
public record FeatureVector(FeatureType type, double[] values, double confidence) {

    public FeatureVector {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(values, "values is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int dimension() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return type == that.type
                && Double.compare(confidence, that.confidence) == 0
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(type, confidence) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{type=" + type + ", dim=" + values.length + ", confidence=" + confidence + '}';
    }
}
