package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;

import java.util.Objects;
import java.util.Set;

/**
 * A stored reference image that resembles the query.
 *
 * @param imageId    stored image id
 * @param drugName   drug the image is labelled with
 * @param similarity combined similarity in [0, 1]
 * @param agreeing   feature types that individually agreed
 */
public record VisualMatch(String imageId, String drugName, double similarity, Set<FeatureType> agreeing) {

    public VisualMatch {
        Objects.requireNonNull(imageId, "imageId is required");
        Objects.requireNonNull(drugName, "drugName is required");
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0");
        }
        agreeing = agreeing != null ? Set.copyOf(agreeing) : Set.of();
    }
}
