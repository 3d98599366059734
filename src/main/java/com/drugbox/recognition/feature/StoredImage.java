package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureVector;

import java.util.List;
import java.util.Objects;

/**
 * A reference image of a known drug, kept as feature vectors only.
 */
public record StoredImage(String imageId, String drugName, List<FeatureVector> features) {

    public StoredImage {
        Objects.requireNonNull(imageId, "imageId is required");
        Objects.requireNonNull(drugName, "drugName is required");
        features = features != null ? List.copyOf(features) : List.of();
    }
}
