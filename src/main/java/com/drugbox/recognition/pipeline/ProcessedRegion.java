package com.drugbox.recognition.pipeline;

import com.drugbox.recognition.aggregate.RegionResult;
import com.drugbox.recognition.core.model.FeatureVector;

import java.util.List;
import java.util.Objects;

/**
 * A region's decision together with the state a later correction needs.
 */
public record ProcessedRegion(String scanId, RegionResult result, String matchedText, List<FeatureVector> features) {

    public ProcessedRegion {
        Objects.requireNonNull(scanId, "scanId is required");
        Objects.requireNonNull(result, "result is required");
        matchedText = matchedText != null ? matchedText : "";
        features = features != null ? List.copyOf(features) : List.of();
    }
}
