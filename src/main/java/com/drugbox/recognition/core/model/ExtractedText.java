package com.drugbox.recognition.core.model;

import java.util.Objects;

/**
 * Raw text recognized inside a region.
 *
 * @param regionId          owning region
 * @param text              recognized text, possibly multi-line
 * @param quality           heuristic quality score in [0, 1]
 * @param serviceConfidence confidence reported by the recognition service, or -1 when it reported none
 */
public record ExtractedText(String regionId, String text, double quality, double serviceConfidence) {

    public ExtractedText {
        Objects.requireNonNull(regionId, "regionId is required");
        text = text != null ? text : "";
        if (quality < 0.0 || quality > 1.0) {
            throw new IllegalArgumentException("quality must be between 0.0 and 1.0");
        }
    }

    public boolean hasServiceConfidence() {
        return serviceConfidence >= 0.0;
    }

    public boolean isEmpty() {
        return text.isBlank();
    }
}
