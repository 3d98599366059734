package com.drugbox.recognition.core.model;

import java.util.Objects;

/**
 * A contained failure inside one region's pipeline.
 */
public record RegionFailure(String regionId, FailureKind kind, String message) {

    public RegionFailure {
        Objects.requireNonNull(regionId, "regionId is required");
        Objects.requireNonNull(kind, "kind is required");
        message = message != null ? message : "";
    }
}
