package com.drugbox.recognition.correction;

import com.drugbox.recognition.core.model.FeatureVector;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A user correction, forwarded to the catalog and feature-store owners.
 *
 * @param originalText   text the pipeline read for the region (after recovery)
 * @param originalDrugId best candidate the pipeline proposed, or null
 * @param features       region feature vectors, so the feature store can learn the image
 */
public record CorrectionRecord(
        String id,
        String scanId,
        String regionId,
        String originalText,
        String originalDrugId,
        String correctedName,
        CorrectionKind kind,
        List<FeatureVector> features,
        Instant timestamp
) {
    public CorrectionRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(regionId, "regionId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (kind != CorrectionKind.REJECTED && (correctedName == null || correctedName.isBlank())) {
            throw new IllegalArgumentException("correctedName is required for " + kind);
        }
        originalText = originalText != null ? originalText : "";
        correctedName = correctedName != null ? correctedName : "";
        features = features != null ? List.copyOf(features) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String scanId;
        private String regionId;
        private String originalText;
        private String originalDrugId;
        private String correctedName;
        private CorrectionKind kind;
        private List<FeatureVector> features;
        private Instant timestamp = Instant.now();

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder regionId(String regionId) {
            this.regionId = regionId;
            return this;
        }

        public Builder originalText(String originalText) {
            this.originalText = originalText;
            return this;
        }

        public Builder originalDrugId(String originalDrugId) {
            this.originalDrugId = originalDrugId;
            return this;
        }

        public Builder correctedName(String correctedName) {
            this.correctedName = correctedName;
            return this;
        }

        public Builder kind(CorrectionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder features(List<FeatureVector> features) {
            this.features = features;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public CorrectionRecord build() {
            return new CorrectionRecord(id, scanId, regionId, originalText, originalDrugId,
                    correctedName, kind, features, timestamp);
        }
    }
}
