package com.drugbox.recognition.aggregate;

import com.drugbox.recognition.core.model.ImageSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of scanning one image: one result per completed region in region order, the
 * duplicates among them, plus scan-wide figures.
 */
public final class MultiDrugResult {

    private final String scanId;
    private final String sessionId;
    private final ImageSource source;
    private final List<RegionResult> regions;
    private final List<String> drugNames;
    private final List<DuplicateDetection> duplicates;
    private final double aggregateConfidence;
    private final Duration processingDuration;
    private final ScanStatistics statistics;
    private final Instant completedAt;

    private MultiDrugResult(Builder builder) {
        this.scanId = Objects.requireNonNull(builder.scanId, "scanId is required");
        this.sessionId = builder.sessionId;
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.regions = builder.regions != null ? List.copyOf(builder.regions) : List.of();
        this.drugNames = builder.drugNames != null ? List.copyOf(builder.drugNames) : List.of();
        this.duplicates = builder.duplicates != null ? List.copyOf(builder.duplicates) : List.of();
        this.aggregateConfidence = builder.aggregateConfidence;
        this.processingDuration = builder.processingDuration != null ? builder.processingDuration : Duration.ZERO;
        this.statistics = builder.statistics != null ? builder.statistics : ScanStatistics.empty();
        this.completedAt = builder.completedAt != null ? builder.completedAt : Instant.now();

        if (aggregateConfidence < 0.0 || aggregateConfidence > 100.0) {
            throw new IllegalArgumentException("aggregateConfidence must be between 0 and 100");
        }
    }

    public String getScanId() {
        return scanId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ImageSource getSource() {
        return source;
    }

    /**
     * One result per completed region, duplicates included, in region order.
     */
    public List<RegionResult> getRegions() {
        return regions;
    }

    /**
     * Regions that represent a distinct detection: every region except those reported as
     * the duplicate side of a {@link DuplicateDetection}.
     */
    public List<RegionResult> getDetections() {
        Set<String> collapsed = new HashSet<>();
        for (DuplicateDetection d : duplicates) {
            collapsed.add(d.duplicateRegionId());
        }
        List<RegionResult> detections = new ArrayList<>(regions.size());
        for (RegionResult region : regions) {
            if (!collapsed.contains(region.getRegionId())) {
                detections.add(region);
            }
        }
        return detections;
    }

    public boolean isDuplicate(String regionId) {
        return duplicates.stream().anyMatch(d -> d.duplicateRegionId().equals(regionId));
    }

    /**
     * Distinct best-candidate drug names, in region order.
     */
    public List<String> getDrugNames() {
        return drugNames;
    }

    public List<DuplicateDetection> getDuplicates() {
        return duplicates;
    }

    /**
     * Mean confidence of the detections, 0 to 100.
     */
    public double getAggregateConfidence() {
        return aggregateConfidence;
    }

    public Duration getProcessingDuration() {
        return processingDuration;
    }

    public ScanStatistics getStatistics() {
        return statistics;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "MultiDrugResult{scanId='" + scanId + "', regions=" + regions.size()
                + ", drugs=" + drugNames + ", aggregateConfidence=" + aggregateConfidence + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String scanId;
        private String sessionId;
        private ImageSource source;
        private List<RegionResult> regions;
        private List<String> drugNames;
        private List<DuplicateDetection> duplicates;
        private double aggregateConfidence;
        private Duration processingDuration;
        private ScanStatistics statistics;
        private Instant completedAt;

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder source(ImageSource source) {
            this.source = source;
            return this;
        }

        public Builder regions(List<RegionResult> regions) {
            this.regions = regions;
            return this;
        }

        public Builder drugNames(List<String> drugNames) {
            this.drugNames = drugNames;
            return this;
        }

        public Builder duplicates(List<DuplicateDetection> duplicates) {
            this.duplicates = duplicates;
            return this;
        }

        public Builder aggregateConfidence(double aggregateConfidence) {
            this.aggregateConfidence = aggregateConfidence;
            return this;
        }

        public Builder processingDuration(Duration processingDuration) {
            this.processingDuration = processingDuration;
            return this;
        }

        public Builder statistics(ScanStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public MultiDrugResult build() {
            return new MultiDrugResult(this);
        }
    }
}
