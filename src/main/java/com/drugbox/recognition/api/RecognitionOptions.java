package com.drugbox.recognition.api;

import com.drugbox.recognition.cache.CacheConfig;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.decision.DecisionThresholds;
import com.drugbox.recognition.detection.DetectionOptions;
import com.drugbox.recognition.feature.FeatureWeights;
import com.drugbox.recognition.matching.CategoryThresholds;
import com.drugbox.recognition.matching.MatchEngine;
import com.drugbox.recognition.ocr.RetryConfig;
import com.drugbox.recognition.recovery.RecoveryOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for the recognition pipeline.
 * Configures concurrency, timeouts, thresholds and the visual index.
 */
public class RecognitionOptions {

    private static final Duration DEFAULT_EXTERNAL_CALL_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REGION_TIMEOUT = Duration.ofSeconds(30);
    private static final double DEFAULT_VISUAL_SIMILARITY_FLOOR = 0.75;
    private static final int DEFAULT_VISUAL_NEIGHBOURS = 10;
    private static final int DEFAULT_CORRECTION_CONTEXT_SIZE = 1_000;

    private final int workerThreads;
    private final Duration externalCallTimeout;
    private final Duration regionTimeout;
    private final RetryConfig retryConfig;
    private final DetectionOptions detectionOptions;
    private final RecoveryOptions recoveryOptions;
    private final DecisionThresholds decisionThresholds;
    private final CategoryThresholds categoryThresholds;
    private final FeatureWeights featureWeights;
    private final double visualSimilarityFloor;
    private final int visualNeighbours;
    private final int maxCandidates;
    private final CacheConfig cacheConfig;
    private final int correctionContextSize;
    private final ImageSource sourceTag;

    private RecognitionOptions(Builder builder) {
        this.workerThreads = builder.workerThreads;
        this.externalCallTimeout = builder.externalCallTimeout;
        this.regionTimeout = builder.regionTimeout;
        this.retryConfig = builder.retryConfig;
        this.detectionOptions = builder.detectionOptions;
        this.recoveryOptions = builder.recoveryOptions;
        this.decisionThresholds = builder.decisionThresholds;
        this.categoryThresholds = builder.categoryThresholds;
        this.featureWeights = builder.featureWeights;
        this.visualSimilarityFloor = builder.visualSimilarityFloor;
        this.visualNeighbours = builder.visualNeighbours;
        this.maxCandidates = builder.maxCandidates;
        this.cacheConfig = builder.cacheConfig;
        this.correctionContextSize = builder.correctionContextSize;
        this.sourceTag = builder.sourceTag;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getExternalCallTimeout() {
        return externalCallTimeout;
    }

    public Duration getRegionTimeout() {
        return regionTimeout;
    }

    public RetryConfig getRetryConfig() {
        return retryConfig;
    }

    public DetectionOptions getDetectionOptions() {
        return detectionOptions;
    }

    public RecoveryOptions getRecoveryOptions() {
        return recoveryOptions;
    }

    public DecisionThresholds getDecisionThresholds() {
        return decisionThresholds;
    }

    public CategoryThresholds getCategoryThresholds() {
        return categoryThresholds;
    }

    public FeatureWeights getFeatureWeights() {
        return featureWeights;
    }

    public double getVisualSimilarityFloor() {
        return visualSimilarityFloor;
    }

    public int getVisualNeighbours() {
        return visualNeighbours;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public int getCorrectionContextSize() {
        return correctionContextSize;
    }

    public ImageSource getSourceTag() {
        return sourceTag;
    }

    /**
     * Creates default options.
     */
    public static RecognitionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options: higher decision thresholds and the per-category clinical
     * minimums for edit-distance matches.
     */
    public static RecognitionOptions strict() {
        return builder()
                .decisionThresholds(DecisionThresholds.strict())
                .categoryThresholds(CategoryThresholds.clinicalPreset())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private Duration externalCallTimeout = DEFAULT_EXTERNAL_CALL_TIMEOUT;
        private Duration regionTimeout = DEFAULT_REGION_TIMEOUT;
        private RetryConfig retryConfig = RetryConfig.defaults();
        private DetectionOptions detectionOptions = DetectionOptions.defaults();
        private RecoveryOptions recoveryOptions = RecoveryOptions.defaults();
        private DecisionThresholds decisionThresholds = DecisionThresholds.defaults();
        private CategoryThresholds categoryThresholds = CategoryThresholds.defaults();
        private FeatureWeights featureWeights = FeatureWeights.defaults();
        private double visualSimilarityFloor = DEFAULT_VISUAL_SIMILARITY_FLOOR;
        private int visualNeighbours = DEFAULT_VISUAL_NEIGHBOURS;
        private int maxCandidates = MatchEngine.DEFAULT_MAX_CANDIDATES;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private int correctionContextSize = DEFAULT_CORRECTION_CONTEXT_SIZE;
        private ImageSource sourceTag = ImageSource.CAMERA;

        public Builder workerThreads(int workerThreads) {
            validatePositive(workerThreads, "workerThreads");
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder externalCallTimeout(Duration externalCallTimeout) {
            validateDuration(externalCallTimeout, "externalCallTimeout");
            this.externalCallTimeout = externalCallTimeout;
            return this;
        }

        public Builder regionTimeout(Duration regionTimeout) {
            validateDuration(regionTimeout, "regionTimeout");
            this.regionTimeout = regionTimeout;
            return this;
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig is required");
            return this;
        }

        public Builder detectionOptions(DetectionOptions detectionOptions) {
            this.detectionOptions = Objects.requireNonNull(detectionOptions, "detectionOptions is required");
            return this;
        }

        public Builder recoveryOptions(RecoveryOptions recoveryOptions) {
            this.recoveryOptions = Objects.requireNonNull(recoveryOptions, "recoveryOptions is required");
            return this;
        }

        public Builder decisionThresholds(DecisionThresholds decisionThresholds) {
            this.decisionThresholds = Objects.requireNonNull(decisionThresholds, "decisionThresholds is required");
            return this;
        }

        public Builder categoryThresholds(CategoryThresholds categoryThresholds) {
            this.categoryThresholds = Objects.requireNonNull(categoryThresholds, "categoryThresholds is required");
            return this;
        }

        public Builder featureWeights(FeatureWeights featureWeights) {
            this.featureWeights = Objects.requireNonNull(featureWeights, "featureWeights is required");
            return this;
        }

        public Builder visualSimilarityFloor(double visualSimilarityFloor) {
            if (visualSimilarityFloor < 0.0 || visualSimilarityFloor > 1.0) {
                throw new IllegalArgumentException("visualSimilarityFloor must be between 0.0 and 1.0");
            }
            this.visualSimilarityFloor = visualSimilarityFloor;
            return this;
        }

        public Builder visualNeighbours(int visualNeighbours) {
            validatePositive(visualNeighbours, "visualNeighbours");
            this.visualNeighbours = visualNeighbours;
            return this;
        }

        public Builder maxCandidates(int maxCandidates) {
            validatePositive(maxCandidates, "maxCandidates");
            this.maxCandidates = maxCandidates;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder correctionContextSize(int correctionContextSize) {
            validatePositive(correctionContextSize, "correctionContextSize");
            this.correctionContextSize = correctionContextSize;
            return this;
        }

        public Builder sourceTag(ImageSource sourceTag) {
            this.sourceTag = Objects.requireNonNull(sourceTag, "sourceTag is required");
            return this;
        }

        public RecognitionOptions build() {
            return new RecognitionOptions(this);
        }

        private static void validatePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
        }

        private static void validateDuration(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
        }
    }
}
