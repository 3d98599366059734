package com.drugbox.recognition.metrics;

import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RecoveryMethod;

import java.time.Duration;

/**
 * Metrics seam for the recognition pipeline. {@link NoOpMetricsService} is the default.
 */
public interface MetricsService {

    void recordScanDuration(ImageSource source, Duration duration);

    void incrementDecision(RecommendedAction action);

    void incrementRegionFailure(FailureKind kind);

    void incrementOcrRetry();

    void recordMatchConfidence(int confidence);

    void incrementRecoveryAttempt(RecoveryMethod outcome);

    void recordCacheHit();

    void recordCacheMiss();

    void incrementIndexOptimize(int duplicatesRemoved);
}
