package com.drugbox.recognition.metrics;

import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RecoveryMethod;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordScanDuration(ImageSource source, Duration duration) {
    }

    @Override
    public void incrementDecision(RecommendedAction action) {
    }

    @Override
    public void incrementRegionFailure(FailureKind kind) {
    }

    @Override
    public void incrementOcrRetry() {
    }

    @Override
    public void recordMatchConfidence(int confidence) {
    }

    @Override
    public void incrementRecoveryAttempt(RecoveryMethod outcome) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void incrementIndexOptimize(int duplicatesRemoved) {
    }
}
