package com.drugbox.recognition.metrics;

import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RecoveryMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <ul>
 *   <li>{@code drugbox.scan.duration} timer, tag {@code source}</li>
 *   <li>{@code drugbox.region.decision} counter, tag {@code action}</li>
 *   <li>{@code drugbox.region.failure} counter, tag {@code kind}</li>
 *   <li>{@code drugbox.ocr.retry} counter</li>
 *   <li>{@code drugbox.match.confidence} summary</li>
 *   <li>{@code drugbox.recovery.attempt} counter, tag {@code method}</li>
 *   <li>{@code drugbox.cache.hit} and {@code drugbox.cache.miss} counters</li>
 *   <li>{@code drugbox.index.optimize} counter and {@code drugbox.index.duplicates.removed} summary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary duplicatesRemovedSummary;
    private final Counter retryCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter optimizeCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("drugbox.match.confidence")
                .description("Confidence of the best candidate per region")
                .register(registry);
        this.duplicatesRemovedSummary = DistributionSummary.builder("drugbox.index.duplicates.removed")
                .description("Near-duplicate images removed per index optimization")
                .register(registry);
        this.retryCounter = Counter.builder("drugbox.ocr.retry")
                .description("Text recognition retries")
                .register(registry);
        this.cacheHitCounter = Counter.builder("drugbox.cache.hit")
                .description("Match cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("drugbox.cache.miss")
                .description("Match cache misses")
                .register(registry);
        this.optimizeCounter = Counter.builder("drugbox.index.optimize")
                .description("Visual index optimizations run")
                .register(registry);
    }

    @Override
    public void recordScanDuration(ImageSource source, Duration duration) {
        timerCache.computeIfAbsent(source.name(), k ->
                Timer.builder("drugbox.scan.duration")
                        .description("Duration of a full image scan")
                        .tag("source", source.name())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementDecision(RecommendedAction action) {
        counter("drugbox.region.decision", "action", action.name(), "Region decisions by action").increment();
    }

    @Override
    public void incrementRegionFailure(FailureKind kind) {
        counter("drugbox.region.failure", "kind", kind.name(), "Contained per-region failures").increment();
    }

    @Override
    public void incrementOcrRetry() {
        retryCounter.increment();
    }

    @Override
    public void recordMatchConfidence(int confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementRecoveryAttempt(RecoveryMethod outcome) {
        counter("drugbox.recovery.attempt", "method", outcome.name(), "Text recovery attempts by outcome")
                .increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementIndexOptimize(int duplicatesRemoved) {
        optimizeCounter.increment();
        duplicatesRemovedSummary.record(duplicatesRemoved);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
