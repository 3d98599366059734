package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.correction.CorrectionConsumer;
import com.drugbox.recognition.correction.CorrectionKind;
import com.drugbox.recognition.correction.CorrectionRecord;
import com.drugbox.recognition.logging.LogContext;
import com.drugbox.recognition.metrics.MetricsService;
import com.drugbox.recognition.tracing.ScanTracer;
import com.drugbox.recognition.tracing.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Visual side of recognition: extracts features from crops, queries the store for
 * similar reference images and maintains the store.
 *
 * <p>Store reads share a read lock held for as long as the store call runs, including a
 * call whose caller already gave up on it; {@link #optimize()} takes the write lock, so a
 * query sees the store either entirely before or entirely after an optimization. Corrections do not
 * touch the store directly: their vectors are staged and committed by the next
 * optimization.</p>
 */
public class FeatureIndex implements CorrectionConsumer {
    private static final Logger log = LoggerFactory.getLogger(FeatureIndex.class);

    public static final double DEFAULT_DUPLICATE_THRESHOLD = 0.95;

    private final VisualCatalogStore store;
    private final VisualFeatureExtractor extractor;
    private final double similarityFloor;
    private final int neighbours;
    private final Duration callTimeout;
    private final ExecutorService callExecutor;
    private final MetricsService metrics;
    private final ScanTracer tracer;
    private final double duplicateThreshold;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Queue<StoredImage> staged = new ConcurrentLinkedQueue<>();

    public FeatureIndex(VisualCatalogStore store, VisualFeatureExtractor extractor, double similarityFloor,
                        int neighbours, Duration callTimeout, ExecutorService callExecutor,
                        MetricsService metrics, ScanTracer tracer) {
        this(store, extractor, similarityFloor, neighbours, callTimeout, callExecutor, metrics, tracer,
                DEFAULT_DUPLICATE_THRESHOLD);
    }

    public FeatureIndex(VisualCatalogStore store, VisualFeatureExtractor extractor, double similarityFloor,
                        int neighbours, Duration callTimeout, ExecutorService callExecutor,
                        MetricsService metrics, ScanTracer tracer, double duplicateThreshold) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        if (similarityFloor < 0.0 || similarityFloor > 1.0) {
            throw new IllegalArgumentException("similarityFloor must be between 0.0 and 1.0");
        }
        if (neighbours <= 0) {
            throw new IllegalArgumentException("neighbours must be > 0");
        }
        this.similarityFloor = similarityFloor;
        this.neighbours = neighbours;
        this.callTimeout = callTimeout;
        this.callExecutor = callExecutor;
        this.metrics = metrics;
        this.tracer = tracer;
        this.duplicateThreshold = duplicateThreshold;
    }

    public List<FeatureVector> extract(BufferedImage crop) {
        return extractor.extract(crop);
    }

    /**
     * Reference images at or above the similarity floor, best first.
     * Never throws: an unreachable or slow store yields {@link VisualLookup#unavailable}.
     */
    public VisualLookup query(List<FeatureVector> features) {
        if (features.isEmpty()) {
            return VisualLookup.skipped();
        }
        try {
            List<VisualMatch> nearest = callStore(features);
            List<VisualMatch> accepted = new ArrayList<>();
            for (VisualMatch m : nearest) {
                if (m.similarity() >= similarityFloor) {
                    accepted.add(m);
                }
            }
            return VisualLookup.of(accepted);
        } catch (IndexUnavailableException e) {
            log.warn("visual.index.unavailable error={}", e.getMessage());
            return VisualLookup.unavailable(e.getMessage());
        }
    }

    /**
     * Queues reference vectors for a drug; written by the next {@link #optimize()}.
     */
    public void stage(String drugName, List<FeatureVector> features) {
        if (features.isEmpty()) {
            return;
        }
        staged.add(new StoredImage(LogContext.generateId(), drugName, features));
    }

    public int stagedCount() {
        return staged.size();
    }

    /**
     * Commits staged vectors and removes near-duplicates, excluding all queries meanwhile.
     */
    public OptimizationResult optimize() {
        String operationId = LogContext.generateId();
        try (LogContext ctx = LogContext.forOptimize(operationId);
             TraceSpan span = tracer.startOptimize(operationId)) {
            lock.writeLock().lock();
            try {
                int updated = 0;
                StoredImage next;
                while ((next = staged.poll()) != null) {
                    store.upsert(next);
                    updated++;
                }
                int removed = store.removeDuplicates(duplicateThreshold);
                OptimizationResult result = new OptimizationResult(removed, updated, store.size());
                span.attribute("duplicatesRemoved", removed).attribute("vectorsUpdated", updated);
                metrics.incrementIndexOptimize(removed);
                log.info("visual.index.optimized duplicatesRemoved={} vectorsUpdated={} imagesRetained={}",
                        removed, updated, result.imagesRetained());
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    @Override
    public void accept(CorrectionRecord record) {
        if (record.kind() == CorrectionKind.REJECTED || record.features().isEmpty()) {
            return;
        }
        stage(record.correctedName().trim(), record.features());
        log.debug("visual.index.staged correctionId={} drug='{}'", record.id(), record.correctedName());
    }

    /**
     * Runs on the call executor and holds the read lock until the store returns, so a call
     * abandoned by its caller after a timeout still keeps {@link #optimize()} out.
     */
    private List<VisualMatch> readStore(List<FeatureVector> features) {
        lock.readLock().lock();
        try {
            return store.nearest(features, neighbours);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<VisualMatch> callStore(List<FeatureVector> features) {
        CompletableFuture<List<VisualMatch>> future = CompletableFuture
                .supplyAsync(() -> readStore(features), callExecutor)
                .orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                future.cancel(true);
                throw new IndexUnavailableException("Visual store did not answer within "
                        + callTimeout.toMillis() + " ms", cause);
            }
            if (cause instanceof IndexUnavailableException iue) {
                throw iue;
            }
            throw new IndexUnavailableException(String.valueOf(cause != null ? cause.getMessage() : e.getMessage()),
                    cause);
        }
    }
}
