package com.drugbox.recognition.api;

import com.drugbox.recognition.aggregate.DuplicateDetection;
import com.drugbox.recognition.aggregate.MultiDrugResult;
import com.drugbox.recognition.aggregate.RegionResult;
import com.drugbox.recognition.aggregate.ResultAggregator;
import com.drugbox.recognition.audit.AuditAction;
import com.drugbox.recognition.audit.AuditService;
import com.drugbox.recognition.cache.CaffeineMatchCache;
import com.drugbox.recognition.cache.MatchCache;
import com.drugbox.recognition.cache.NoOpMatchCache;
import com.drugbox.recognition.catalog.DrugCatalog;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.core.model.RegionFailure;
import com.drugbox.recognition.correction.CorrectionConsumer;
import com.drugbox.recognition.correction.CorrectionKind;
import com.drugbox.recognition.correction.CorrectionQueue;
import com.drugbox.recognition.correction.CorrectionRecord;
import com.drugbox.recognition.correction.CorrectionService;
import com.drugbox.recognition.correction.InMemoryCorrectionQueue;
import com.drugbox.recognition.decision.DecisionEngine;
import com.drugbox.recognition.detection.ContrastRegionProposer;
import com.drugbox.recognition.detection.DetectionFailureException;
import com.drugbox.recognition.detection.RegionDetector;
import com.drugbox.recognition.detection.RegionProposer;
import com.drugbox.recognition.feature.FeatureIndex;
import com.drugbox.recognition.feature.FeatureSimilarity;
import com.drugbox.recognition.feature.InMemoryVisualCatalogStore;
import com.drugbox.recognition.feature.OptimizationResult;
import com.drugbox.recognition.feature.VisualCatalogStore;
import com.drugbox.recognition.feature.VisualFeatureExtractor;
import com.drugbox.recognition.logging.LogContext;
import com.drugbox.recognition.matching.MatchEngine;
import com.drugbox.recognition.metrics.MetricsService;
import com.drugbox.recognition.metrics.NoOpMetricsService;
import com.drugbox.recognition.ocr.TextExtractor;
import com.drugbox.recognition.ocr.TextQualityScorer;
import com.drugbox.recognition.ocr.TextRecognitionService;
import com.drugbox.recognition.pipeline.ProcessedRegion;
import com.drugbox.recognition.pipeline.RegionProcessor;
import com.drugbox.recognition.pipeline.ScanExecutor;
import com.drugbox.recognition.pipeline.ScanHandle;
import com.drugbox.recognition.recovery.RecoveryEngine;
import com.drugbox.recognition.rules.DrugNameNormalizationRules;
import com.drugbox.recognition.rules.NormalizationEngine;
import com.drugbox.recognition.tracing.NoOpScanTracer;
import com.drugbox.recognition.tracing.ScanTracer;
import com.drugbox.recognition.tracing.TraceSpan;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the library: detects every drug box in an image, reads and matches
 * each one, and returns a ranked, deduplicated result.
 *
 * <pre>
 * try (DrugBoxRecognizer recognizer = DrugBoxRecognizer.builder()
 *         .catalog(catalog)
 *         .textRecognitionService(ocr)
 *         .build()) {
 *     MultiDrugResult result = recognizer.process(image, session);
 * }
 * </pre>
 *
 * <p>{@link #process} may be called concurrently. Each call owns its regions; the
 * catalog, match cache and visual index are shared read-mostly.</p>
 */
public class DrugBoxRecognizer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DrugBoxRecognizer.class);

    private final RecognitionOptions options;
    private final RegionDetector detector;
    private final RegionProcessor regionProcessor;
    private final ScanExecutor scanExecutor;
    private final ExecutorService ioExecutor;
    private final FeatureIndex featureIndex;
    private final ResultAggregator aggregator;
    private final CorrectionService correctionService;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final ScanTracer tracer;
    private final MatchCache matchCache;
    private final Clock clock;
    private final Cache<String, ProcessedRegion> regionContext;

    private DrugBoxRecognizer(Builder builder) {
        this.options = builder.options;
        this.metrics = builder.metricsService;
        this.tracer = builder.tracer;
        this.auditService = builder.auditService;
        this.clock = builder.clock;

        NormalizationEngine normalizer = builder.normalizer;
        DrugCatalog catalog = builder.catalog;

        this.ioExecutor = ScanExecutor.newIoPool(options.getWorkerThreads() * 2);
        this.scanExecutor = new ScanExecutor(options.getWorkerThreads(), options.getRegionTimeout());
        this.detector = new RegionDetector(builder.regionProposer, options.getDetectionOptions());

        if (options.getCacheConfig().enabled()) {
            CaffeineMatchCache cache = new CaffeineMatchCache(options.getCacheConfig());
            catalog.addListener(cache);
            this.matchCache = cache;
        } else {
            this.matchCache = new NoOpMatchCache();
        }
        MatchEngine matchEngine = new MatchEngine(catalog, normalizer, options.getCategoryThresholds(),
                matchCache, metrics, options.getMaxCandidates());

        FeatureSimilarity similarity = new FeatureSimilarity(options.getFeatureWeights());
        VisualCatalogStore store = builder.visualStore != null
                ? builder.visualStore
                : new InMemoryVisualCatalogStore(similarity);
        this.featureIndex = new FeatureIndex(store, new VisualFeatureExtractor(),
                options.getVisualSimilarityFloor(), options.getVisualNeighbours(),
                options.getExternalCallTimeout(), ioExecutor, metrics, tracer);

        TextExtractor textExtractor = new TextExtractor(builder.textRecognitionService, options.getRetryConfig(),
                options.getExternalCallTimeout(), new TextQualityScorer(), ioExecutor, metrics);
        RecoveryEngine recoveryEngine = new RecoveryEngine(catalog, normalizer, options.getRecoveryOptions());
        DecisionEngine decisionEngine = new DecisionEngine(options.getDecisionThresholds(), normalizer);
        this.regionProcessor = new RegionProcessor(textExtractor, recoveryEngine, featureIndex, matchEngine,
                decisionEngine, metrics, tracer);
        this.aggregator = new ResultAggregator(clock);

        this.correctionService = new CorrectionService(builder.correctionQueue, auditService);
        if (catalog instanceof CorrectionConsumer catalogConsumer) {
            correctionService.addConsumer(catalogConsumer);
        }
        correctionService.addConsumer(featureIndex);
        for (CorrectionConsumer consumer : builder.correctionConsumers) {
            correctionService.addConsumer(consumer);
        }

        this.regionContext = Caffeine.newBuilder()
                .maximumSize(options.getCorrectionContextSize())
                .expireAfterWrite(1, TimeUnit.HOURS)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Processes an image in a throwaway session tagged with the configured source.
     */
    public MultiDrugResult process(BufferedImage image) {
        return process(image, null);
    }

    /**
     * Detects, reads, matches and ranks every box in the image.
     *
     * @param session caller-owned session, or null for a throwaway one
     * @throws DetectionFailureException if the image itself is unusable
     */
    public MultiDrugResult process(BufferedImage image, ScanSession session) {
        ScanSession scanSession = session != null ? session : ScanSession.create(options.getSourceTag());
        String scanId = LogContext.generateId();
        Instant startedAt = clock.instant();

        try (LogContext ctx = LogContext.forScan(scanId, scanSession.getSource().name());
             TraceSpan span = tracer.startScan(scanId, scanSession.getSource().name())) {
            log.info("scan.started sessionId={}", scanSession.getSessionId());
            auditService.record(AuditAction.SCAN_STARTED, scanId,
                    Map.of("sessionId", scanSession.getSessionId(), "source", scanSession.getSource().name()));

            List<Region> regions;
            try {
                regions = detector.detect(image, scanId);
            } catch (DetectionFailureException e) {
                span.fail(e);
                log.warn("scan.detection.failed error={}", e.getMessage());
                throw e;
            }
            span.attribute("regions", regions.size());

            ScanHandle handle = scanSession.begin(scanId);
            List<ProcessedRegion> processed;
            try {
                processed = scanExecutor.runAll(regions,
                        region -> regionProcessor.process(region, scanId),
                        (region, error) -> regionProcessor.failed(region, scanId, error),
                        handle);
            } finally {
                scanSession.end(handle);
            }

            List<RegionResult> completed = new ArrayList<>(processed.size());
            for (ProcessedRegion p : processed) {
                regionContext.put(p.result().getRegionId(), p);
                completed.add(p.result());
                auditFailures(p.result());
            }

            MultiDrugResult result = aggregator.aggregate(scanId, scanSession.getSessionId(),
                    scanSession.getSource(), completed, regions.size(), startedAt);
            for (DuplicateDetection duplicate : result.getDuplicates()) {
                auditService.record(AuditAction.DUPLICATE_COLLAPSED, duplicate.duplicateRegionId(),
                        Map.of("drugId", duplicate.drugId(), "keptRegionId", duplicate.keptRegionId()));
            }

            AuditAction outcome = handle.isCanceled() ? AuditAction.SCAN_CANCELED : AuditAction.SCAN_COMPLETED;
            auditService.record(outcome, scanId, Map.of(
                    "regions", result.getRegions().size(),
                    "drugs", result.getDrugNames().size(),
                    "canceled", result.getStatistics().regionsCanceled()));
            metrics.recordScanDuration(scanSession.getSource(), result.getProcessingDuration());
            scanSession.record(result);

            span.attribute("drugs", result.getDrugNames().size());
            log.info("scan.completed regions={} drugs={} duplicates={} canceled={} durationMs={}",
                    result.getRegions().size(), result.getDrugNames().size(), result.getDuplicates().size(),
                    result.getStatistics().regionsCanceled(), result.getProcessingDuration().toMillis());
            return result;
        }
    }

    /**
     * Forwards a user correction for a recently processed region to the catalog and
     * feature-store owners. Nothing in the current results changes; the next scan
     * sees the correction once the owners have absorbed it.
     *
     * @param correctedName required unless {@code kind} is {@link CorrectionKind#REJECTED}
     * @throws IllegalArgumentException if the region is unknown or no longer remembered
     */
    public CorrectionRecord applyCorrection(String regionId, String correctedName, CorrectionKind kind) {
        Objects.requireNonNull(regionId, "regionId is required");
        Objects.requireNonNull(kind, "kind is required");
        ProcessedRegion context = regionContext.getIfPresent(regionId);
        if (context == null) {
            throw new IllegalArgumentException("Unknown region: " + regionId);
        }
        RegionResult result = context.result();
        CorrectionRecord record = CorrectionRecord.builder()
                .scanId(context.scanId())
                .regionId(regionId)
                .originalText(context.matchedText())
                .originalDrugId(result.getBestCandidate().map(MatchCandidate::drugId).orElse(null))
                .correctedName(correctedName)
                .kind(kind)
                .features(context.features())
                .timestamp(clock.instant())
                .build();
        correctionService.submit(record);
        return record;
    }

    /**
     * Waits until every correction submitted so far has reached all consumers.
     *
     * @return false if the wait timed out
     */
    public boolean awaitCorrections(Duration timeout) {
        return correctionService.awaitDispatched(timeout);
    }

    /**
     * Commits staged visual corrections and removes near-duplicate images. Blocks
     * visual queries while it runs.
     */
    public OptimizationResult optimizeIndex() {
        OptimizationResult result = featureIndex.optimize();
        auditService.record(AuditAction.INDEX_OPTIMIZED, "visual-index", Map.of(
                "duplicatesRemoved", result.duplicatesRemoved(),
                "vectorsUpdated", result.vectorsUpdated(),
                "imagesRetained", result.imagesRetained()));
        return result;
    }

    public RecognitionOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public CorrectionQueue getCorrectionQueue() {
        return correctionService.getQueue();
    }

    public MatchCache getMatchCache() {
        return matchCache;
    }

    private void auditFailures(RegionResult result) {
        for (RegionFailure failure : result.getFailures()) {
            Map<String, Object> details = new HashMap<>();
            details.put("kind", failure.kind().name());
            details.put("message", failure.message());
            auditService.record(AuditAction.REGION_FAILED, result.getRegionId(), details);
        }
    }

    @Override
    public void close() {
        scanExecutor.close();
        correctionService.close();
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ioExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static class Builder {
        private DrugCatalog catalog;
        private TextRecognitionService textRecognitionService;
        private RegionProposer regionProposer = new ContrastRegionProposer();
        private VisualCatalogStore visualStore;
        private NormalizationEngine normalizer;
        private RecognitionOptions options = RecognitionOptions.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private ScanTracer tracer = new NoOpScanTracer();
        private AuditService auditService = new AuditService();
        private CorrectionQueue correctionQueue = new InMemoryCorrectionQueue();
        private final List<CorrectionConsumer> correctionConsumers = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        public Builder catalog(DrugCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder textRecognitionService(TextRecognitionService textRecognitionService) {
            this.textRecognitionService = textRecognitionService;
            return this;
        }

        public Builder regionProposer(RegionProposer regionProposer) {
            this.regionProposer = regionProposer;
            return this;
        }

        public Builder visualStore(VisualCatalogStore visualStore) {
            this.visualStore = visualStore;
            return this;
        }

        /**
         * Must apply the same rules the catalog normalizes its keys with.
         */
        public Builder normalizer(NormalizationEngine normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder options(RecognitionOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracer(ScanTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder correctionQueue(CorrectionQueue correctionQueue) {
            this.correctionQueue = correctionQueue;
            return this;
        }

        /**
         * Adds a consumer beyond the catalog and the visual index, which are registered
         * automatically.
         */
        public Builder addCorrectionConsumer(CorrectionConsumer consumer) {
            this.correctionConsumers.add(Objects.requireNonNull(consumer, "consumer is required"));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DrugBoxRecognizer build() {
            Objects.requireNonNull(catalog, "catalog is required");
            Objects.requireNonNull(textRecognitionService, "textRecognitionService is required");
            Objects.requireNonNull(regionProposer, "regionProposer is required");
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(metricsService, "metricsService is required");
            Objects.requireNonNull(tracer, "tracer is required");
            Objects.requireNonNull(auditService, "auditService is required");
            Objects.requireNonNull(correctionQueue, "correctionQueue is required");
            Objects.requireNonNull(clock, "clock is required");
            if (normalizer == null) {
                normalizer = DrugNameNormalizationRules.createDefaultEngine();
            }
            return new DrugBoxRecognizer(this);
        }
    }
}
