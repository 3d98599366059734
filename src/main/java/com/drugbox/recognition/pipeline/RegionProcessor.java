package com.drugbox.recognition.pipeline;

import com.drugbox.recognition.aggregate.RegionResult;
import com.drugbox.recognition.core.model.ExtractedText;
import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.RecoveredText;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.core.model.RegionFailure;
import com.drugbox.recognition.decision.DecisionEngine;
import com.drugbox.recognition.feature.FeatureIndex;
import com.drugbox.recognition.feature.VisualLookup;
import com.drugbox.recognition.logging.LogContext;
import com.drugbox.recognition.matching.MatchEngine;
import com.drugbox.recognition.metrics.MetricsService;
import com.drugbox.recognition.ocr.ExtractionFailureException;
import com.drugbox.recognition.ocr.TextExtractor;
import com.drugbox.recognition.recovery.RecoveryEngine;
import com.drugbox.recognition.tracing.ScanTracer;
import com.drugbox.recognition.tracing.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs one region through features, text extraction, recovery, matching and decision.
 * Per-region failures are recorded on the result rather than thrown.
 */
public class RegionProcessor {
    private static final Logger log = LoggerFactory.getLogger(RegionProcessor.class);

    private final TextExtractor textExtractor;
    private final RecoveryEngine recoveryEngine;
    private final FeatureIndex featureIndex;
    private final MatchEngine matchEngine;
    private final DecisionEngine decisionEngine;
    private final MetricsService metrics;
    private final ScanTracer tracer;

    public RegionProcessor(TextExtractor textExtractor, RecoveryEngine recoveryEngine, FeatureIndex featureIndex,
                           MatchEngine matchEngine, DecisionEngine decisionEngine, MetricsService metrics,
                           ScanTracer tracer) {
        this.textExtractor = textExtractor;
        this.recoveryEngine = recoveryEngine;
        this.featureIndex = featureIndex;
        this.matchEngine = matchEngine;
        this.decisionEngine = decisionEngine;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    public ProcessedRegion process(Region region, String scanId) {
        try (LogContext ctx = LogContext.forRegion(scanId, region.id());
             TraceSpan span = tracer.startRegion(scanId, region.id())) {
            List<RegionFailure> failures = new ArrayList<>();

            List<FeatureVector> features = extractFeatures(region);
            VisualLookup visual = featureIndex.query(features);
            if (!visual.available()) {
                failures.add(new RegionFailure(region.id(), FailureKind.INDEX_UNAVAILABLE, visual.reason()));
                metrics.incrementRegionFailure(FailureKind.INDEX_UNAVAILABLE);
            }

            ExtractedText extracted;
            try {
                extracted = textExtractor.extract(region);
            } catch (ExtractionFailureException e) {
                failures.add(new RegionFailure(region.id(), e.getKind(), e.getMessage()));
                metrics.incrementRegionFailure(e.getKind());
                span.fail(e);
                RegionResult result = decisionEngine.decide(region, "", null, List.of(), visual, failures);
                record(result);
                return new ProcessedRegion(scanId, result, "", features);
            }

            RecoveredText recovered = recoveryEngine.recover(extracted, region, visual);
            if (recovered.attempted()) {
                metrics.incrementRecoveryAttempt(recovered.method());
                if (!recovered.recovered()) {
                    failures.add(new RegionFailure(region.id(), FailureKind.RECOVERY,
                            "No reconstruction for damaged text"));
                    metrics.incrementRegionFailure(FailureKind.RECOVERY);
                }
            }

            List<MatchCandidate> candidates = matchEngine.match(region.id(), recovered.text());
            if (recovered.recovered()) {
                candidates = MatchEngine.discount(candidates, recovered.confidence());
            }

            RegionResult result = decisionEngine.decide(region, extracted.text(), recovered, candidates,
                    visual, failures);
            span.attribute("action", result.getAction().name()).attribute("confidence", result.getConfidence());
            record(result);
            log.info("region.processed action={} best='{}' confidence={} failures={}",
                    result.getAction(), result.getBestCandidate().map(MatchCandidate::drugName).orElse(""),
                    result.getConfidence(), failures.size());
            return new ProcessedRegion(scanId, result, recovered.text(), features);
        }
    }

    /**
     * Result for a region whose work failed or overran as a whole.
     */
    public ProcessedRegion failed(Region region, String scanId, Throwable cause) {
        FailureKind kind = cause instanceof TimeoutException ? FailureKind.TIMEOUT : FailureKind.EXTRACTION;
        RegionFailure failure = new RegionFailure(region.id(), kind, String.valueOf(cause.getMessage()));
        metrics.incrementRegionFailure(kind);
        RegionResult result = decisionEngine.decide(region, "", null, List.of(), VisualLookup.skipped(),
                List.of(failure));
        record(result);
        return new ProcessedRegion(scanId, result, "", List.of());
    }

    private List<FeatureVector> extractFeatures(Region region) {
        try {
            return featureIndex.extract(region.crop());
        } catch (RuntimeException e) {
            log.warn("region.features.failed regionId={} error={}", region.id(), e.getMessage());
            return List.of();
        }
    }

    private void record(RegionResult result) {
        metrics.incrementDecision(result.getAction());
        if (!result.getCandidates().isEmpty()) {
            metrics.recordMatchConfidence(result.getConfidence());
        }
    }
}
