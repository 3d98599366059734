package com.drugbox.recognition.pipeline;

import com.drugbox.recognition.aggregate.RegionResult;
import com.drugbox.recognition.catalog.CatalogLoader;
import com.drugbox.recognition.catalog.InMemoryDrugCatalog;
import com.drugbox.recognition.core.model.BoundingBox;
import com.drugbox.recognition.core.model.BoxAngle;
import com.drugbox.recognition.core.model.BoxCondition;
import com.drugbox.recognition.core.model.BoxLighting;
import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.MatchType;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RecoveryMethod;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.core.model.RegionFailure;
import com.drugbox.recognition.decision.DecisionEngine;
import com.drugbox.recognition.decision.DecisionThresholds;
import com.drugbox.recognition.feature.FeatureIndex;
import com.drugbox.recognition.feature.FeatureSimilarity;
import com.drugbox.recognition.feature.FeatureWeights;
import com.drugbox.recognition.feature.IndexUnavailableException;
import com.drugbox.recognition.feature.InMemoryVisualCatalogStore;
import com.drugbox.recognition.feature.VisualCatalogStore;
import com.drugbox.recognition.feature.VisualFeatureExtractor;
import com.drugbox.recognition.image.TestImages;
import com.drugbox.recognition.matching.CategoryThresholds;
import com.drugbox.recognition.matching.MatchEngine;
import com.drugbox.recognition.metrics.MicrometerMetricsService;
import com.drugbox.recognition.ocr.RecognizedText;
import com.drugbox.recognition.ocr.RetryConfig;
import com.drugbox.recognition.ocr.TextExtractor;
import com.drugbox.recognition.ocr.TextQualityScorer;
import com.drugbox.recognition.ocr.TextRecognitionException;
import com.drugbox.recognition.ocr.TextRecognitionService;
import com.drugbox.recognition.recovery.RecoveryEngine;
import com.drugbox.recognition.recovery.RecoveryOptions;
import com.drugbox.recognition.rules.DrugNameNormalizationRules;
import com.drugbox.recognition.rules.NormalizationEngine;
import com.drugbox.recognition.tracing.NoOpScanTracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegionProcessorTest {

    @Mock
    private TextRecognitionService ocr;
    @Mock
    private VisualCatalogStore brokenStore;

    private ExecutorService io;
    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;
    private NormalizationEngine normalizer;
    private InMemoryDrugCatalog catalog;

    @BeforeEach
    void setUp() {
        io = Executors.newFixedThreadPool(2);
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
        normalizer = DrugNameNormalizationRules.createDefaultEngine();
        catalog = new InMemoryDrugCatalog(normalizer, new CatalogLoader().loadResource("catalog/drugs.json"));
    }

    @AfterEach
    void tearDown() {
        io.shutdownNow();
    }

    private RegionProcessor processor(VisualCatalogStore store) {
        FeatureIndex index = new FeatureIndex(store, new VisualFeatureExtractor(), 0.75, 10,
                Duration.ofSeconds(2), io, metrics, new NoOpScanTracer());
        TextExtractor extractor = new TextExtractor(ocr, RetryConfig.noRetry(), Duration.ofSeconds(2),
                new TextQualityScorer(), io, metrics);
        return new RegionProcessor(extractor,
                new RecoveryEngine(catalog, normalizer, RecoveryOptions.defaults()),
                index,
                new MatchEngine(catalog, normalizer, CategoryThresholds.defaults()),
                new DecisionEngine(DecisionThresholds.defaults(), normalizer),
                metrics, new NoOpScanTracer());
    }

    private RegionProcessor processor() {
        return processor(new InMemoryVisualCatalogStore(new FeatureSimilarity(FeatureWeights.defaults())));
    }

    private static Region region(BoxCondition condition) {
        return new Region("scan-r0", 0, new BoundingBox(0, 0, 640, 480), TestImages.oneBox(TestImages.RED), 0.9,
                condition, BoxAngle.FRONT, BoxLighting.NORMAL, false);
    }

    private static List<FailureKind> kinds(RegionResult result) {
        return result.getFailures().stream().map(RegionFailure::kind).toList();
    }

    @Test
    @DisplayName("Should auto-select a clearly printed brand")
    void clearBrand() {
        when(ocr.recognize(any())).thenReturn(new RecognizedText("PAROL 500 mg Tablet", 0.95));

        ProcessedRegion processed = processor().process(region(BoxCondition.PERFECT), "scan");

        RegionResult result = processed.result();
        assertEquals(RecommendedAction.AUTO_SELECT, result.getAction());
        assertEquals("paracetamol", result.getBestCandidate().orElseThrow().drugId());
        assertEquals(100, result.getConfidence());
        assertTrue(result.getFailures().isEmpty());
        assertEquals("PAROL 500 mg Tablet", processed.matchedText());
        assertFalse(processed.features().isEmpty());
        assertEquals("scan", processed.scanId());
        assertEquals(1.0, registry.get("drugbox.region.decision").tag("action", "AUTO_SELECT").counter().count());
    }

    @Test
    @DisplayName("Should recover text on a damaged box and discount its match")
    void recoveredText() {
        when(ocr.recognize(any())).thenReturn(RecognizedText.of("Amoxicilln 500 mg"));

        ProcessedRegion processed = processor().process(region(BoxCondition.DAMAGED), "scan");

        RegionResult result = processed.result();
        MatchCandidate best = result.getBestCandidate().orElseThrow();
        assertEquals("amoxicillin", best.drugId());
        assertEquals(91, best.confidence());
        assertEquals(MatchType.HIGH, best.matchType());
        assertEquals(RecoveryMethod.DICTIONARY_COMPLETION, result.getRecoveredText().orElseThrow().method());
        assertEquals("Amoxicilln 500 mg", result.getExtractedText());
        assertEquals("Amoxicillin", processed.matchedText());
        assertEquals(1.0, registry.get("drugbox.recovery.attempt")
                .tag("method", "DICTIONARY_COMPLETION").counter().count());
    }

    @Test
    @DisplayName("Should ask for a rescan on unrecoverable noise")
    void noise() {
        when(ocr.recognize(any())).thenReturn(RecognizedText.of("x#q !!"));

        RegionResult result = processor().process(region(BoxCondition.PERFECT), "scan").result();

        assertEquals(RecommendedAction.RESCAN, result.getAction());
        assertEquals(List.of(FailureKind.RECOVERY), kinds(result));
        assertTrue(result.getRecoveredText().orElseThrow().lowQuality());
    }

    @Test
    @DisplayName("Should contain failed extraction in the region result")
    void extractionFailure() {
        when(ocr.recognize(any())).thenThrow(
                new TextRecognitionException(TextRecognitionException.Kind.INVALID_INPUT, "blank"));

        RegionResult result = processor().process(region(BoxCondition.PERFECT), "scan").result();

        assertEquals(RecommendedAction.RESCAN, result.getAction());
        assertEquals(List.of(FailureKind.EXTRACTION), kinds(result));
        assertTrue(result.getRecoveredText().isEmpty());
        assertEquals("", result.getExtractedText());
        assertEquals(1.0, registry.get("drugbox.region.failure").tag("kind", "EXTRACTION").counter().count());
    }

    @Test
    @DisplayName("Should let text decide when the visual index is unavailable")
    void indexUnavailable() {
        when(brokenStore.nearest(any(), anyInt())).thenThrow(new IndexUnavailableException("store offline"));
        when(ocr.recognize(any())).thenReturn(new RecognizedText("PAROL 500 mg Tablet", 0.95));

        RegionResult result = processor(brokenStore).process(region(BoxCondition.PERFECT), "scan").result();

        assertEquals(RecommendedAction.AUTO_SELECT, result.getAction());
        assertFalse(result.isVisualIndexAvailable());
        assertEquals(List.of(FailureKind.INDEX_UNAVAILABLE), kinds(result));
    }

    @Test
    @DisplayName("Should turn a region that failed as a whole into a rescan")
    void failedRegion() {
        ProcessedRegion timedOut = processor().failed(region(BoxCondition.PERFECT), "scan",
                new TimeoutException());
        ProcessedRegion crashed = processor().failed(region(BoxCondition.PERFECT), "scan",
                new IllegalStateException("bug"));

        assertEquals(RecommendedAction.RESCAN, timedOut.result().getAction());
        assertEquals(List.of(FailureKind.TIMEOUT), kinds(timedOut.result()));
        assertEquals(List.of(FailureKind.EXTRACTION), kinds(crashed.result()));
        assertTrue(timedOut.features().isEmpty());
    }
}
