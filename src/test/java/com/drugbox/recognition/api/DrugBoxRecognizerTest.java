package com.drugbox.recognition.api;

import com.drugbox.recognition.aggregate.MultiDrugResult;
import com.drugbox.recognition.aggregate.RegionResult;
import com.drugbox.recognition.audit.AuditAction;
import com.drugbox.recognition.catalog.CatalogLoader;
import com.drugbox.recognition.catalog.InMemoryDrugCatalog;
import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RegionFailure;
import com.drugbox.recognition.correction.CorrectionKind;
import com.drugbox.recognition.correction.CorrectionRecord;
import com.drugbox.recognition.correction.CorrectionStatus;
import com.drugbox.recognition.detection.DetectionFailureException;
import com.drugbox.recognition.feature.OptimizationResult;
import com.drugbox.recognition.image.TestImages;
import com.drugbox.recognition.metrics.MicrometerMetricsService;
import com.drugbox.recognition.ocr.RecognizedText;
import com.drugbox.recognition.ocr.RetryConfig;
import com.drugbox.recognition.ocr.TextRecognitionService;
import com.drugbox.recognition.rules.DrugNameNormalizationRules;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DrugBoxRecognizerTest {

    private static final List<Color> BOX_COLOURS = List.of(TestImages.RED, TestImages.BLUE, TestImages.GREEN);

    /**
     * Reads a box by its colour, standing in for a real OCR engine.
     */
    static final class ColourOcr implements TextRecognitionService {
        private final Map<Color, String> texts = new ConcurrentHashMap<>();
        private final Map<Color, Duration> delays = new ConcurrentHashMap<>();
        private final CountDownLatch firstRead = new CountDownLatch(1);

        ColourOcr reads(Color colour, String text) {
            texts.put(colour, text);
            return this;
        }

        ColourOcr slow(Color colour, Duration delay) {
            delays.put(colour, delay);
            return this;
        }

        @Override
        public RecognizedText recognize(BufferedImage crop) {
            Color colour = TestImages.dominant(crop, BOX_COLOURS);
            Duration delay = colour != null ? delays.get(colour) : null;
            if (delay != null) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            } else {
                firstRead.countDown();
            }
            String text = colour != null ? texts.get(colour) : null;
            return new RecognizedText(text != null ? text : "x#q !!", 0.9);
        }
    }

    private InMemoryDrugCatalog catalog;
    private ColourOcr ocr;
    private SimpleMeterRegistry registry;
    private DrugBoxRecognizer recognizer;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryDrugCatalog(DrugNameNormalizationRules.createDefaultEngine(),
                new CatalogLoader().loadResource("catalog/drugs.json"));
        ocr = new ColourOcr()
                .reads(TestImages.RED, "PAROL 500 mg Tablet")
                .reads(TestImages.BLUE, "Glucophage 850 mg")
                .reads(TestImages.GREEN, "Glucofaj 850 mg");
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (recognizer != null) {
            recognizer.close();
        }
    }

    private DrugBoxRecognizer recognizer(RecognitionOptions options) {
        recognizer = DrugBoxRecognizer.builder()
                .catalog(catalog)
                .textRecognitionService(ocr)
                .options(options)
                .metricsService(new MicrometerMetricsService(registry))
                .build();
        return recognizer;
    }

    private DrugBoxRecognizer recognizer() {
        return recognizer(RecognitionOptions.builder().workerThreads(2).build());
    }

    private static List<String> bestIds(MultiDrugResult result) {
        return result.getDetections().stream()
                .map(r -> r.getBestCandidate().map(MatchCandidate::drugId).orElse("-"))
                .toList();
    }

    @Nested
    @DisplayName("Scanning")
    class Scanning {

        @Test
        @DisplayName("Should auto-select two clearly printed boxes in reading order")
        void twoDrugs() {
            MultiDrugResult result = recognizer().process(TestImages.twoBoxes(TestImages.RED, TestImages.BLUE));

            assertEquals(List.of("paracetamol", "metformin"), bestIds(result));
            assertEquals(List.of("Paracetamol", "Metformin"), result.getDrugNames());
            for (RegionResult region : result.getRegions()) {
                assertEquals(RecommendedAction.AUTO_SELECT, region.getAction());
                assertEquals(100, region.getConfidence());
                assertTrue(region.getRegionId().startsWith(result.getScanId()));
            }
            assertEquals(100.0, result.getAggregateConfidence(), 1e-9);
            assertEquals(ImageSource.CAMERA, result.getSource());
            assertTrue(result.getDuplicates().isEmpty());
        }

        @Test
        @DisplayName("Should fail only the region whose read timed out")
        void regionTimeout() {
            ocr.slow(TestImages.GREEN, Duration.ofSeconds(2));
            MultiDrugResult result = recognizer(RecognitionOptions.builder()
                    .workerThreads(2)
                    .externalCallTimeout(Duration.ofMillis(200))
                    .retryConfig(RetryConfig.noRetry())
                    .build())
                    .process(TestImages.twoBoxes(TestImages.RED, TestImages.GREEN));

            assertEquals(2, result.getRegions().size());
            RegionResult ok = result.getRegions().get(0);
            RegionResult failed = result.getRegions().get(1);
            assertEquals(RecommendedAction.AUTO_SELECT, ok.getAction());
            assertTrue(ok.getFailures().isEmpty());
            assertEquals(RecommendedAction.RESCAN, failed.getAction());
            assertEquals(List.of(FailureKind.TIMEOUT),
                    failed.getFailures().stream().map(RegionFailure::kind).toList());
            assertEquals(1, result.getStatistics().count(FailureKind.TIMEOUT));
            assertEquals(1, recognizer.getAuditService().getEntriesByAction(AuditAction.REGION_FAILED).size());
        }

        @Test
        @DisplayName("Should report the same drug twice as one detection and a duplicate")
        void duplicateBoxes() {
            MultiDrugResult result = recognizer().process(TestImages.twoBoxes(TestImages.RED, TestImages.RED));

            assertEquals(List.of("paracetamol"), bestIds(result));
            assertEquals(2, result.getRegions().size());
            assertEquals(List.of("Paracetamol"), result.getDrugNames());
            assertEquals(1, result.getDuplicates().size());
            assertEquals(result.getDetections().get(0).getRegionId(), result.getDuplicates().get(0).keptRegionId());
            assertEquals(2, result.getStatistics().regionsCompleted());
            assertEquals(1, recognizer.getAuditService()
                    .getEntriesByAction(AuditAction.DUPLICATE_COLLAPSED).size());
        }

        @Test
        @DisplayName("Should ask for a rescan when no box is readable")
        void unreadable() {
            MultiDrugResult result = recognizer().process(TestImages.blank(320, 240));

            assertEquals(1, result.getRegions().size());
            assertEquals(RecommendedAction.RESCAN, result.getRegions().get(0).getAction());
            assertTrue(result.getDrugNames().isEmpty());
            assertEquals(0.0, result.getAggregateConfidence());
        }

        @Test
        @DisplayName("Should give the same answer for the same image twice")
        void idempotent() {
            DrugBoxRecognizer r = recognizer();
            BufferedImage image = TestImages.twoBoxes(TestImages.RED, TestImages.BLUE);

            MultiDrugResult first = r.process(image);
            MultiDrugResult second = r.process(image);

            assertNotEquals(first.getScanId(), second.getScanId());
            assertEquals(bestIds(first), bestIds(second));
            assertEquals(first.getRegions().stream().map(RegionResult::getAction).toList(),
                    second.getRegions().stream().map(RegionResult::getAction).toList());
            assertEquals(first.getRegions().stream().map(RegionResult::getBox).toList(),
                    second.getRegions().stream().map(RegionResult::getBox).toList());
            assertEquals(first.getAggregateConfidence(), second.getAggregateConfidence());
        }

        @Test
        @DisplayName("Should reject an unusable image")
        void nullImage() {
            DrugBoxRecognizer r = recognizer();

            assertThrows(DetectionFailureException.class, () -> r.process(null));
        }

        @Test
        @DisplayName("Should audit and time scans")
        void observability() {
            DrugBoxRecognizer r = recognizer();
            MultiDrugResult result = r.process(TestImages.oneBox(TestImages.BLUE));

            assertEquals(1, r.getAuditService().getEntriesByAction(AuditAction.SCAN_STARTED).size());
            assertEquals(1, r.getAuditService().getEntriesForSubject(result.getScanId()).stream()
                    .filter(e -> e.action() == AuditAction.SCAN_COMPLETED).count());
            assertEquals(1, registry.get("drugbox.scan.duration").tag("source", "CAMERA").timer().count());
            assertEquals(1.0, registry.get("drugbox.region.decision").tag("action", "AUTO_SELECT")
                    .counter().count());
        }
    }

    @Nested
    @DisplayName("Corrections")
    class Corrections {

        @Test
        @DisplayName("Should teach the catalog an unfamiliar brand through a name edit")
        void nameEditRoundTrip() {
            DrugBoxRecognizer r = recognizer();
            BufferedImage image = TestImages.oneBox(TestImages.GREEN);

            MultiDrugResult before = r.process(image);
            RegionResult region = before.getRegions().get(0);
            assertNotEquals(RecommendedAction.AUTO_SELECT, region.getAction());

            CorrectionRecord record = r.applyCorrection(region.getRegionId(), "Metformin", CorrectionKind.NAME_EDIT);
            assertTrue(r.awaitCorrections(Duration.ofSeconds(5)));
            assertEquals(CorrectionStatus.DISPATCHED, r.getCorrectionQueue().status(record.id()).orElseThrow());
            assertEquals("Glucofaj 850 mg", record.originalText());
            assertFalse(record.features().isEmpty());

            MultiDrugResult after = r.process(image);
            RegionResult rescanned = after.getRegions().get(0);
            assertEquals("metformin", rescanned.getBestCandidate().orElseThrow().drugId());
            assertEquals(RecommendedAction.AUTO_SELECT, rescanned.getAction());
            assertTrue(rescanned.getConfidence() >= region.getConfidence());
        }

        @Test
        @DisplayName("Should commit corrected visual features on index optimization")
        void optimizeAfterCorrection() {
            DrugBoxRecognizer r = recognizer();
            MultiDrugResult result = r.process(TestImages.oneBox(TestImages.BLUE));

            r.applyCorrection(result.getRegions().get(0).getRegionId(), "Metformin", CorrectionKind.VERIFIED);
            assertTrue(r.awaitCorrections(Duration.ofSeconds(5)));
            OptimizationResult optimized = r.optimizeIndex();

            assertEquals(1, optimized.vectorsUpdated());
            assertEquals(1, optimized.imagesRetained());
            assertEquals(1, r.getAuditService().getEntriesByAction(AuditAction.INDEX_OPTIMIZED).size());

            RegionResult again = r.process(TestImages.oneBox(TestImages.BLUE)).getRegions().get(0);
            assertFalse(again.getVisualMatches().isEmpty());
            assertTrue(again.getBestCandidate().orElseThrow().visualConfirmed());
        }

        @Test
        @DisplayName("Should refuse to correct an unknown region")
        void unknownRegion() {
            DrugBoxRecognizer r = recognizer();

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> r.applyCorrection("nope-r0", "Parol", CorrectionKind.NAME_EDIT));
            assertTrue(e.getMessage().contains("nope-r0"));
        }

        @Test
        @DisplayName("Should require a name for a name edit")
        void blankName() {
            DrugBoxRecognizer r = recognizer();
            String regionId = r.process(TestImages.oneBox(TestImages.RED)).getRegions().get(0).getRegionId();

            assertThrows(IllegalArgumentException.class,
                    () -> r.applyCorrection(regionId, " ", CorrectionKind.NAME_EDIT));
            assertNotNull(r.applyCorrection(regionId, null, CorrectionKind.REJECTED));
        }
    }

    @Nested
    @DisplayName("Sessions")
    class Sessions {

        @Test
        @DisplayName("Should keep the history of a session's scans")
        void history() {
            DrugBoxRecognizer r = recognizer();
            ScanSession session = ScanSession.create(ImageSource.GALLERY);

            MultiDrugResult first = r.process(TestImages.oneBox(TestImages.RED), session);
            MultiDrugResult second = r.process(TestImages.oneBox(TestImages.BLUE), session);

            assertEquals(List.of(first, second), session.getHistory());
            assertSame(second, session.getLastResult().orElseThrow());
            assertEquals(session.getSessionId(), second.getSessionId());
            assertEquals(ImageSource.GALLERY, second.getSource());
            assertFalse(session.isScanning());
            assertFalse(session.requestRescan());
        }

        @Test
        @DisplayName("Should drop regions still in flight on a rescan request")
        void rescanCancels() throws InterruptedException {
            ocr.slow(TestImages.BLUE, Duration.ofSeconds(2));
            DrugBoxRecognizer r = recognizer();
            ScanSession session = ScanSession.create(ImageSource.CAMERA);

            Thread canceller = new Thread(() -> {
                try {
                    if (ocr.firstRead.await(5, TimeUnit.SECONDS)) {
                        Thread.sleep(300);
                        session.requestRescan();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            canceller.start();
            MultiDrugResult result = r.process(TestImages.twoBoxes(TestImages.RED, TestImages.BLUE), session);
            canceller.join();

            assertFalse(result.getDrugNames().contains("Metformin"));
            assertTrue(result.getStatistics().regionsCanceled() >= 1);
            assertEquals(1, r.getAuditService().getEntriesByAction(AuditAction.SCAN_CANCELED).size());
            assertFalse(session.isScanning());
        }
    }
}
