package com.drugbox.recognition.aggregate;

import com.drugbox.recognition.core.model.BoundingBox;
import com.drugbox.recognition.core.model.BoxCondition;
import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.MatchType;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RegionFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ResultAggregator aggregator = new ResultAggregator(Clock.fixed(NOW, ZoneOffset.UTC));

    private static RegionResult matched(int index, String drugId, int confidence, RecommendedAction action) {
        String regionId = "scan-r" + index;
        MatchType type = confidence == 100 ? MatchType.EXACT : MatchType.forConfidence(confidence);
        MatchCandidate candidate = new MatchCandidate(regionId, drugId, capitalize(drugId), confidence, type,
                null, false, false, null, false, "", 0);
        return RegionResult.builder()
                .regionId(regionId)
                .regionIndex(index)
                .box(new BoundingBox(index * 100, 0, 80, 120))
                .condition(BoxCondition.PERFECT)
                .candidates(List.of(candidate))
                .action(action)
                .build();
    }

    private static RegionResult rescan(int index, FailureKind... failures) {
        String regionId = "scan-r" + index;
        List<RegionFailure> list = new ArrayList<>();
        for (FailureKind kind : failures) {
            list.add(new RegionFailure(regionId, kind, kind.name()));
        }
        return RegionResult.builder()
                .regionId(regionId)
                .regionIndex(index)
                .box(new BoundingBox(index * 100, 0, 80, 120))
                .condition(BoxCondition.DAMAGED)
                .action(RecommendedAction.RESCAN)
                .failures(list)
                .build();
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private MultiDrugResult aggregate(List<RegionResult> completed, int detected) {
        return aggregator.aggregate("scan", "session", ImageSource.CAMERA, completed, detected,
                NOW.minusMillis(250));
    }

    @Nested
    @DisplayName("Duplicates")
    class Duplicates {

        @Test
        @DisplayName("Should let the more confident region represent a repeated drug")
        void keepsHigherConfidence() {
            MultiDrugResult result = aggregate(List.of(
                    matched(0, "paracetamol", 72, RecommendedAction.SHOW_OPTIONS),
                    matched(1, "paracetamol", 100, RecommendedAction.AUTO_SELECT)), 2);

            assertEquals(2, result.getRegions().size());
            assertEquals(List.of("scan-r1"),
                    result.getDetections().stream().map(RegionResult::getRegionId).toList());
            assertTrue(result.isDuplicate("scan-r0"));
            assertFalse(result.isDuplicate("scan-r1"));
            assertEquals(List.of(new DuplicateDetection("paracetamol", "Paracetamol", "scan-r1", "scan-r0", 100, 72)),
                    result.getDuplicates());
            assertEquals(1, result.getStatistics().duplicatesCollapsed());
            assertEquals(100.0, result.getAggregateConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Should keep the earlier region on equal confidence")
        void tieKeepsEarlier() {
            MultiDrugResult result = aggregate(List.of(
                    matched(1, "metformin", 90, RecommendedAction.AUTO_SELECT),
                    matched(0, "metformin", 90, RecommendedAction.AUTO_SELECT)), 2);

            assertEquals("scan-r0", result.getDetections().get(0).getRegionId());
            assertEquals("scan-r1", result.getDuplicates().get(0).duplicateRegionId());
        }

        @Test
        @DisplayName("Should return one result per surviving region with drug names deduplicated")
        void oneResultPerRegion() {
            MultiDrugResult result = aggregate(List.of(
                    matched(0, "paracetamol", 100, RecommendedAction.AUTO_SELECT),
                    matched(1, "paracetamol", 95, RecommendedAction.AUTO_SELECT),
                    matched(2, "ibuprofen", 90, RecommendedAction.AUTO_SELECT)), 4);

            assertEquals(3, result.getRegions().size());
            assertEquals(result.getStatistics().regionsCompleted(), result.getRegions().size());
            assertEquals(List.of("scan-r0", "scan-r1", "scan-r2"),
                    result.getRegions().stream().map(RegionResult::getRegionId).toList());
            assertEquals(List.of("Paracetamol", "Ibuprofen"), result.getDrugNames());
            assertEquals(2, result.getDetections().size());
            assertEquals(3, result.getStatistics().count(RecommendedAction.AUTO_SELECT));
            assertEquals((100 + 90) / 2.0, result.getAggregateConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Should point earlier duplicates at the region that displaced their keeper")
        void repointsDisplacedKeeper() {
            MultiDrugResult result = aggregate(List.of(
                    matched(0, "ibuprofen", 80, RecommendedAction.SHOW_OPTIONS),
                    matched(1, "ibuprofen", 70, RecommendedAction.SHOW_OPTIONS),
                    matched(2, "ibuprofen", 90, RecommendedAction.AUTO_SELECT)), 3);

            assertEquals(List.of(
                    new DuplicateDetection("ibuprofen", "Ibuprofen", "scan-r2", "scan-r1", 90, 70),
                    new DuplicateDetection("ibuprofen", "Ibuprofen", "scan-r2", "scan-r0", 90, 80)),
                    result.getDuplicates());
            assertTrue(result.getDuplicates().stream().allMatch(d -> d.keptRegionId().equals("scan-r2")));
            assertEquals(List.of("scan-r2"),
                    result.getDetections().stream().map(RegionResult::getRegionId).toList());
        }

        @Test
        @DisplayName("Should never collapse regions without a candidate")
        void rescansKept() {
            MultiDrugResult result = aggregate(List.of(rescan(0), rescan(1)), 2);

            assertEquals(2, result.getRegions().size());
            assertEquals(2, result.getDetections().size());
            assertTrue(result.getDuplicates().isEmpty());
            assertTrue(result.getDrugNames().isEmpty());
        }
    }

    @Test
    @DisplayName("Should return regions in detection order with distinct drug names")
    void ordering() {
        MultiDrugResult result = aggregate(List.of(
                matched(2, "ibuprofen", 80, RecommendedAction.SHOW_OPTIONS),
                rescan(1, FailureKind.TIMEOUT),
                matched(0, "amoxicillin", 95, RecommendedAction.AUTO_SELECT)), 3);

        assertEquals(List.of("scan-r0", "scan-r1", "scan-r2"),
                result.getRegions().stream().map(RegionResult::getRegionId).toList());
        assertEquals(List.of("Amoxicillin", "Ibuprofen"), result.getDrugNames());
        assertEquals((95 + 0 + 80) / 3.0, result.getAggregateConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Should count actions, failures and canceled regions")
    void statistics() {
        MultiDrugResult result = aggregate(List.of(
                matched(0, "amoxicillin", 95, RecommendedAction.AUTO_SELECT),
                rescan(1, FailureKind.TIMEOUT, FailureKind.INDEX_UNAVAILABLE),
                rescan(2, FailureKind.TIMEOUT)), 5);

        ScanStatistics stats = result.getStatistics();
        assertEquals(5, stats.regionsDetected());
        assertEquals(3, stats.regionsCompleted());
        assertEquals(2, stats.regionsCanceled());
        assertEquals(1, stats.count(RecommendedAction.AUTO_SELECT));
        assertEquals(2, stats.count(RecommendedAction.RESCAN));
        assertEquals(0, stats.count(RecommendedAction.MANUAL_ENTRY));
        assertEquals(2, stats.count(FailureKind.TIMEOUT));
        assertEquals(1, stats.count(FailureKind.INDEX_UNAVAILABLE));
    }

    @Test
    @DisplayName("Should take timing from the clock")
    void timing() {
        MultiDrugResult result = aggregate(List.of(), 0);

        assertEquals(NOW, result.getCompletedAt());
        assertEquals(Duration.ofMillis(250), result.getProcessingDuration());
        assertEquals(0.0, result.getAggregateConfidence());
        assertEquals("scan", result.getScanId());
        assertEquals("session", result.getSessionId());
        assertEquals(ImageSource.CAMERA, result.getSource());
    }

    @Test
    @DisplayName("Should report zero duration when the start is after the clock")
    void clockSkew() {
        MultiDrugResult result = aggregator.aggregate("scan", null, ImageSource.GALLERY, List.of(), 0,
                NOW.plusSeconds(1));

        assertEquals(Duration.ZERO, result.getProcessingDuration());
    }

    @Test
    @DisplayName("Should refuse candidates of another region")
    void foreignCandidate() {
        MatchCandidate foreign = new MatchCandidate("other", "x", "X", 70, MatchType.MEDIUM,
                null, false, false, null, false, "", 0);

        assertThrows(IllegalArgumentException.class, () -> RegionResult.builder()
                .regionId("scan-r0").box(new BoundingBox(0, 0, 1, 1)).condition(BoxCondition.PERFECT)
                .candidates(List.of(foreign)).action(RecommendedAction.SHOW_OPTIONS).build());
        assertThrows(IllegalArgumentException.class, () -> RegionResult.builder()
                .regionId("scan-r0").box(new BoundingBox(0, 0, 1, 1)).condition(BoxCondition.PERFECT)
                .action(RecommendedAction.AUTO_SELECT).build());
    }
}
