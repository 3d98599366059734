package com.drugbox.recognition.aggregate;

import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RegionFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds per-region results into one {@link MultiDrugResult}.
 *
 * <p>Every completed region keeps its result, in region order. Regions whose best candidate
 * is the same catalog entry form one detection, represented by the region with the higher
 * confidence; on equal confidence the earlier region represents it. The others are reported
 * as {@link DuplicateDetection}s and left out of the drug names and the aggregate
 * confidence. Regions without a candidate are never collapsed.</p>
 */
public class ResultAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final Clock clock;

    public ResultAggregator() {
        this(Clock.systemUTC());
    }

    public ResultAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param completed       finished regions, any order
     * @param regionsDetected regions the detector produced, canceled ones included
     * @param startedAt       when detection began
     */
    public MultiDrugResult aggregate(String scanId, String sessionId, ImageSource source,
                                     List<RegionResult> completed, int regionsDetected, Instant startedAt) {
        List<RegionResult> ordered = new ArrayList<>(completed);
        ordered.sort(Comparator.comparingInt(RegionResult::getRegionIndex));

        Map<String, RegionResult> byDrug = new LinkedHashMap<>();
        List<DuplicateDetection> duplicates = new ArrayList<>();
        for (RegionResult region : ordered) {
            MatchCandidate best = region.getBestCandidate().orElse(null);
            if (best == null) {
                continue;
            }
            RegionResult existing = byDrug.get(best.drugId());
            if (existing == null) {
                byDrug.put(best.drugId(), region);
            } else if (region.getConfidence() > existing.getConfidence()) {
                byDrug.put(best.drugId(), region);
                repointDuplicates(duplicates, existing, region);
                duplicates.add(new DuplicateDetection(best.drugId(), best.drugName(), region.getRegionId(),
                        existing.getRegionId(), region.getConfidence(), existing.getConfidence()));
            } else {
                duplicates.add(new DuplicateDetection(best.drugId(), best.drugName(), existing.getRegionId(),
                        region.getRegionId(), existing.getConfidence(), region.getConfidence()));
            }
        }
        Set<String> collapsed = new HashSet<>();
        for (DuplicateDetection d : duplicates) {
            collapsed.add(d.duplicateRegionId());
        }

        Set<String> drugNames = new LinkedHashSet<>();
        double confidenceSum = 0;
        int detections = 0;
        Map<RecommendedAction, Integer> actions = new EnumMap<>(RecommendedAction.class);
        Map<FailureKind, Integer> failures = new EnumMap<>(FailureKind.class);
        for (RegionResult region : ordered) {
            actions.merge(region.getAction(), 1, Integer::sum);
            for (RegionFailure f : region.getFailures()) {
                failures.merge(f.kind(), 1, Integer::sum);
            }
            if (!collapsed.contains(region.getRegionId())) {
                region.getBestCandidate().ifPresent(c -> drugNames.add(c.drugName()));
                confidenceSum += region.getConfidence();
                detections++;
            }
        }

        Instant now = clock.instant();
        Duration elapsed = Duration.between(startedAt, now);
        double aggregate = detections == 0 ? 0.0 : confidenceSum / detections;
        ScanStatistics stats = new ScanStatistics(regionsDetected, ordered.size(),
                Math.max(0, regionsDetected - ordered.size()), duplicates.size(), actions, failures);

        if (!duplicates.isEmpty()) {
            log.debug("aggregate.duplicates scanId={} collapsed={}", scanId, duplicates.size());
        }
        return MultiDrugResult.builder()
                .scanId(scanId)
                .sessionId(sessionId)
                .source(source)
                .regions(ordered)
                .drugNames(new ArrayList<>(drugNames))
                .duplicates(duplicates)
                .aggregateConfidence(aggregate)
                .processingDuration(elapsed.isNegative() ? Duration.ZERO : elapsed)
                .statistics(stats)
                .completedAt(now)
                .build();
    }

    /**
     * A region that displaced the previous holder of a drug also takes over the duplicates
     * that region had collected.
     */
    private static void repointDuplicates(List<DuplicateDetection> duplicates, RegionResult replaced,
                                          RegionResult keeper) {
        for (int i = 0; i < duplicates.size(); i++) {
            DuplicateDetection d = duplicates.get(i);
            if (d.keptRegionId().equals(replaced.getRegionId())) {
                duplicates.set(i, new DuplicateDetection(d.drugId(), d.drugName(), keeper.getRegionId(),
                        d.duplicateRegionId(), keeper.getConfidence(), d.duplicateConfidence()));
            }
        }
    }
}
