package com.drugbox.recognition.aggregate;

import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.RecommendedAction;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counts over one scan.
 *
 * @param regionsDetected     regions the detector produced
 * @param regionsCompleted    regions that finished processing
 * @param regionsCanceled     regions dropped by a rescan request
 * @param duplicatesCollapsed regions folded into another region showing the same drug
 * @param actions             completed regions per recommended action
 * @param failures            contained failures per kind
 */
public record ScanStatistics(
        int regionsDetected,
        int regionsCompleted,
        int regionsCanceled,
        int duplicatesCollapsed,
        Map<RecommendedAction, Integer> actions,
        Map<FailureKind, Integer> failures
) {
    public ScanStatistics {
        actions = Map.copyOf(actions);
        failures = Map.copyOf(failures);
    }

    public int count(RecommendedAction action) {
        return actions.getOrDefault(action, 0);
    }

    public int count(FailureKind kind) {
        return failures.getOrDefault(kind, 0);
    }

    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0,
                new EnumMap<>(RecommendedAction.class), new EnumMap<>(FailureKind.class));
    }
}
