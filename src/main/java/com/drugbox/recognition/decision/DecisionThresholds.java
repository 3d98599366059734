package com.drugbox.recognition.decision;

/**
 * @param high                     best confidence at or above which auto-selection is considered
 * @param lowFloor                 best confidence below which no options are offered
 * @param tieMargin                candidates this close to the best count as tied
 * @param visualContradictionFloor visual similarity at which a different drug blocks auto-selection
 */
public record DecisionThresholds(int high, int lowFloor, int tieMargin, double visualContradictionFloor) {

    public DecisionThresholds {
        if (lowFloor < 1 || high > 100 || lowFloor > high) {
            throw new IllegalArgumentException("thresholds must satisfy 1 <= lowFloor <= high <= 100");
        }
        if (tieMargin < 0) {
            throw new IllegalArgumentException("tieMargin must be >= 0");
        }
        if (visualContradictionFloor < 0.0 || visualContradictionFloor > 1.0) {
            throw new IllegalArgumentException("visualContradictionFloor must be between 0.0 and 1.0");
        }
    }

    public static DecisionThresholds defaults() {
        return new DecisionThresholds(90, 60, 3, 0.85);
    }

    /**
     * Auto-selects only near-certain matches.
     */
    public static DecisionThresholds strict() {
        return new DecisionThresholds(95, 70, 5, 0.8);
    }
}
