package com.drugbox.recognition.recovery;

/**
 * @param damageQualityThreshold text quality below this marks a region as damaged
 * @param maxDistanceRatio       highest accepted edit distance divided by catalog key length
 * @param minPrefixLength        shortest truncated token that may be completed by prefix
 * @param minPrefixCoverage      share of the catalog key a prefix must cover
 * @param visualBoost            confidence added when the visual index names the same drug
 * @param minRecoveryConfidence  reconstructions below this are discarded
 */
public record RecoveryOptions(
        double damageQualityThreshold,
        double maxDistanceRatio,
        int minPrefixLength,
        double minPrefixCoverage,
        double visualBoost,
        double minRecoveryConfidence
) {
    public RecoveryOptions {
        requireUnit(damageQualityThreshold, "damageQualityThreshold");
        requireUnit(maxDistanceRatio, "maxDistanceRatio");
        requireUnit(minPrefixCoverage, "minPrefixCoverage");
        requireUnit(visualBoost, "visualBoost");
        requireUnit(minRecoveryConfidence, "minRecoveryConfidence");
        if (minPrefixLength < 1) {
            throw new IllegalArgumentException("minPrefixLength must be >= 1");
        }
    }

    public static RecoveryOptions defaults() {
        return new RecoveryOptions(0.5, 0.34, 5, 0.5, 0.15, 0.6);
    }

    private static void requireUnit(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}
