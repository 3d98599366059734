package com.drugbox.recognition.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * One possible drug for one region, with its score and provenance.
 *
 * @param regionId                owning region
 * @param drugId                  catalog entry id
 * @param drugName                canonical name of the catalog entry
 * @param confidence              score in [0, 100]
 * @param matchType               band of {@code confidence}
 * @param algorithms              algorithms that produced this drug
 * @param multiAlgorithmConfirmed true when two or more algorithms agreed
 * @param genericMatch            true when a brand alias was resolved to this generic entry
 * @param matchedBrand            brand alias that was hit, or null
 * @param visualConfirmed         true when the visual index points to the same drug
 * @param category                therapeutic category of the entry
 * @param usageCount              usage count of the entry when matched
 */
public record MatchCandidate(
        String regionId,
        String drugId,
        String drugName,
        int confidence,
        MatchType matchType,
        Set<String> algorithms,
        boolean multiAlgorithmConfirmed,
        boolean genericMatch,
        String matchedBrand,
        boolean visualConfirmed,
        String category,
        long usageCount
) {
    public MatchCandidate {
        Objects.requireNonNull(drugId, "drugId is required");
        Objects.requireNonNull(drugName, "drugName is required");
        Objects.requireNonNull(matchType, "matchType is required");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
        if (!matchType.admits(confidence)) {
            throw new IllegalArgumentException(
                    "confidence " + confidence + " is outside the " + matchType + " band");
        }
        algorithms = algorithms != null ? Set.copyOf(algorithms) : Set.of();
        category = category != null ? category : "";
    }

    public boolean isExact() {
        return matchType == MatchType.EXACT;
    }

    public MatchCandidate forRegion(String newRegionId) {
        return new MatchCandidate(newRegionId, drugId, drugName, confidence, matchType, algorithms,
                multiAlgorithmConfirmed, genericMatch, matchedBrand, visualConfirmed, category, usageCount);
    }

    public MatchCandidate withVisualConfirmation() {
        return new MatchCandidate(regionId, drugId, drugName, confidence, matchType, algorithms,
                multiAlgorithmConfirmed, genericMatch, matchedBrand, true, category, usageCount);
    }
}
