package com.drugbox.recognition.decision;

import com.drugbox.recognition.core.model.MatchCandidate;

import java.util.Comparator;

/**
 * Orderings over match candidates. Both are total, so equal inputs always rank the same way.
 */
public final class CandidateRanking {

    private CandidateRanking() {
    }

    /**
     * Evidence that separates equally scored candidates: multi-algorithm agreement, then visual
     * confirmation, then exactness. Strongest first.
     */
    public static final Comparator<MatchCandidate> EVIDENCE =
            Comparator.comparing(MatchCandidate::multiAlgorithmConfirmed).reversed()
                    .thenComparing(Comparator.comparing(MatchCandidate::visualConfirmed).reversed())
                    .thenComparing(Comparator.comparing(MatchCandidate::isExact).reversed());

    /**
     * Tie-break between equal confidences: evidence, then usage count, then name.
     */
    public static final Comparator<MatchCandidate> TIE_BREAK =
            EVIDENCE
                    .thenComparing(Comparator.comparingLong(MatchCandidate::usageCount).reversed())
                    .thenComparing(MatchCandidate::drugName)
                    .thenComparing(MatchCandidate::drugId);

    /**
     * Overall list order: confidence first, then the tie-break.
     */
    public static final Comparator<MatchCandidate> BY_CONFIDENCE =
            Comparator.comparingInt(MatchCandidate::confidence).reversed()
                    .thenComparing(TIE_BREAK);
}
