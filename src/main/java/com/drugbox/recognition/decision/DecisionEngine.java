package com.drugbox.recognition.decision;

import com.drugbox.recognition.aggregate.RegionResult;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RecoveredText;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.core.model.RegionFailure;
import com.drugbox.recognition.feature.VisualLookup;
import com.drugbox.recognition.feature.VisualMatch;
import com.drugbox.recognition.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Chooses the best candidate for a region and what the caller should do with it.
 *
 * <ul>
 *   <li>No candidates: {@link RecommendedAction#RESCAN}.</li>
 *   <li>Best at or above {@code high}: {@link RecommendedAction#AUTO_SELECT} when it is the only
 *       candidate at or above {@code high}, no other candidate is within the tie margin, and the
 *       visual index does not confidently show a different drug. Otherwise
 *       {@link RecommendedAction#SHOW_OPTIONS}.</li>
 *   <li>Best at or above {@code lowFloor}: {@link RecommendedAction#SHOW_OPTIONS}.</li>
 *   <li>Below that: {@link RecommendedAction#RESCAN} when the text itself is unreliable
 *       (extraction failed, or recovery was needed and failed), otherwise
 *       {@link RecommendedAction#MANUAL_ENTRY}.</li>
 * </ul>
 *
 * <p>Candidates are listed by confidence. {@link CandidateRanking#TIE_BREAK} only orders
 * candidates whose confidences are equal, so evidence never lifts a lower score above a higher
 * one.</p>
 */
public class DecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final DecisionThresholds thresholds;
    private final NormalizationEngine normalizer;

    public DecisionEngine(DecisionThresholds thresholds, NormalizationEngine normalizer) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    /**
     * @param recovered null when extraction failed
     */
    public RegionResult decide(Region region, String extractedText, RecoveredText recovered,
                               List<MatchCandidate> candidates, VisualLookup visual, List<RegionFailure> failures) {
        VisualLookup lookup = visual != null ? visual : VisualLookup.skipped();
        List<MatchCandidate> confirmed = confirmVisually(candidates, lookup);
        List<MatchCandidate> ordered = order(confirmed);
        boolean textUnreliable = recovered == null || recovered.lowQuality();
        RecommendedAction action = choose(ordered, lookup, textUnreliable);

        if (!ordered.isEmpty()) {
            MatchCandidate best = ordered.get(0);
            log.debug("decision.made regionId={} action={} best='{}' confidence={} type={} candidates={}",
                    region.id(), action, best.drugName(), best.confidence(), best.matchType(), ordered.size());
        } else {
            log.debug("decision.made regionId={} action={} candidates=0", region.id(), action);
        }

        return RegionResult.builder()
                .regionId(region.id())
                .regionIndex(region.index())
                .box(region.box())
                .condition(region.condition())
                .extractedText(extractedText)
                .recoveredText(recovered)
                .candidates(ordered)
                .visualMatches(lookup.matches())
                .visualIndexAvailable(lookup.available())
                .action(action)
                .failures(failures)
                .build();
    }

    RecommendedAction choose(List<MatchCandidate> ordered, VisualLookup visual, boolean textUnreliable) {
        if (ordered.isEmpty()) {
            return RecommendedAction.RESCAN;
        }
        MatchCandidate best = ordered.get(0);
        if (best.confidence() >= thresholds.high()) {
            if (hasCompetitor(best, ordered) || visualContradicts(best, visual)) {
                return RecommendedAction.SHOW_OPTIONS;
            }
            return RecommendedAction.AUTO_SELECT;
        }
        if (best.confidence() >= thresholds.lowFloor()) {
            return RecommendedAction.SHOW_OPTIONS;
        }
        return textUnreliable ? RecommendedAction.RESCAN : RecommendedAction.MANUAL_ENTRY;
    }

    List<MatchCandidate> order(List<MatchCandidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<MatchCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(CandidateRanking.BY_CONFIDENCE);
        return ranked;
    }

    /**
     * Any second candidate at or above {@code high}, or within the tie margin of the best,
     * competes with it.
     */
    private boolean hasCompetitor(MatchCandidate best, List<MatchCandidate> ordered) {
        for (int i = 1; i < ordered.size(); i++) {
            MatchCandidate other = ordered.get(i);
            if (other.confidence() >= thresholds.high()
                    || best.confidence() - other.confidence() <= thresholds.tieMargin()) {
                return true;
            }
        }
        return false;
    }

    private boolean visualContradicts(MatchCandidate best, VisualLookup visual) {
        if (best.visualConfirmed() || !visual.available()) {
            return false;
        }
        return visual.top()
                .filter(top -> top.similarity() >= thresholds.visualContradictionFloor())
                .filter(top -> !normalizer.normalize(top.drugName()).equals(normalizer.normalize(best.drugName())))
                .isPresent();
    }

    private List<MatchCandidate> confirmVisually(List<MatchCandidate> candidates, VisualLookup visual) {
        if (visual.matches().isEmpty()) {
            return candidates;
        }
        Set<String> seen = new HashSet<>();
        for (VisualMatch m : visual.matches()) {
            seen.add(normalizer.normalize(m.drugName()));
        }
        List<MatchCandidate> out = new ArrayList<>(candidates.size());
        for (MatchCandidate c : candidates) {
            out.add(seen.contains(normalizer.normalize(c.drugName())) ? c.withVisualConfirmation() : c);
        }
        return out;
    }
}
