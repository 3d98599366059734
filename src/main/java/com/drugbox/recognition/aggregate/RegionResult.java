package com.drugbox.recognition.aggregate;

import com.drugbox.recognition.core.model.BoundingBox;
import com.drugbox.recognition.core.model.BoxCondition;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.RecommendedAction;
import com.drugbox.recognition.core.model.RecoveredText;
import com.drugbox.recognition.core.model.RegionFailure;
import com.drugbox.recognition.feature.VisualMatch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything decided about one region.
 *
 * <p>{@code candidates} lists the best candidate first. Every candidate and failure
 * belongs to this region.</p>
 */
public final class RegionResult {

    private final String regionId;
    private final int regionIndex;
    private final BoundingBox box;
    private final BoxCondition condition;
    private final String extractedText;
    private final RecoveredText recoveredText;
    private final List<MatchCandidate> candidates;
    private final List<VisualMatch> visualMatches;
    private final boolean visualIndexAvailable;
    private final RecommendedAction action;
    private final List<RegionFailure> failures;

    private RegionResult(Builder builder) {
        this.regionId = Objects.requireNonNull(builder.regionId, "regionId is required");
        this.regionIndex = builder.regionIndex;
        this.box = Objects.requireNonNull(builder.box, "box is required");
        this.condition = Objects.requireNonNull(builder.condition, "condition is required");
        this.extractedText = builder.extractedText != null ? builder.extractedText : "";
        this.recoveredText = builder.recoveredText;
        this.candidates = builder.candidates != null ? List.copyOf(builder.candidates) : List.of();
        this.visualMatches = builder.visualMatches != null ? List.copyOf(builder.visualMatches) : List.of();
        this.visualIndexAvailable = builder.visualIndexAvailable;
        this.action = Objects.requireNonNull(builder.action, "action is required");
        this.failures = builder.failures != null ? List.copyOf(builder.failures) : List.of();

        for (MatchCandidate c : candidates) {
            if (!regionId.equals(c.regionId())) {
                throw new IllegalArgumentException("Candidate " + c.drugId() + " belongs to region "
                        + c.regionId() + ", not " + regionId);
            }
        }
        for (RegionFailure f : failures) {
            if (!regionId.equals(f.regionId())) {
                throw new IllegalArgumentException("Failure belongs to region " + f.regionId() + ", not " + regionId);
            }
        }
        if (action != RecommendedAction.RESCAN && candidates.isEmpty()) {
            throw new IllegalArgumentException(action + " requires at least one candidate");
        }
    }

    public String getRegionId() {
        return regionId;
    }

    public int getRegionIndex() {
        return regionIndex;
    }

    public BoundingBox getBox() {
        return box;
    }

    public BoxCondition getCondition() {
        return condition;
    }

    public String getExtractedText() {
        return extractedText;
    }

    /**
     * Empty when extraction failed before recovery could run.
     */
    public Optional<RecoveredText> getRecoveredText() {
        return Optional.ofNullable(recoveredText);
    }

    public List<MatchCandidate> getCandidates() {
        return candidates;
    }

    public Optional<MatchCandidate> getBestCandidate() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /**
     * Confidence of the best candidate, 0 when there is none.
     */
    public int getConfidence() {
        return candidates.isEmpty() ? 0 : candidates.get(0).confidence();
    }

    public List<VisualMatch> getVisualMatches() {
        return visualMatches;
    }

    public boolean isVisualIndexAvailable() {
        return visualIndexAvailable;
    }

    public RecommendedAction getAction() {
        return action;
    }

    public List<RegionFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "RegionResult{regionId='" + regionId + "', action=" + action
                + ", best=" + getBestCandidate().map(MatchCandidate::drugName).orElse("-")
                + ", confidence=" + getConfidence() + ", failures=" + failures.size() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String regionId;
        private int regionIndex;
        private BoundingBox box;
        private BoxCondition condition;
        private String extractedText;
        private RecoveredText recoveredText;
        private List<MatchCandidate> candidates;
        private List<VisualMatch> visualMatches;
        private boolean visualIndexAvailable = true;
        private RecommendedAction action;
        private List<RegionFailure> failures;

        public Builder regionId(String regionId) {
            this.regionId = regionId;
            return this;
        }

        public Builder regionIndex(int regionIndex) {
            this.regionIndex = regionIndex;
            return this;
        }

        public Builder box(BoundingBox box) {
            this.box = box;
            return this;
        }

        public Builder condition(BoxCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder extractedText(String extractedText) {
            this.extractedText = extractedText;
            return this;
        }

        public Builder recoveredText(RecoveredText recoveredText) {
            this.recoveredText = recoveredText;
            return this;
        }

        public Builder candidates(List<MatchCandidate> candidates) {
            this.candidates = candidates;
            return this;
        }

        public Builder visualMatches(List<VisualMatch> visualMatches) {
            this.visualMatches = visualMatches;
            return this;
        }

        public Builder visualIndexAvailable(boolean visualIndexAvailable) {
            this.visualIndexAvailable = visualIndexAvailable;
            return this;
        }

        public Builder action(RecommendedAction action) {
            this.action = action;
            return this;
        }

        public Builder failures(List<RegionFailure> failures) {
            this.failures = failures;
            return this;
        }

        public RegionResult build() {
            return new RegionResult(this);
        }
    }
}
