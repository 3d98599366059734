package com.drugbox.recognition.feature;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a visual index query. An unavailable index yields no matches and a reason;
 * the region carries on with text evidence only.
 */
public record VisualLookup(boolean available, List<VisualMatch> matches, String reason) {

    public VisualLookup {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static VisualLookup of(List<VisualMatch> matches) {
        return new VisualLookup(true, matches, null);
    }

    public static VisualLookup unavailable(String reason) {
        return new VisualLookup(false, List.of(), reason);
    }

    public static VisualLookup skipped() {
        return new VisualLookup(true, List.of(), "no features");
    }

    public Optional<VisualMatch> top() {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }
}
