package com.drugbox.recognition.core.model;

/**
 * What the caller should do with a region.
 */
public enum RecommendedAction {
    /** Take the best candidate without asking. */
    AUTO_SELECT,
    /** Let the user pick among the ranked candidates. */
    SHOW_OPTIONS,
    /** Candidates are too weak to offer; ask the user to type the name. */
    MANUAL_ENTRY,
    /** Nothing usable was read; capture the box again. */
    RESCAN
}
