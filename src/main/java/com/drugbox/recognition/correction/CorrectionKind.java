package com.drugbox.recognition.correction;

/**
 * What the user did to a region's result.
 */
public enum CorrectionKind {
    /** The user typed or picked a different drug name. */
    NAME_EDIT,
    /** The user confirmed the proposed drug. */
    VERIFIED,
    /** The user rejected the proposed drug without naming another. */
    REJECTED
}
