package com.drugbox.recognition.core.model;

import java.util.Objects;

/**
 * Result of the recovery stage for one region.
 *
 * <p>When recovery was not needed, or failed, {@code text} equals the original text and
 * {@code method} is {@link RecoveryMethod#NONE}. {@code lowQuality} marks text that
 * needed recovery and did not get it.</p>
 */
public record RecoveredText(
        String regionId,
        String originalText,
        String text,
        RecoveryMethod method,
        double confidence,
        boolean attempted,
        boolean lowQuality
) {
    public RecoveredText {
        Objects.requireNonNull(regionId, "regionId is required");
        Objects.requireNonNull(method, "method is required");
        originalText = originalText != null ? originalText : "";
        text = text != null ? text : "";
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    /**
     * Text that did not need recovery.
     */
    public static RecoveredText untouched(ExtractedText extracted) {
        return new RecoveredText(extracted.regionId(), extracted.text(), extracted.text(),
                RecoveryMethod.NONE, extracted.quality(), false, false);
    }

    /**
     * Recovery was attempted and produced nothing usable; the original text passes through.
     */
    public static RecoveredText failed(ExtractedText extracted) {
        return new RecoveredText(extracted.regionId(), extracted.text(), extracted.text(),
                RecoveryMethod.NONE, 0.0, true, true);
    }

    public boolean recovered() {
        return method != RecoveryMethod.NONE;
    }
}
