package com.drugbox.recognition.matching;

/**
 * Notified after a {@link CategoryThresholds} value changes.
 */
@FunctionalInterface
public interface ThresholdListener {

    void onThresholdsChanged();
}
