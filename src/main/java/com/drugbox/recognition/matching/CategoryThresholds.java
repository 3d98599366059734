package com.drugbox.recognition.matching;

import com.drugbox.recognition.catalog.TherapeuticCategory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Minimum edit-distance confidence per therapeutic category. Values are clamped to
 * [10, 100] and may be changed while scans are running. Registered
 * {@link ThresholdListener}s are told about every change that alters a value.
 */
public class CategoryThresholds {

    public static final int MIN_THRESHOLD = 10;
    public static final int MAX_THRESHOLD = 100;

    private final Map<String, Integer> thresholds = new ConcurrentHashMap<>();
    private final List<ThresholdListener> listeners = new CopyOnWriteArrayList<>();
    private volatile int defaultThreshold;

    public CategoryThresholds(int defaultThreshold) {
        this.defaultThreshold = clamp(defaultThreshold);
    }

    /**
     * Uniform threshold of 70 for every category.
     */
    public static CategoryThresholds defaults() {
        return new CategoryThresholds(70);
    }

    /**
     * Stricter thresholds for drug classes where a wrong pick is costly.
     */
    public static CategoryThresholds clinicalPreset() {
        CategoryThresholds t = new CategoryThresholds(80);
        t.set(TherapeuticCategory.ANTIBIOTICS, 85);
        t.set(TherapeuticCategory.ANALGESICS, 75);
        t.set(TherapeuticCategory.DIABETES, 90);
        t.set(TherapeuticCategory.HYPERTENSION, 85);
        t.set(TherapeuticCategory.CHOLESTEROL, 80);
        return t;
    }

    public int minimumFor(String category) {
        if (category == null || category.isEmpty()) {
            return defaultThreshold;
        }
        return thresholds.getOrDefault(category.toLowerCase(Locale.ROOT), defaultThreshold);
    }

    public CategoryThresholds set(String category, int threshold) {
        int value = clamp(threshold);
        Integer previous = thresholds.put(category.toLowerCase(Locale.ROOT), value);
        if (previous == null || previous != value) {
            notifyListeners();
        }
        return this;
    }

    public void setDefault(int threshold) {
        int value = clamp(threshold);
        int previous = defaultThreshold;
        this.defaultThreshold = value;
        if (previous != value) {
            notifyListeners();
        }
    }

    public void addListener(ThresholdListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ThresholdListener listener) {
        listeners.remove(listener);
    }

    public int getDefault() {
        return defaultThreshold;
    }

    public Map<String, Integer> asMap() {
        return Map.copyOf(thresholds);
    }

    private void notifyListeners() {
        for (ThresholdListener listener : listeners) {
            listener.onThresholdsChanged();
        }
    }

    private static int clamp(int value) {
        return Math.max(MIN_THRESHOLD, Math.min(MAX_THRESHOLD, value));
    }
}
