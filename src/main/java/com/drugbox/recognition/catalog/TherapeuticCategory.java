package com.drugbox.recognition.catalog;

import java.util.Locale;

/**
 * Category names used for per-category match thresholds, derived from ATC codes when the
 * catalog does not state one.
 */
public final class TherapeuticCategory {

    public static final String ANTIBIOTICS = "antibiotics";
    public static final String ANALGESICS = "analgesics";
    public static final String DIABETES = "diabetes";
    public static final String HYPERTENSION = "hypertension";
    public static final String CHOLESTEROL = "cholesterol";
    public static final String GENERAL = "general";

    private TherapeuticCategory() {
    }

    public static String fromAtcCode(String atcCode) {
        if (atcCode == null || atcCode.length() < 3) {
            return GENERAL;
        }
        String code = atcCode.toUpperCase(Locale.ROOT);
        if (code.startsWith("J01")) {
            return ANTIBIOTICS;
        }
        if (code.startsWith("N02") || code.startsWith("M01")) {
            return ANALGESICS;
        }
        if (code.startsWith("A10")) {
            return DIABETES;
        }
        if (code.startsWith("C10")) {
            return CHOLESTEROL;
        }
        if (code.startsWith("C0")) {
            char group = code.charAt(2);
            if (group >= '2' && group <= '9') {
                return HYPERTENSION;
            }
        }
        return GENERAL;
    }
}
