package com.drugbox.recognition.rules;

import java.util.List;

/**
 * Built-in rules for text printed on drug packaging.
 */
public final class DrugNameNormalizationRules {

    private DrugNameNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getDosageRules());
        engine.addRules(getFormRules());
        engine.addRules(getCleanupRules());
        return engine;
    }

    /**
     * Strengths such as {@code 500 mg}, {@code 1 g/5 ml}, {@code %2}, {@code 0,5%}.
     */
    public static List<NormalizationRule> getDosageRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("dosage-compound")
                        .pattern("\\d+(?:[.,]\\d+)?\\s*(?:mg|mcg|µg|g|ml|iu|ui)\\s*/\\s*\\d*(?:[.,]\\d+)?\\s*(?:mg|mcg|g|ml)\\b")
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("dosage-unit")
                        .pattern("\\d+(?:[.,]\\d+)?\\s*(?:mg|mcg|µg|g|ml|iu|ui)\\b")
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("dosage-percent")
                        .pattern("%\\s*\\d+(?:[.,]\\d+)?|\\d+(?:[.,]\\d+)?\\s*%")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Pharmaceutical form and pack-count words, English and Turkish.
     */
    public static List<NormalizationRule> getFormRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("form-coated")
                        .pattern("\\bfilm[\\s-]*(?:kapli|coated)\\b")
                        .priority(30)
                        .build(),
                NormalizationRule.builder()
                        .name("form-word")
                        .pattern("\\b(?:tablets?|tabs?|kapsul|capsules?|caps|surup|syrup|suspansiyon|suspension"
                                + "|krem|cream|pomad|ointment|jel|gel|damla|drops|ampul|ampoules?|flakon|vials?"
                                + "|enjektabl|injection|sase|sachets?|efervesan|effervescent|oral|adet|pieces)\\b")
                        .priority(40)
                        .build(),
                NormalizationRule.builder()
                        .name("pack-count")
                        .pattern("\\b\\d+\\s*x\\b|\\bx\\s*\\d+\\b")
                        .priority(45)
                        .build()
        );
    }

    public static List<NormalizationRule> getCleanupRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .priority(50)
                        .build(),
                NormalizationRule.builder()
                        .name("standalone-number")
                        .pattern("\\b\\d+\\b")
                        .priority(60)
                        .build()
        );
    }
}
