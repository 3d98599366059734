package com.drugbox.recognition.recovery;

import com.drugbox.recognition.catalog.CatalogLoader;
import com.drugbox.recognition.catalog.InMemoryDrugCatalog;
import com.drugbox.recognition.core.model.BoundingBox;
import com.drugbox.recognition.core.model.BoxAngle;
import com.drugbox.recognition.core.model.BoxCondition;
import com.drugbox.recognition.core.model.BoxLighting;
import com.drugbox.recognition.core.model.ExtractedText;
import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.RecoveredText;
import com.drugbox.recognition.core.model.RecoveryMethod;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.feature.VisualLookup;
import com.drugbox.recognition.feature.VisualMatch;
import com.drugbox.recognition.rules.DrugNameNormalizationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryEngineTest {

    private RecoveryEngine engine;

    @BeforeEach
    void setUp() {
        var normalizer = DrugNameNormalizationRules.createDefaultEngine();
        var catalog = new InMemoryDrugCatalog(normalizer, new CatalogLoader().loadResource("catalog/drugs.json"));
        engine = new RecoveryEngine(catalog, normalizer, RecoveryOptions.defaults());
    }

    private static Region region(BoxCondition condition) {
        return new Region("scan-r0", 0, new BoundingBox(0, 0, 100, 100),
                new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB), 0.9,
                condition, BoxAngle.FRONT, BoxLighting.NORMAL, false);
    }

    private static ExtractedText text(String raw, double quality) {
        return new ExtractedText("scan-r0", raw, quality, -1);
    }

    private static VisualLookup visuallyLooksLike(String drugName) {
        return VisualLookup.of(List.of(
                new VisualMatch("img-1", drugName, 0.9, Set.of(FeatureType.COLOR_HISTOGRAM))));
    }

    @Nested
    @DisplayName("Damage detection")
    class Damage {

        @Test
        @DisplayName("Should leave clean text on an intact box alone")
        void clean() {
            RecoveredText result = engine.recover(text("Amoxil 500 mg", 0.9), region(BoxCondition.PERFECT),
                    VisualLookup.skipped());

            assertFalse(result.attempted());
            assertFalse(result.recovered());
            assertEquals("Amoxil 500 mg", result.text());
        }

        @Test
        @DisplayName("Should mark the region damaged for low quality or a damaged box")
        void damaged() {
            assertTrue(engine.isDamaged(text("Amoxil", 0.3), region(BoxCondition.PERFECT)));
            assertTrue(engine.isDamaged(text("Amoxil", 0.9), region(BoxCondition.SEVERELY_DAMAGED)));
            assertFalse(engine.isDamaged(text("Amoxil", 0.9), region(BoxCondition.WORN)));
        }

        @Test
        @DisplayName("Should skip recovery when a damaged box's text already names a drug")
        void damagedButReadable() {
            RecoveredText result = engine.recover(text("PAROL", 0.9), region(BoxCondition.DAMAGED),
                    VisualLookup.skipped());

            assertFalse(result.attempted());
            assertEquals("PAROL", result.text());
        }
    }

    @Nested
    @DisplayName("Reconstruction")
    class Reconstruction {

        @Test
        @DisplayName("Should complete a dropped letter from the catalog")
        void dictionaryCompletion() {
            RecoveredText result = engine.recover(text("Amoxicilln 500 mg", 0.3), region(BoxCondition.PERFECT),
                    VisualLookup.skipped());

            assertTrue(result.attempted());
            assertTrue(result.recovered());
            assertFalse(result.lowQuality());
            assertEquals("Amoxicillin", result.text());
            assertEquals("Amoxicilln 500 mg", result.originalText());
            assertEquals(RecoveryMethod.DICTIONARY_COMPLETION, result.method());
            assertEquals(1.0 - 1.0 / 11, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should reconstruct multi-word names from consecutive tokens")
        void multiWord() {
            RecoveredText result = engine.recover(text("Acetylsalicylc Acid 100 mg", 0.3),
                    region(BoxCondition.PERFECT), VisualLookup.skipped());

            assertEquals("Acetylsalicylic Acid", result.text());
            assertEquals(0.95, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should tag the reconstruction and raise its confidence on visual agreement")
        void visualCrossReference() {
            RecoveredText result = engine.recover(text("Amoxicilln 500 mg", 0.3), region(BoxCondition.PERFECT),
                    visuallyLooksLike("Amoxil"));

            assertEquals(RecoveryMethod.VISUAL_CROSS_REFERENCE, result.method());
            assertEquals(1.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should need visual support to trust a short truncation")
        void truncatedPrefix() {
            RecoveredText alone = engine.recover(text("Atorvas", 0.3), region(BoxCondition.PERFECT),
                    VisualLookup.skipped());
            assertTrue(alone.attempted());
            assertTrue(alone.lowQuality());
            assertFalse(alone.recovered());
            assertEquals("Atorvas", alone.text());

            RecoveredText supported = engine.recover(text("Atorvas", 0.3), region(BoxCondition.PERFECT),
                    visuallyLooksLike("Lipitor"));
            assertEquals("Atorvastatin", supported.text());
            assertEquals(RecoveryMethod.VISUAL_CROSS_REFERENCE, supported.method());
            assertEquals(7.0 / 12 * 0.9 + 0.15, supported.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should give no boost when the visual index is unavailable")
        void unavailableIndex() {
            RecoveredText result = engine.recover(text("Atorvas", 0.3), region(BoxCondition.PERFECT),
                    VisualLookup.unavailable("store down"));

            assertTrue(result.lowQuality());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should pass noise through flagged low quality")
        void noise() {
            RecoveredText result = engine.recover(text("x#q !!", 0.2), region(BoxCondition.PERFECT),
                    VisualLookup.skipped());

            assertTrue(result.attempted());
            assertTrue(result.lowQuality());
            assertEquals(RecoveryMethod.NONE, result.method());
            assertEquals("x#q !!", result.text());
            assertEquals(0.0, result.confidence());
        }

        @Test
        @DisplayName("Should not recover empty text")
        void empty() {
            RecoveredText result = engine.recover(text("", 0.0), region(BoxCondition.DAMAGED),
                    VisualLookup.skipped());

            assertTrue(result.lowQuality());
        }
    }

    @Test
    @DisplayName("Should reject out-of-range options")
    void optionsValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RecoveryOptions(1.5, 0.3, 5, 0.5, 0.1, 0.6));
        assertThrows(IllegalArgumentException.class, () -> new RecoveryOptions(0.5, 0.3, 0, 0.5, 0.1, 0.6));
    }
}
