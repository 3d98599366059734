package com.drugbox.recognition.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityAlgorithmsTest {

    @Nested
    @DisplayName("LevenshteinSimilarity")
    class LevenshteinTests {

        private LevenshteinSimilarity levenshtein;

        @BeforeEach
        void setUp() {
            levenshtein = new LevenshteinSimilarity();
        }

        @Test
        @DisplayName("Should return 1.0 for identical strings")
        void identical() {
            assertEquals(1.0, levenshtein.compute("parol", "parol"));
        }

        @Test
        @DisplayName("Should return 0.0 for null or empty strings")
        void nullOrEmpty() {
            assertEquals(0.0, levenshtein.compute(null, "parol"));
            assertEquals(0.0, levenshtein.compute("parol", null));
            assertEquals(0.0, levenshtein.compute("", "parol"));
        }

        @ParameterizedTest
        @DisplayName("Should compute the raw edit distance")
        @CsvSource({
                "kitten,sitting,3",
                "parol,parl,1",
                "amoxil,amoxil,0",
                "abc,'',3"
        })
        void distance(String a, String b, int expected) {
            assertEquals(expected, LevenshteinSimilarity.distance(a, b));
            assertEquals(expected, LevenshteinSimilarity.distance(b, a));
        }

        @Test
        @DisplayName("Should keep similarity high for a single OCR typo")
        void singleTypo() {
            double score = levenshtein.compute("metformin", "metfonnin");
            assertTrue(score >= 0.75, "got " + score);
        }
    }

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {

        @Test
        @DisplayName("Should compute the token overlap ratio")
        void overlap() {
            JaccardSimilarity jaccard = new JaccardSimilarity();
            assertEquals(1.0 / 3.0, jaccard.compute("parol plus", "parol forte"), 1e-9);
        }

        @Test
        @DisplayName("Should ignore short tokens when a minimum length is set")
        void minTokenLength() {
            JaccardSimilarity jaccard = new JaccardSimilarity(3);
            Set<String> tokens = jaccard.tokenize("ab parol c forte");
            assertEquals(Set.of("parol", "forte"), tokens);
        }

        @Test
        @DisplayName("Should return 0.0 for disjoint tokens")
        void disjoint() {
            assertEquals(0.0, new JaccardSimilarity().compute("parol", "amoxil"));
        }
    }

    @Nested
    @DisplayName("PhoneticEncoder")
    class PhoneticTests {

        private final PhoneticEncoder encoder = new PhoneticEncoder();

        @ParameterizedTest
        @DisplayName("Should fold OCR glyph confusions to letters")
        @CsvSource({
                "paro1,parol",
                "rnetformin,metformin",
                "a5pirin,aspirin",
                "ib0profen,iboprofen",
                "vvarfarin,warfarin"
        })
        void foldConfusables(String confused, String expected) {
            assertEquals(expected, encoder.foldConfusables(confused));
        }

        @Test
        @DisplayName("Should encode a confused spelling like the clean spelling")
        void sameCode() {
            assertEquals(encoder.encode("parol"), encoder.encode("paro1"));
            assertEquals(encoder.encode("metformin"), encoder.encode("rnetformin"));
        }

        @Test
        @DisplayName("Should keep the first letter and drop vowels")
        void codeShape() {
            assertEquals("p64", encoder.encode("parol"));
        }

        @Test
        @DisplayName("Should give each token its own code")
        void perToken() {
            String code = encoder.encode("parol forte");
            assertEquals(2, code.split(" ").length);
        }

        @Test
        @DisplayName("Should encode blank or digit-only input to empty")
        void blank() {
            assertEquals("", encoder.encode(""));
            assertEquals("", encoder.encode(null));
            assertEquals("", encoder.encode("   "));
        }
    }
}
