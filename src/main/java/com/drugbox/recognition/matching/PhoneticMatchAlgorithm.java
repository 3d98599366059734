package com.drugbox.recognition.matching;

import com.drugbox.recognition.catalog.CatalogKey;
import com.drugbox.recognition.catalog.DrugCatalog;
import com.drugbox.recognition.similarity.LevenshteinSimilarity;
import com.drugbox.recognition.similarity.PhoneticEncoder;

import java.util.ArrayList;
import java.util.List;

/**
 * Same phonetic code after OCR-confusion folding.
 *
 * <p>Confidence is the edit similarity of the folded strings less a fixed penalty and
 * never above the cap, so a phonetic hit always ranks below an edit-distance hit of the
 * same apparent similarity.</p>
 */
public class PhoneticMatchAlgorithm implements MatchAlgorithm {

    public static final String NAME = "phonetic";

    public static final int DEFAULT_CAP = 85;
    public static final int DEFAULT_PENALTY = 10;
    private static final int MIN_CODE_LENGTH = 3;

    private final PhoneticEncoder encoder = new PhoneticEncoder();
    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();
    private final int cap;
    private final int penalty;
    private final int minConfidence;

    public PhoneticMatchAlgorithm() {
        this(DEFAULT_CAP, DEFAULT_PENALTY, 40);
    }

    public PhoneticMatchAlgorithm(int cap, int penalty, int minConfidence) {
        if (cap >= 100) {
            throw new IllegalArgumentException("cap must be below 100");
        }
        this.cap = cap;
        this.penalty = penalty;
        this.minConfidence = minConfidence;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AlgorithmHit> match(MatchQuery query, DrugCatalog catalog) {
        List<AlgorithmHit> hits = new ArrayList<>();
        for (CatalogKey key : catalog.keys()) {
            String keyCode = encoder.encode(key.key());
            if (keyCode.replace(" ", "").length() < MIN_CODE_LENGTH) {
                continue;
            }
            String foldedKey = encoder.foldConfusables(key.key());
            int keyTokens = key.key().split(" ").length;
            int best = 0;
            for (String candidate : query.comparisonStrings(keyTokens)) {
                if (!keyCode.equals(encoder.encode(candidate))) {
                    continue;
                }
                double sim = similarity.compute(encoder.foldConfusables(candidate), foldedKey);
                best = Math.max(best, (int) Math.round(sim * 100) - penalty);
            }
            int confidence = Math.min(cap, best);
            if (confidence >= minConfidence) {
                hits.add(new AlgorithmHit(key, confidence, NAME, false));
            }
        }
        return hits;
    }
}
