package com.drugbox.recognition.matching;

import com.drugbox.recognition.catalog.CatalogKey;
import com.drugbox.recognition.catalog.DrugCatalog;
import com.drugbox.recognition.core.model.CatalogEntry;
import com.drugbox.recognition.similarity.LevenshteinSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Edit-distance similarity against every key, kept only when it clears the minimum for the
 * key's therapeutic category.
 */
public class EditDistanceAlgorithm implements MatchAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(EditDistanceAlgorithm.class);

    public static final String NAME = "edit-distance";

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();
    private final CategoryThresholds thresholds;

    public EditDistanceAlgorithm(CategoryThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AlgorithmHit> match(MatchQuery query, DrugCatalog catalog) {
        List<AlgorithmHit> hits = new ArrayList<>();
        for (CatalogKey key : catalog.keys()) {
            int keyTokens = key.key().split(" ").length;
            double best = 0.0;
            for (String candidate : query.comparisonStrings(keyTokens)) {
                best = Math.max(best, similarity.compute(candidate, key.key()));
            }
            int confidence = Math.min(99, (int) Math.round(best * 100));
            String category = catalog.findById(key.entryId()).map(CatalogEntry::category).orElse("");
            int minimum = thresholds.minimumFor(category);
            if (confidence >= minimum) {
                hits.add(new AlgorithmHit(key, confidence, NAME, false));
            } else if (confidence >= minimum - 10) {
                log.debug("match.edit.below-threshold key='{}' category={} confidence={} minimum={}",
                        key.key(), category, confidence, minimum);
            }
        }
        return hits;
    }
}
