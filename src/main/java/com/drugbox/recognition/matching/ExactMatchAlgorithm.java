package com.drugbox.recognition.matching;

import com.drugbox.recognition.catalog.CatalogKey;
import com.drugbox.recognition.catalog.DrugCatalog;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalized text, or one of its lines, equals a catalog name or alias.
 */
public class ExactMatchAlgorithm implements MatchAlgorithm {

    public static final String NAME = "exact";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AlgorithmHit> match(MatchQuery query, DrugCatalog catalog) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(query.normalized());
        variants.addAll(query.lines());
        List<AlgorithmHit> hits = new ArrayList<>();
        for (String variant : variants) {
            for (CatalogKey key : catalog.lookupByKey(variant)) {
                hits.add(new AlgorithmHit(key, 100, NAME, true));
            }
        }
        return hits;
    }
}
