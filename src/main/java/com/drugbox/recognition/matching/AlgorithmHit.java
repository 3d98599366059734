package com.drugbox.recognition.matching;

import com.drugbox.recognition.catalog.CatalogKey;

/**
 * One algorithm's opinion that a catalog key matches the query.
 *
 * @param confidence 0 to 100; only exact hits may reach 100
 */
public record AlgorithmHit(CatalogKey key, int confidence, String algorithm, boolean exact) {

    public AlgorithmHit {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
        if (!exact && confidence == 100) {
            throw new IllegalArgumentException("only exact hits may report 100");
        }
    }
}
