package com.drugbox.recognition.matching;

import com.drugbox.recognition.catalog.DrugCatalog;

import java.util.List;

/**
 * One independent way of matching region text against the catalog.
 * Implementations must not depend on each other's output.
 */
public interface MatchAlgorithm {

    String getName();

    List<AlgorithmHit> match(MatchQuery query, DrugCatalog catalog);
}
