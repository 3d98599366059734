package com.drugbox.recognition.cache;

import com.drugbox.recognition.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Memoizes ranked candidates per normalized query text. Cached candidates are region-free;
 * callers re-stamp the region id.
 */
public interface MatchCache {

    Optional<List<MatchCandidate>> get(String normalizedQuery);

    void put(String normalizedQuery, List<MatchCandidate> candidates);

    void invalidateAll();

    CacheStats getStats();
}
