package com.drugbox.recognition.cache;

import com.drugbox.recognition.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<List<MatchCandidate>> get(String normalizedQuery) {
        return Optional.empty();
    }

    @Override
    public void put(String normalizedQuery, List<MatchCandidate> candidates) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
