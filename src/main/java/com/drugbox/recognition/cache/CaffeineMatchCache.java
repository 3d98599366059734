package com.drugbox.recognition.cache;

import com.drugbox.recognition.catalog.CatalogListener;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed {@link MatchCache}. Registered as a {@link CatalogListener} so any catalog
 * change drops every cached ranking.
 */
public class CaffeineMatchCache implements MatchCache, CatalogListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMatchCache.class);

    private final Cache<String, List<MatchCandidate>> cache;

    public CaffeineMatchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineMatchCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<MatchCandidate>> get(String normalizedQuery) {
        return Optional.ofNullable(cache.getIfPresent(normalizedQuery));
    }

    @Override
    public void put(String normalizedQuery, List<MatchCandidate> candidates) {
        cache.put(normalizedQuery, List.copyOf(candidates));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all match cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    @Override
    public void onCatalogChanged(String entryId) {
        invalidateAll();
    }
}
