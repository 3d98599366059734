package com.drugbox.recognition.matching;

import com.drugbox.recognition.cache.MatchCache;
import com.drugbox.recognition.cache.NoOpMatchCache;
import com.drugbox.recognition.catalog.CatalogKey;
import com.drugbox.recognition.catalog.DrugCatalog;
import com.drugbox.recognition.core.model.CatalogEntry;
import com.drugbox.recognition.core.model.MatchCandidate;
import com.drugbox.recognition.core.model.MatchType;
import com.drugbox.recognition.decision.CandidateRanking;
import com.drugbox.recognition.metrics.MetricsService;
import com.drugbox.recognition.metrics.NoOpMetricsService;
import com.drugbox.recognition.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Matches region text against the catalog with several independent algorithms and merges
 * their hits into one ranked candidate list.
 *
 * <p>Hits for the same catalog entry are merged: the highest confidence wins and the entry
 * is flagged multi-algorithm confirmed when two or more algorithms found it. A hit through a
 * brand alias resolves to the generic entry and keeps the brand. Only an exact hit can make
 * a candidate {@link MatchType#EXACT}.</p>
 */
public class MatchEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    public static final int DEFAULT_MAX_CANDIDATES = 5;

    private final DrugCatalog catalog;
    private final NormalizationEngine normalizer;
    private final List<MatchAlgorithm> algorithms;
    private final MatchCache cache;
    private final MetricsService metrics;
    private final int maxCandidates;

    public MatchEngine(DrugCatalog catalog, NormalizationEngine normalizer, CategoryThresholds thresholds) {
        this(catalog, normalizer, defaultAlgorithms(thresholds), new NoOpMatchCache(),
                new NoOpMetricsService(), DEFAULT_MAX_CANDIDATES);
    }

    /**
     * Engine with the default algorithms whose cache is dropped whenever {@code thresholds}
     * changes, so cached edit-distance hits never outlive the threshold that admitted them.
     */
    public MatchEngine(DrugCatalog catalog, NormalizationEngine normalizer, CategoryThresholds thresholds,
                       MatchCache cache, MetricsService metrics, int maxCandidates) {
        this(catalog, normalizer, defaultAlgorithms(thresholds), cache, metrics, maxCandidates);
        thresholds.addListener(cache::invalidateAll);
    }

    public MatchEngine(DrugCatalog catalog, NormalizationEngine normalizer, List<MatchAlgorithm> algorithms,
                       MatchCache cache, MetricsService metrics, int maxCandidates) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.algorithms = List.copyOf(algorithms);
        this.cache = cache;
        this.metrics = metrics;
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be > 0");
        }
        this.maxCandidates = maxCandidates;
    }

    public static List<MatchAlgorithm> defaultAlgorithms(CategoryThresholds thresholds) {
        return List.of(
                new ExactMatchAlgorithm(),
                new TokenContainmentAlgorithm(),
                new EditDistanceAlgorithm(thresholds),
                new PhoneticMatchAlgorithm()
        );
    }

    /**
     * Ranked candidates for one region's text, best first. Empty when nothing matched.
     */
    public List<MatchCandidate> match(String regionId, String text) {
        MatchQuery query = MatchQuery.of(text, normalizer);
        if (query.isEmpty()) {
            return List.of();
        }
        String cacheKey = query.cacheKey();
        var cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return stamp(cached.get(), regionId);
        }
        metrics.recordCacheMiss();

        Map<String, List<AlgorithmHit>> hitsByEntry = new LinkedHashMap<>();
        for (MatchAlgorithm algorithm : algorithms) {
            List<AlgorithmHit> hits;
            try {
                hits = algorithm.match(query, catalog);
            } catch (RuntimeException e) {
                log.warn("match.algorithm.failed algorithm={} error={}", algorithm.getName(), e.getMessage());
                continue;
            }
            log.debug("match.algorithm algorithm={} hits={}", algorithm.getName(), hits.size());
            for (AlgorithmHit hit : hits) {
                hitsByEntry.computeIfAbsent(hit.key().entryId(), k -> new ArrayList<>()).add(hit);
            }
        }

        List<MatchCandidate> merged = new ArrayList<>();
        for (Map.Entry<String, List<AlgorithmHit>> e : hitsByEntry.entrySet()) {
            catalog.findById(e.getKey()).ifPresent(entry -> merged.add(merge(entry, e.getValue())));
        }
        merged.sort(CandidateRanking.BY_CONFIDENCE);
        List<MatchCandidate> ranked = List.copyOf(merged.subList(0, Math.min(maxCandidates, merged.size())));
        cache.put(cacheKey, ranked);

        if (!ranked.isEmpty()) {
            MatchCandidate top = ranked.get(0);
            log.debug("match.ranked query='{}' candidates={} top={} confidence={}",
                    query.normalized(), ranked.size(), top.drugName(), top.confidence());
        }
        return stamp(ranked, regionId);
    }

    /**
     * Scales candidates found from reconstructed text by the reconstruction's confidence.
     * The result is never {@link MatchType#EXACT}, since the text was not read as such.
     */
    public static List<MatchCandidate> discount(List<MatchCandidate> candidates, double factor) {
        List<MatchCandidate> out = new ArrayList<>(candidates.size());
        for (MatchCandidate c : candidates) {
            int confidence = Math.min(99, (int) Math.round(c.confidence() * factor));
            out.add(new MatchCandidate(c.regionId(), c.drugId(), c.drugName(), confidence,
                    MatchType.forConfidence(confidence), c.algorithms(), c.multiAlgorithmConfirmed(),
                    c.genericMatch(), c.matchedBrand(), c.visualConfirmed(), c.category(), c.usageCount()));
        }
        return out;
    }

    private static MatchCandidate merge(CatalogEntry entry, List<AlgorithmHit> hits) {
        AlgorithmHit best = hits.get(0);
        TreeSet<String> names = new TreeSet<>();
        for (AlgorithmHit hit : hits) {
            names.add(hit.algorithm());
            if (hit.confidence() > best.confidence()
                    || (hit.confidence() == best.confidence() && best.key().brand() && !hit.key().brand())) {
                best = hit;
            }
        }
        boolean exact = best.exact() && best.confidence() == 100;
        int confidence = best.confidence();
        MatchType type = exact ? MatchType.EXACT : MatchType.forConfidence(confidence);
        CatalogKey key = best.key();
        return new MatchCandidate(null, entry.id(), entry.name(), confidence, type, names,
                names.size() >= 2, key.brand(), key.brand() ? key.surface() : null, false,
                entry.category(), entry.usageCount());
    }

    private static List<MatchCandidate> stamp(List<MatchCandidate> candidates, String regionId) {
        List<MatchCandidate> out = new ArrayList<>(candidates.size());
        for (MatchCandidate c : candidates) {
            out.add(c.forRegion(regionId));
        }
        return out;
    }
}
