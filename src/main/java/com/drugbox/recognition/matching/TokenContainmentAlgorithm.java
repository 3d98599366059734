package com.drugbox.recognition.matching;

import com.drugbox.recognition.catalog.CatalogKey;
import com.drugbox.recognition.catalog.DrugCatalog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Catalog key tokens found among the query tokens, exactly or as a truncated prefix.
 *
 * <p>Score is the covered share of the key's tokens scaled to {@value #MAX_CONFIDENCE}; a
 * prefix counts by the share of the key token it covers.</p>
 */
public class TokenContainmentAlgorithm implements MatchAlgorithm {

    public static final String NAME = "token-containment";

    static final int MAX_CONFIDENCE = 95;
    private static final int MIN_QUERY_TOKEN = 3;
    private static final int MIN_PREFIX = 4;

    private final int minConfidence;

    public TokenContainmentAlgorithm() {
        this(50);
    }

    public TokenContainmentAlgorithm(int minConfidence) {
        this.minConfidence = minConfidence;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<AlgorithmHit> match(MatchQuery query, DrugCatalog catalog) {
        Set<String> queryTokens = new HashSet<>();
        for (String token : query.tokens()) {
            if (token.length() >= MIN_QUERY_TOKEN) {
                queryTokens.add(token);
            }
        }
        if (queryTokens.isEmpty()) {
            return List.of();
        }
        List<AlgorithmHit> hits = new ArrayList<>();
        for (CatalogKey key : catalog.keys()) {
            String[] keyTokens = key.key().split(" ");
            double covered = 0.0;
            for (String keyToken : keyTokens) {
                covered += coverage(keyToken, queryTokens);
            }
            int confidence = (int) Math.round(covered / keyTokens.length * MAX_CONFIDENCE);
            if (confidence >= minConfidence) {
                hits.add(new AlgorithmHit(key, Math.min(confidence, MAX_CONFIDENCE), NAME, false));
            }
        }
        return hits;
    }

    private static double coverage(String keyToken, Set<String> queryTokens) {
        if (queryTokens.contains(keyToken)) {
            return 1.0;
        }
        double best = 0.0;
        for (String q : queryTokens) {
            if (q.length() >= MIN_PREFIX && q.length() < keyToken.length() && keyToken.startsWith(q)) {
                best = Math.max(best, (double) q.length() / keyToken.length());
            }
        }
        return best;
    }
}
