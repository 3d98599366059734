package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.FeatureVector;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-type and weighted similarity between two sets of feature vectors.
 *
 * <p>Colour histograms compare by histogram intersection, every other type by cosine
 * similarity. Types missing on either side drop out and the remaining weights are
 * renormalized.</p>
 */
public class FeatureSimilarity {

    public static final double DEFAULT_AGREEMENT = 0.8;

    private final FeatureWeights weights;
    private final double agreementFloor;

    public FeatureSimilarity(FeatureWeights weights) {
        this(weights, DEFAULT_AGREEMENT);
    }

    public FeatureSimilarity(FeatureWeights weights, double agreementFloor) {
        this.weights = weights;
        this.agreementFloor = agreementFloor;
    }

    public Comparison compare(List<FeatureVector> a, List<FeatureVector> b) {
        Map<FeatureType, FeatureVector> left = byType(a);
        Map<FeatureType, FeatureVector> right = byType(b);
        Map<FeatureType, Double> perType = new EnumMap<>(FeatureType.class);
        double weighted = 0.0;
        double weightSum = 0.0;
        for (FeatureType type : FeatureType.values()) {
            FeatureVector l = left.get(type);
            FeatureVector r = right.get(type);
            if (l == null || r == null || l.dimension() != r.dimension()) {
                continue;
            }
            double sim = type == FeatureType.COLOR_HISTOGRAM
                    ? intersection(l.values(), r.values())
                    : cosine(l.values(), r.values());
            perType.put(type, sim);
            weighted += weights.weightOf(type) * sim;
            weightSum += weights.weightOf(type);
        }
        double combined = weightSum == 0 ? 0.0 : weighted / weightSum;
        Set<FeatureType> agreeing = EnumSet.noneOf(FeatureType.class);
        perType.forEach((type, sim) -> {
            if (sim >= agreementFloor) {
                agreeing.add(type);
            }
        });
        return new Comparison(combined, perType, agreeing);
    }

    static double cosine(double[] a, double[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 && nb == 0) {
            return 1.0;
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, dot / (Math.sqrt(na) * Math.sqrt(nb))));
    }

    static double intersection(double[] a, double[] b) {
        double sum = 0;
        double massA = 0;
        double massB = 0;
        for (int i = 0; i < a.length; i++) {
            sum += Math.min(a[i], b[i]);
            massA += a[i];
            massB += b[i];
        }
        double mass = Math.min(massA, massB);
        return mass == 0 ? 0.0 : Math.min(1.0, sum / mass);
    }

    private static Map<FeatureType, FeatureVector> byType(List<FeatureVector> vectors) {
        Map<FeatureType, FeatureVector> map = new EnumMap<>(FeatureType.class);
        for (FeatureVector v : vectors) {
            map.put(v.type(), v);
        }
        return map;
    }

    /**
     * @param combined  weighted similarity in [0, 1]
     * @param perType   similarity per compared type
     * @param agreeing  types whose similarity reached the agreement floor
     */
    public record Comparison(double combined, Map<FeatureType, Double> perType, Set<FeatureType> agreeing) {
        public Comparison {
            perType = Map.copyOf(perType);
            agreeing = Set.copyOf(agreeing);
        }
    }
}
