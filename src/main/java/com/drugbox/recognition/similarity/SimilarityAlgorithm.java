package com.drugbox.recognition.similarity;

/**
 * String similarity in [0.0, 1.0], where 1.0 means identical.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
