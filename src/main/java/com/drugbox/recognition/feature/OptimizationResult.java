package com.drugbox.recognition.feature;

/**
 * @param duplicatesRemoved near-duplicate images dropped
 * @param vectorsUpdated    images written or replaced from staged corrections
 * @param imagesRetained    images in the store afterwards
 */
public record OptimizationResult(int duplicatesRemoved, int vectorsUpdated, int imagesRetained) {
}
