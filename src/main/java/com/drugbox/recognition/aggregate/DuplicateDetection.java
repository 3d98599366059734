package com.drugbox.recognition.aggregate;

/**
 * Two regions showed the same drug; {@code keptRegionId} represents the detection and
 * {@code duplicateRegionId} is not counted again.
 */
public record DuplicateDetection(String drugId, String drugName, String keptRegionId, String duplicateRegionId,
                                 int keptConfidence, int duplicateConfidence) {
}
