package com.drugbox.recognition.detection;

/**
 * Proposal filtering, suppression and cropping parameters.
 *
 * @param minRegionWidth  proposals narrower than this are dropped, in pixels
 * @param minRegionHeight proposals shorter than this are dropped, in pixels
 * @param minAspectRatio  lowest accepted width/height
 * @param maxAspectRatio  highest accepted width/height
 * @param maxAreaRatio    proposals covering more of the image than this are dropped
 * @param iouThreshold    overlap above which the weaker of two proposals is suppressed
 * @param cropPadding     pixels added around each crop
 */
public record DetectionOptions(
        int minRegionWidth,
        int minRegionHeight,
        double minAspectRatio,
        double maxAspectRatio,
        double maxAreaRatio,
        double iouThreshold,
        int cropPadding
) {
    public DetectionOptions {
        if (minRegionWidth <= 0 || minRegionHeight <= 0) {
            throw new IllegalArgumentException("minimum region size must be > 0");
        }
        if (minAspectRatio <= 0 || maxAspectRatio < minAspectRatio) {
            throw new IllegalArgumentException("aspect ratio bounds must satisfy 0 < min <= max");
        }
        if (maxAreaRatio <= 0.0 || maxAreaRatio > 1.0) {
            throw new IllegalArgumentException("maxAreaRatio must be in (0, 1]");
        }
        if (iouThreshold <= 0.0 || iouThreshold > 1.0) {
            throw new IllegalArgumentException("iouThreshold must be in (0, 1]");
        }
        if (cropPadding < 0) {
            throw new IllegalArgumentException("cropPadding must be >= 0");
        }
    }

    /**
     * 100 px minimum side, aspect 0.3 to 3.0, at most 80% of the frame, IoU 0.5, 10 px padding.
     */
    public static DetectionOptions defaults() {
        return new DetectionOptions(100, 100, 0.3, 3.0, 0.8, 0.5, 10);
    }
}
