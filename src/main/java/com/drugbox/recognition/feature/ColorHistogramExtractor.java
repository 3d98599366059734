package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.image.GrayImage;

import java.awt.image.BufferedImage;

/**
 * Per-channel RGB histogram, normalized to sum to 1. Confidence is the histogram's
 * entropy relative to the maximum possible, so a flat single-colour crop scores low.
 */
public class ColorHistogramExtractor implements FeatureExtractor {

    static final int BINS_PER_CHANNEL = 16;

    @Override
    public FeatureType getType() {
        return FeatureType.COLOR_HISTOGRAM;
    }

    @Override
    public FeatureVector extract(BufferedImage crop, GrayImage gray, GrayImage.EdgeMap edges) {
        int w = crop.getWidth();
        int h = crop.getHeight();
        int[] rgb = crop.getRGB(0, 0, w, h, null, 0, w);
        double[] hist = new double[3 * BINS_PER_CHANNEL];
        int shift = 8 - Integer.numberOfTrailingZeros(BINS_PER_CHANNEL);
        for (int p : rgb) {
            hist[((p >> 16) & 0xFF) >> shift]++;
            hist[BINS_PER_CHANNEL + (((p >> 8) & 0xFF) >> shift)]++;
            hist[2 * BINS_PER_CHANNEL + ((p & 0xFF) >> shift)]++;
        }
        double total = 3.0 * rgb.length;
        double entropy = 0.0;
        for (int i = 0; i < hist.length; i++) {
            hist[i] /= total;
            if (hist[i] > 0) {
                entropy -= hist[i] * (Math.log(hist[i]) / Math.log(2));
            }
        }
        double maxEntropy = Math.log(hist.length) / Math.log(2);
        return new FeatureVector(getType(), hist, Math.min(1.0, entropy / maxEntropy));
    }
}
