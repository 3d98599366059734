package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.image.GrayImage;

import java.awt.image.BufferedImage;

/**
 * Eight-bin gradient orientation histogram of strong edges, weighted by magnitude, plus
 * the strong-edge density as a ninth component.
 */
public class EdgeOrientationExtractor implements FeatureExtractor {

    static final int ORIENTATION_BINS = 8;
    static final double STRONG_EDGE = 50.0;

    @Override
    public FeatureType getType() {
        return FeatureType.EDGE;
    }

    @Override
    public FeatureVector extract(BufferedImage crop, GrayImage gray, GrayImage.EdgeMap edges) {
        double[] values = new double[ORIENTATION_BINS + 1];
        double weight = 0.0;
        int strong = 0;
        int total = edges.width() * edges.height();
        for (int y = 0; y < edges.height(); y++) {
            for (int x = 0; x < edges.width(); x++) {
                float m = edges.magnitude(x, y);
                if (m <= STRONG_EDGE) {
                    continue;
                }
                strong++;
                double angle = edges.direction(x, y) + Math.PI;
                int bin = (int) (angle / (2 * Math.PI) * ORIENTATION_BINS) % ORIENTATION_BINS;
                values[bin] += m;
                weight += m;
            }
        }
        if (weight > 0) {
            for (int i = 0; i < ORIENTATION_BINS; i++) {
                values[i] /= weight;
            }
        }
        double density = total == 0 ? 0.0 : (double) strong / total;
        values[ORIENTATION_BINS] = density;
        return new FeatureVector(getType(), values, Math.min(1.0, density * 10));
    }
}
