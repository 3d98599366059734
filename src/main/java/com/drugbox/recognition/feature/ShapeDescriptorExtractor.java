package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.image.GrayImage;

import java.awt.image.BufferedImage;

/**
 * Coarse outline descriptors: aspect ratio, dark-pixel fill, edge-mass centroid and spread,
 * and the edge density along the crop border.
 */
public class ShapeDescriptorExtractor implements FeatureExtractor {

    static final double EDGE = 50.0;

    @Override
    public FeatureType getType() {
        return FeatureType.SHAPE;
    }

    @Override
    public FeatureVector extract(BufferedImage crop, GrayImage gray, GrayImage.EdgeMap edges) {
        int w = gray.width();
        int h = gray.height();
        double mean = gray.mean();
        int dark = 0;
        double total = 0, sx = 0, sy = 0, sxx = 0, syy = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (gray.at(x, y) < mean) {
                    dark++;
                }
                float m = edges.magnitude(x, y);
                if (m > EDGE) {
                    double nx = (double) x / w;
                    double ny = (double) y / h;
                    total += m;
                    sx += m * nx;
                    sy += m * ny;
                    sxx += m * nx * nx;
                    syy += m * ny * ny;
                }
            }
        }
        double[] values = new double[7];
        values[0] = Math.min(1.0, ((double) w / h) / 3.0);
        values[1] = (double) dark / (w * h);
        if (total > 0) {
            double mx = sx / total;
            double my = sy / total;
            values[2] = mx;
            values[3] = my;
            values[4] = Math.sqrt(Math.max(0, sxx / total - mx * mx));
            values[5] = Math.sqrt(Math.max(0, syy / total - my * my));
        }
        int band = Math.max(1, Math.min(w, h) / 10);
        double border = (edges.density(0, 0, w, band, EDGE) + edges.density(0, h - band, w, h, EDGE)
                + edges.density(0, 0, band, h, EDGE) + edges.density(w - band, 0, w, h, EDGE)) / 4.0;
        values[6] = border;
        return new FeatureVector(getType(), values, total > 0 ? 0.7 : 0.3);
    }
}
