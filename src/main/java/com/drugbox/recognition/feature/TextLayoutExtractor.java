package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.image.GrayImage;

import java.awt.image.BufferedImage;

/**
 * Where print sits on the box face. The crop is split into square cells; a cell counts as
 * text when more than 15% of its pixels carry an edge above 30. Eight statistics follow:
 * text-cell share, centroid x and y, spread x and y, and the share of text cells in the
 * top, middle and bottom thirds.
 */
public class TextLayoutExtractor implements FeatureExtractor {

    static final int CELL = 32;
    static final double EDGE = 30.0;
    static final double TEXT_CELL_DENSITY = 0.15;

    @Override
    public FeatureType getType() {
        return FeatureType.TEXT_LAYOUT;
    }

    @Override
    public FeatureVector extract(BufferedImage crop, GrayImage gray, GrayImage.EdgeMap edges) {
        int cols = Math.max(1, edges.width() / CELL);
        int rows = Math.max(1, edges.height() / CELL);
        int cellW = Math.max(1, edges.width() / cols);
        int cellH = Math.max(1, edges.height() / rows);

        int textCells = 0;
        double sx = 0, sy = 0, sxx = 0, syy = 0;
        int[] thirds = new int[3];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double density = edges.density(c * cellW, r * cellH, (c + 1) * cellW, (r + 1) * cellH, EDGE);
                if (density > TEXT_CELL_DENSITY) {
                    double cx = (c + 0.5) / cols;
                    double cy = (r + 0.5) / rows;
                    textCells++;
                    sx += cx;
                    sy += cy;
                    sxx += cx * cx;
                    syy += cy * cy;
                    thirds[Math.min(2, (int) (cy * 3))]++;
                }
            }
        }
        double[] values = new double[8];
        values[0] = (double) textCells / (rows * cols);
        if (textCells > 0) {
            double mx = sx / textCells;
            double my = sy / textCells;
            values[1] = mx;
            values[2] = my;
            values[3] = Math.sqrt(Math.max(0, sxx / textCells - mx * mx));
            values[4] = Math.sqrt(Math.max(0, syy / textCells - my * my));
            values[5] = (double) thirds[0] / textCells;
            values[6] = (double) thirds[1] / textCells;
            values[7] = (double) thirds[2] / textCells;
        }
        return new FeatureVector(getType(), values, textCells > 0 ? 0.8 : 0.2);
    }
}
