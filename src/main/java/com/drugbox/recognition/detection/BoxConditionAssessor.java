package com.drugbox.recognition.detection;

import com.drugbox.recognition.core.model.BoxAngle;
import com.drugbox.recognition.core.model.BoxCondition;
import com.drugbox.recognition.core.model.BoxLighting;
import com.drugbox.recognition.image.GrayImage;

import java.awt.image.BufferedImage;

/**
 * Estimates a crop's physical condition, viewing angle and lighting from simple image
 * statistics: mean brightness, luminance spread and Sobel edge density.
 */
public class BoxConditionAssessor {

    static final double EDGE_THRESHOLD = 50.0;
    /** Edge density of a crisply printed box face. */
    static final double FULL_PRINT_DENSITY = 0.08;

    public BoxAssessment assess(BufferedImage crop) {
        GrayImage gray = GrayImage.of(crop);
        GrayImage.EdgeMap edges = gray.edges();

        double brightness = gray.mean() / 255.0;
        double contrast = Math.min(1.0, gray.stddev() / 64.0);
        double edgeDensity = edges.density(0, 0, gray.width(), gray.height(), EDGE_THRESHOLD);

        return new BoxAssessment(
                condition(contrast, edgeDensity),
                angle(edges),
                lighting(brightness, contrast),
                brightness, contrast, edgeDensity);
    }

    static BoxLighting lighting(double brightness, double contrast) {
        if (brightness > 0.8) {
            return BoxLighting.OVEREXPOSED;
        }
        if (brightness < 0.2) {
            return BoxLighting.UNDEREXPOSED;
        }
        if (contrast < 0.3) {
            return BoxLighting.LOW_CONTRAST;
        }
        return BoxLighting.NORMAL;
    }

    static BoxCondition condition(double contrast, double edgeDensity) {
        double print = Math.min(1.0, edgeDensity / FULL_PRINT_DENSITY);
        double score = 0.5 * print + 0.5 * contrast;
        if (score >= 0.75) {
            return BoxCondition.PERFECT;
        }
        if (score >= 0.5) {
            return BoxCondition.WORN;
        }
        if (score >= 0.25) {
            return BoxCondition.DAMAGED;
        }
        return BoxCondition.SEVERELY_DAMAGED;
    }

    /**
     * Where the edge mass sits: centred print reads as a front view, print pushed to one
     * side suggests that face is turned toward the camera.
     */
    static BoxAngle angle(GrayImage.EdgeMap edges) {
        double total = 0;
        double sx = 0;
        double sy = 0;
        for (int y = 0; y < edges.height(); y++) {
            for (int x = 0; x < edges.width(); x++) {
                float m = edges.magnitude(x, y);
                if (m > EDGE_THRESHOLD) {
                    total += m;
                    sx += m * x;
                    sy += m * y;
                }
            }
        }
        if (total == 0) {
            return BoxAngle.FRONT;
        }
        double cx = sx / total / Math.max(1, edges.width() - 1);
        double cy = sy / total / Math.max(1, edges.height() - 1);
        double dx = Math.abs(cx - 0.5);
        double dy = Math.abs(cy - 0.5);
        if (dx < 0.15 && dy < 0.15) {
            return BoxAngle.FRONT;
        }
        if (dx >= 0.15 && dy >= 0.15) {
            return BoxAngle.ANGLED;
        }
        if (dy >= 0.15) {
            return cy < 0.5 ? BoxAngle.TOP : BoxAngle.BOTTOM;
        }
        return cx < 0.5 ? BoxAngle.LEFT_SIDE : BoxAngle.RIGHT_SIDE;
    }
}
