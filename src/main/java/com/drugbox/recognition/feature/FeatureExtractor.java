package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.image.GrayImage;

import java.awt.image.BufferedImage;

/**
 * Computes one feature type from a crop. Extractors share nothing and may run in any order.
 */
public interface FeatureExtractor {

    FeatureType getType();

    /**
     * @param crop  colour crop
     * @param gray  luminance of the same crop
     * @param edges Sobel gradients of {@code gray}
     */
    FeatureVector extract(BufferedImage crop, GrayImage gray, GrayImage.EdgeMap edges);
}
