package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureVector;
import com.drugbox.recognition.image.GrayImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered {@link FeatureExtractor} over a crop. A failing extractor only
 * loses its own feature type.
 */
public class VisualFeatureExtractor {
    private static final Logger log = LoggerFactory.getLogger(VisualFeatureExtractor.class);

    private final List<FeatureExtractor> extractors;

    public VisualFeatureExtractor() {
        this(List.of(
                new ColorHistogramExtractor(),
                new EdgeOrientationExtractor(),
                new TextLayoutExtractor(),
                new ShapeDescriptorExtractor()));
    }

    public VisualFeatureExtractor(List<FeatureExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public List<FeatureVector> extract(BufferedImage crop) {
        GrayImage gray = GrayImage.of(crop);
        GrayImage.EdgeMap edges = gray.edges();
        List<FeatureVector> vectors = new ArrayList<>(extractors.size());
        for (FeatureExtractor extractor : extractors) {
            try {
                vectors.add(extractor.extract(crop, gray, edges));
            } catch (RuntimeException e) {
                log.warn("feature.extract.failed type={} error={}", extractor.getType(), e.getMessage());
            }
        }
        return vectors;
    }
}
