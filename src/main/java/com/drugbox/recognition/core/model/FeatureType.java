package com.drugbox.recognition.core.model;

/**
 * Kinds of visual feature computed per region.
 */
public enum FeatureType {
    /** Normalized RGB histogram. */
    COLOR_HISTOGRAM,
    /** Magnitude-weighted Sobel orientation histogram. */
    EDGE,
    /** Grid statistics of where print sits on the box face. */
    TEXT_LAYOUT,
    /** Coarse outline descriptors. */
    SHAPE
}
