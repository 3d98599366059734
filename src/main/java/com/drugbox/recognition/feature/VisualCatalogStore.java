package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureVector;

import java.util.List;

/**
 * Persistent store of labelled reference images. Called under the {@link FeatureIndex}
 * lock, so implementations need not coordinate readers with maintenance themselves.
 */
public interface VisualCatalogStore {

    /**
     * Up to {@code limit} most similar images, best first.
     *
     * @throws IndexUnavailableException when the store cannot be reached
     */
    List<VisualMatch> nearest(List<FeatureVector> query, int limit);

    /**
     * Adds an image, replacing one with the same id.
     */
    void upsert(StoredImage image);

    /**
     * Removes near-duplicate images of the same drug.
     *
     * @return number of images removed
     */
    int removeDuplicates(double threshold);

    int size();
}
