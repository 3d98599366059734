package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reference {@link VisualCatalogStore}: linear scan over images held in memory.
 * Not synchronized; {@link FeatureIndex} serializes writers against readers.
 */
public class InMemoryVisualCatalogStore implements VisualCatalogStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryVisualCatalogStore.class);

    private final FeatureSimilarity similarity;
    private final Map<String, StoredImage> images = new LinkedHashMap<>();

    public InMemoryVisualCatalogStore(FeatureSimilarity similarity) {
        this.similarity = similarity;
    }

    @Override
    public List<VisualMatch> nearest(List<FeatureVector> query, int limit) {
        List<VisualMatch> matches = new ArrayList<>();
        for (StoredImage image : images.values()) {
            FeatureSimilarity.Comparison c = similarity.compare(query, image.features());
            matches.add(new VisualMatch(image.imageId(), image.drugName(), c.combined(), c.agreeing()));
        }
        matches.sort(Comparator.comparingDouble(VisualMatch::similarity).reversed()
                .thenComparing(VisualMatch::imageId));
        return matches.subList(0, Math.min(limit, matches.size()));
    }

    @Override
    public void upsert(StoredImage image) {
        images.put(image.imageId(), image);
    }

    @Override
    public int removeDuplicates(double threshold) {
        List<StoredImage> kept = new ArrayList<>();
        int removed = 0;
        Iterator<StoredImage> it = images.values().iterator();
        while (it.hasNext()) {
            StoredImage image = it.next();
            boolean duplicate = false;
            for (StoredImage k : kept) {
                if (sameDrug(k, image) && similarity.compare(k.features(), image.features()).combined() >= threshold) {
                    duplicate = true;
                    break;
                }
            }
            if (duplicate) {
                it.remove();
                removed++;
                log.debug("visual.store.duplicate imageId={} drug='{}'", image.imageId(), image.drugName());
            } else {
                kept.add(image);
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return images.size();
    }

    /**
     * Copies the stored images. Not guarded by {@link FeatureIndex}'s lock: call it before
     * scanning starts or while no optimization can run.
     */
    public List<StoredImage> snapshot() {
        return List.copyOf(images.values());
    }

    /**
     * Adds images in bulk at startup, before the store is handed to a {@link FeatureIndex}.
     * Later changes go through {@link FeatureIndex#stage} and {@link FeatureIndex#optimize()}.
     */
    public void load(List<StoredImage> stored) {
        stored.forEach(this::upsert);
    }

    private static boolean sameDrug(StoredImage a, StoredImage b) {
        return a.drugName().trim().toLowerCase(Locale.ROOT).equals(b.drugName().trim().toLowerCase(Locale.ROOT));
    }
}
