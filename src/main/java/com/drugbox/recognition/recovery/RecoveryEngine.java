package com.drugbox.recognition.recovery;

import com.drugbox.recognition.catalog.CatalogKey;
import com.drugbox.recognition.catalog.DrugCatalog;
import com.drugbox.recognition.core.model.CatalogEntry;
import com.drugbox.recognition.core.model.ExtractedText;
import com.drugbox.recognition.core.model.RecoveredText;
import com.drugbox.recognition.core.model.RecoveryMethod;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.feature.VisualLookup;
import com.drugbox.recognition.feature.VisualMatch;
import com.drugbox.recognition.rules.NormalizationEngine;
import com.drugbox.recognition.similarity.LevenshteinSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reconstructs the text of damaged regions.
 *
 * <p>A region is damaged when its text quality is below the threshold or its box condition
 * is damaged. Reconstruction looks for a catalog name within a small edit distance of some
 * run of the text's tokens, or one that a truncated token is a long enough prefix of. When
 * the visual index independently points to the same drug, the reconstruction is tagged
 * {@link RecoveryMethod#VISUAL_CROSS_REFERENCE} and its confidence is raised. A failed
 * reconstruction passes the original text through, flagged low quality.</p>
 */
public class RecoveryEngine {
    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private static final int MIN_TOKEN = 3;
    /** A completed prefix is never as trustworthy as a full read. */
    private static final double PREFIX_FACTOR = 0.9;

    private final DrugCatalog catalog;
    private final NormalizationEngine normalizer;
    private final RecoveryOptions options;

    public RecoveryEngine(DrugCatalog catalog, NormalizationEngine normalizer, RecoveryOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    public boolean isDamaged(ExtractedText text, Region region) {
        return text.quality() < options.damageQualityThreshold() || region.condition().isDamaged();
    }

    public RecoveredText recover(ExtractedText text, Region region, VisualLookup visual) {
        if (!isDamaged(text, region)) {
            return RecoveredText.untouched(text);
        }
        String normalized = normalizer.normalize(text.text());
        if (normalized.isEmpty()) {
            log.debug("recovery.failed regionId={} reason=empty", region.id());
            return RecoveredText.failed(text);
        }
        if (readsAsCatalogName(normalized, text.text())) {
            return RecoveredText.untouched(text);
        }

        Reconstruction best = bestReconstruction(normalized);
        if (best == null) {
            log.debug("recovery.failed regionId={} text='{}' reason=no-candidate", region.id(), normalized);
            return RecoveredText.failed(text);
        }

        CatalogEntry entry = catalog.findById(best.key().entryId()).orElse(null);
        boolean visualAgrees = entry != null && visualAgrees(entry, visual);
        double confidence = visualAgrees ? Math.min(1.0, best.confidence() + options.visualBoost()) : best.confidence();
        if (confidence < options.minRecoveryConfidence()) {
            log.debug("recovery.failed regionId={} candidate='{}' confidence={} reason=below-minimum",
                    region.id(), best.key().key(), confidence);
            return RecoveredText.failed(text);
        }
        RecoveryMethod method = visualAgrees ? RecoveryMethod.VISUAL_CROSS_REFERENCE : RecoveryMethod.DICTIONARY_COMPLETION;
        log.info("recovery.succeeded regionId={} from='{}' to='{}' method={} confidence={}",
                region.id(), normalized, best.key().surface(), method, confidence);
        return new RecoveredText(text.regionId(), text.text(), best.key().surface(), method,
                confidence, true, false);
    }

    private boolean readsAsCatalogName(String normalized, String raw) {
        if (!catalog.lookupByKey(normalized).isEmpty()) {
            return true;
        }
        for (String line : normalizer.normalizeLines(raw)) {
            if (!catalog.lookupByKey(line).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private Reconstruction bestReconstruction(String normalized) {
        List<String> tokens = new ArrayList<>();
        for (String t : normalized.split(" ")) {
            if (t.length() >= MIN_TOKEN) {
                tokens.add(t);
            }
        }
        Reconstruction best = null;
        for (CatalogKey key : catalog.keys()) {
            String[] keyTokens = key.key().split(" ");
            for (int i = 0; i + keyTokens.length <= tokens.size(); i++) {
                String window = String.join(" ", tokens.subList(i, i + keyTokens.length));
                Reconstruction r = score(window, key);
                if (r != null && (best == null || r.isBetterThan(best))) {
                    best = r;
                }
            }
        }
        return best;
    }

    private Reconstruction score(String window, CatalogKey key) {
        String k = key.key();
        int distance = LevenshteinSimilarity.distance(window, k);
        double ratio = (double) distance / k.length();
        if (ratio <= options.maxDistanceRatio()) {
            return new Reconstruction(key, 1.0 - ratio);
        }
        if (window.length() >= options.minPrefixLength() && k.startsWith(window)) {
            double coverage = (double) window.length() / k.length();
            if (coverage >= options.minPrefixCoverage()) {
                return new Reconstruction(key, coverage * PREFIX_FACTOR);
            }
        }
        return null;
    }

    private boolean visualAgrees(CatalogEntry entry, VisualLookup visual) {
        if (visual == null || !visual.available()) {
            return false;
        }
        List<String> names = new ArrayList<>();
        names.add(normalizer.normalize(entry.name()));
        for (String alias : entry.brandAliases()) {
            names.add(normalizer.normalize(alias));
        }
        for (VisualMatch match : visual.matches()) {
            if (names.contains(normalizer.normalize(match.drugName()))) {
                return true;
            }
        }
        return false;
    }

    private record Reconstruction(CatalogKey key, double confidence) {

        boolean isBetterThan(Reconstruction other) {
            if (confidence != other.confidence) {
                return confidence > other.confidence;
            }
            if (key.brand() != other.key.brand()) {
                return !key.brand();
            }
            return key.key().compareTo(other.key.key()) < 0;
        }
    }
}
