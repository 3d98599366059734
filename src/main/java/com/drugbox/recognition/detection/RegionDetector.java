package com.drugbox.recognition.detection;

import com.drugbox.recognition.core.model.BoundingBox;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.image.ImageCrops;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns an image into an ordered list of non-overlapping regions.
 *
 * <p>Proposals are filtered by size, aspect ratio and frame coverage, then suppressed by
 * intersection-over-union, keeping the more confident of any two overlapping boxes. Kept
 * regions are ordered top-to-bottom, left-to-right. When nothing survives, or the proposer
 * fails, the whole image becomes a single fallback region so the scan can still proceed.</p>
 */
public class RegionDetector {
    private static final Logger log = LoggerFactory.getLogger(RegionDetector.class);

    static final double FALLBACK_CONFIDENCE = 0.5;

    private static final Comparator<Proposal> BY_STRENGTH =
            Comparator.comparingDouble(Proposal::confidence).reversed()
                    .thenComparing(Comparator.comparingLong((Proposal p) -> p.box().area()).reversed())
                    .thenComparingInt(p -> p.box().y())
                    .thenComparingInt(p -> p.box().x());

    private static final Comparator<Proposal> READING_ORDER =
            Comparator.comparingInt((Proposal p) -> p.box().y())
                    .thenComparingInt(p -> p.box().x());

    private final RegionProposer proposer;
    private final BoxConditionAssessor assessor;
    private final DetectionOptions options;

    public RegionDetector(RegionProposer proposer, DetectionOptions options) {
        this(proposer, new BoxConditionAssessor(), options);
    }

    public RegionDetector(RegionProposer proposer, BoxConditionAssessor assessor, DetectionOptions options) {
        this.proposer = Objects.requireNonNull(proposer, "proposer is required");
        this.assessor = Objects.requireNonNull(assessor, "assessor is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * @param scanId prefix for the generated region ids
     * @throws DetectionFailureException if the image is missing or empty
     */
    public List<Region> detect(BufferedImage image, String scanId) {
        if (!ImageCrops.isUsable(image)) {
            throw new DetectionFailureException("Image is missing or has zero size");
        }
        List<Proposal> proposals;
        try {
            proposals = proposer.propose(image);
        } catch (RuntimeException e) {
            log.warn("detection.proposer.failed scanId={} error={}", scanId, e.getMessage());
            proposals = List.of();
        }

        List<Proposal> kept = suppress(filter(proposals, image.getWidth(), image.getHeight()));
        if (kept.isEmpty()) {
            log.info("detection.fallback scanId={} proposals={}", scanId, proposals.size());
            BoundingBox whole = new BoundingBox(0, 0, image.getWidth(), image.getHeight());
            return List.of(toRegion(image, scanId, 0, whole, FALLBACK_CONFIDENCE, true));
        }

        kept.sort(READING_ORDER);
        List<Region> regions = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            Proposal p = kept.get(i);
            BoundingBox padded = p.box().expand(options.cropPadding(), image.getWidth(), image.getHeight());
            regions.add(toRegion(image, scanId, i, padded, p.confidence(), false));
        }
        log.debug("detection.completed scanId={} proposals={} regions={}", scanId, proposals.size(), regions.size());
        return regions;
    }

    List<Proposal> filter(List<Proposal> proposals, int imageWidth, int imageHeight) {
        double imageArea = (double) imageWidth * imageHeight;
        List<Proposal> out = new ArrayList<>();
        for (Proposal p : proposals) {
            BoundingBox b = clip(p.box(), imageWidth, imageHeight);
            if (b == null) {
                continue;
            }
            double aspect = b.aspectRatio();
            if (b.width() < options.minRegionWidth() || b.height() < options.minRegionHeight()
                    || aspect < options.minAspectRatio() || aspect > options.maxAspectRatio()
                    || b.area() / imageArea > options.maxAreaRatio()) {
                log.debug("detection.proposal.rejected box={} confidence={}", b, p.confidence());
                continue;
            }
            out.add(new Proposal(b, p.confidence()));
        }
        return out;
    }

    List<Proposal> suppress(List<Proposal> proposals) {
        List<Proposal> sorted = new ArrayList<>(proposals);
        sorted.sort(BY_STRENGTH);
        List<Proposal> kept = new ArrayList<>();
        for (Proposal candidate : sorted) {
            boolean overlaps = false;
            for (Proposal k : kept) {
                if (candidate.box().iou(k.box()) > options.iouThreshold()) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private Region toRegion(BufferedImage image, String scanId, int index, BoundingBox box,
                            double confidence, boolean fallback) {
        BufferedImage crop = ImageCrops.crop(image, box);
        BoxAssessment assessment = assessor.assess(crop);
        return new Region(scanId + "-r" + index, index, box, crop, confidence,
                assessment.condition(), assessment.angle(), assessment.lighting(), fallback);
    }

    private static BoundingBox clip(BoundingBox box, int imageWidth, int imageHeight) {
        int x = Math.max(0, box.x());
        int y = Math.max(0, box.y());
        int r = Math.min(imageWidth, box.right());
        int b = Math.min(imageHeight, box.bottom());
        if (r <= x || b <= y) {
            return null;
        }
        return new BoundingBox(x, y, r - x, b - y);
    }
}
