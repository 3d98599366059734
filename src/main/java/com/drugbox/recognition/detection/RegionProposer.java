package com.drugbox.recognition.detection;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Object-detection capability: finds box-shaped candidates in an image. Proposals may
 * overlap; the detector suppresses duplicates.
 */
public interface RegionProposer {

    List<Proposal> propose(BufferedImage image);
}
