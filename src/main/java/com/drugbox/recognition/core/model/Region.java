package com.drugbox.recognition.core.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * One candidate drug box cut out of the source image.
 *
 * @param id         identifier unique across scans
 * @param index      position of the region in detection order, starting at 0
 * @param box        location in the source image
 * @param crop       padded pixel crop handed to the downstream stages
 * @param confidence detection confidence in [0, 1]
 * @param condition  estimated physical condition
 * @param angle      estimated viewing angle
 * @param lighting   estimated lighting
 * @param fallback   true when the whole image was used because nothing was detected
 */
public record Region(
        String id,
        int index,
        BoundingBox box,
        BufferedImage crop,
        double confidence,
        BoxCondition condition,
        BoxAngle angle,
        BoxLighting lighting,
        boolean fallback
) {
    public Region {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(box, "box is required");
        Objects.requireNonNull(crop, "crop is required");
        Objects.requireNonNull(condition, "condition is required");
        Objects.requireNonNull(angle, "angle is required");
        Objects.requireNonNull(lighting, "lighting is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }
}
