package com.drugbox.recognition.detection;

import com.drugbox.recognition.core.model.BoxAngle;
import com.drugbox.recognition.core.model.BoxCondition;
import com.drugbox.recognition.core.model.BoxLighting;

/**
 * Condition, angle and lighting of one crop, with the measurements they came from.
 */
public record BoxAssessment(
        BoxCondition condition,
        BoxAngle angle,
        BoxLighting lighting,
        double brightness,
        double contrast,
        double edgeDensity
) {
}
