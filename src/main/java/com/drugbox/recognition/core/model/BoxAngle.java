package com.drugbox.recognition.core.model;

/**
 * Which face of the box the camera sees, judged from where the print sits in the crop.
 */
public enum BoxAngle {
    FRONT,
    TOP,
    BOTTOM,
    LEFT_SIDE,
    RIGHT_SIDE,
    ANGLED
}
