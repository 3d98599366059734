package com.drugbox.recognition.core.model;

public enum BoxLighting {
    NORMAL,
    OVEREXPOSED,
    UNDEREXPOSED,
    LOW_CONTRAST
}
