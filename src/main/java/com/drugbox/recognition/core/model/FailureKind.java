package com.drugbox.recognition.core.model;

public enum FailureKind {
    EXTRACTION,
    RECOVERY,
    INDEX_UNAVAILABLE,
    TIMEOUT
}
