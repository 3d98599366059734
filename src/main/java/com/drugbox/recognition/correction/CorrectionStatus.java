package com.drugbox.recognition.correction;

public enum CorrectionStatus {
    PENDING,
    DISPATCHED,
    FAILED
}
