package com.drugbox.recognition.audit;

/**
 * Auditable events of the recognition pipeline.
 */
public enum AuditAction {
    SCAN_STARTED,
    SCAN_COMPLETED,
    SCAN_CANCELED,
    REGION_FAILED,
    DUPLICATE_COLLAPSED,
    CORRECTION_SUBMITTED,
    CORRECTION_DISPATCHED,
    INDEX_OPTIMIZED
}
