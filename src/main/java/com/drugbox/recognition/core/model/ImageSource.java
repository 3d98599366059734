package com.drugbox.recognition.core.model;

/**
 * Where the scanned image came from. Carried through to the aggregated result.
 */
public enum ImageSource {
    CAMERA,
    GALLERY,
    BATCH_SCAN,
    FILE_IMPORT
}
