package com.drugbox.recognition.detection;

/**
 * The image as a whole could not be processed. The only failure that aborts a scan.
 */
public class DetectionFailureException extends RuntimeException {

    public DetectionFailureException(String message) {
        super(message);
    }

    public DetectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
