package com.drugbox.recognition.tracing;

/**
 * Tracing seam: one span per scan, one child span per region.
 * {@link NoOpScanTracer} is the default.
 */
public interface ScanTracer {

    TraceSpan startScan(String scanId, String source);

    TraceSpan startRegion(String scanId, String regionId);

    TraceSpan startOptimize(String operationId);
}
