package com.drugbox.recognition.tracing;

public class NoOpScanTracer implements ScanTracer {

    private static final TraceSpan NO_OP_SPAN = new TraceSpan() {
        @Override
        public TraceSpan attribute(String key, String value) {
            return this;
        }

        @Override
        public TraceSpan attribute(String key, long value) {
            return this;
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public TraceSpan startScan(String scanId, String source) {
        return NO_OP_SPAN;
    }

    @Override
    public TraceSpan startRegion(String scanId, String regionId) {
        return NO_OP_SPAN;
    }

    @Override
    public TraceSpan startOptimize(String operationId) {
        return NO_OP_SPAN;
    }
}
