package com.drugbox.recognition.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-backed {@link ScanTracer}.
 *
 * <p>Region work runs on pool threads, so region spans are not parented through the
 * thread-local context; they carry the {@code drugbox.scan_id} attribute instead.</p>
 */
public class OpenTelemetryScanTracer implements ScanTracer {

    private final Tracer tracer;

    public OpenTelemetryScanTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public TraceSpan startScan(String scanId, String source) {
        return new OtelSpan(tracer.spanBuilder("drugbox.scan").startSpan())
                .attribute("drugbox.scan_id", scanId)
                .attribute("drugbox.source", source);
    }

    @Override
    public TraceSpan startRegion(String scanId, String regionId) {
        return new OtelSpan(tracer.spanBuilder("drugbox.region").startSpan())
                .attribute("drugbox.scan_id", scanId)
                .attribute("drugbox.region_id", regionId);
    }

    @Override
    public TraceSpan startOptimize(String operationId) {
        return new OtelSpan(tracer.spanBuilder("drugbox.index.optimize").startSpan())
                .attribute("drugbox.operation_id", operationId);
    }

    private static final class OtelSpan implements TraceSpan {

        private final Span span;
        private boolean failed;

        OtelSpan(Span span) {
            this.span = span;
        }

        @Override
        public TraceSpan attribute(String key, String value) {
            span.setAttribute(key, value);
            return this;
        }

        @Override
        public TraceSpan attribute(String key, long value) {
            span.setAttribute(key, value);
            return this;
        }

        @Override
        public void fail(Throwable cause) {
            failed = true;
            span.recordException(cause);
            span.setStatus(StatusCode.ERROR);
        }

        @Override
        public void close() {
            if (!failed) {
                span.setStatus(StatusCode.OK);
            }
            span.end();
        }
    }
}
