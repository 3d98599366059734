package com.drugbox.recognition.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenTelemetryScanTracerTest {

    @Mock
    private Tracer tracer;
    @Mock
    private SpanBuilder spanBuilder;
    @Mock
    private Span span;

    private OpenTelemetryScanTracer scanTracer;

    @BeforeEach
    void setUp() {
        scanTracer = new OpenTelemetryScanTracer(tracer);
    }

    @Test
    @DisplayName("Should carry the scan id on the scan span and end OK")
    void scanSpan() {
        when(tracer.spanBuilder("drugbox.scan")).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);

        try (TraceSpan s = scanTracer.startScan("scan-1", "CAMERA")) {
            s.attribute("drugbox.regions", 2L);
        }

        verify(span).setAttribute("drugbox.scan_id", "scan-1");
        verify(span).setAttribute("drugbox.source", "CAMERA");
        verify(span).setAttribute("drugbox.regions", 2L);
        verify(span).setStatus(StatusCode.OK);
        verify(span).end();
    }

    @Test
    @DisplayName("Should record the error on a failed region span and keep ERROR status")
    void failedRegion() {
        when(tracer.spanBuilder("drugbox.region")).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        IllegalStateException error = new IllegalStateException("ocr down");

        try (TraceSpan s = scanTracer.startRegion("scan-1", "scan-1-r0")) {
            s.fail(error);
        }

        verify(span).setAttribute("drugbox.region_id", "scan-1-r0");
        verify(span).recordException(error);
        verify(span).setStatus(StatusCode.ERROR);
        verify(span, never()).setStatus(StatusCode.OK);
        verify(span).end();
    }

    @Test
    @DisplayName("Should work against the no-op OpenTelemetry")
    void noopOpenTelemetry() {
        ScanTracer real = new OpenTelemetryScanTracer(OpenTelemetry.noop().getTracer("drugbox"));

        assertDoesNotThrow(() -> {
            try (TraceSpan s = real.startOptimize("op-1")) {
                s.attribute("duplicatesRemoved", 0L).attribute("note", "x");
            }
        });
    }

    @Test
    @DisplayName("Should accept everything in the no-op tracer")
    void noOpTracer() {
        ScanTracer noOp = new NoOpScanTracer();
        TraceSpan s = noOp.startScan("scan-1", "CAMERA");

        assertSame(s, s.attribute("k", "v").attribute("n", 1L));
        assertDoesNotThrow(() -> {
            s.fail(new RuntimeException("x"));
            s.close();
        });
    }
}
