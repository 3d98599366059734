package com.drugbox.recognition.tracing;

/**
 * A traced unit of pipeline work; closing it ends the span.
 */
public interface TraceSpan extends AutoCloseable {

    TraceSpan attribute(String key, String value);

    TraceSpan attribute(String key, long value);

    void fail(Throwable cause);

    @Override
    void close();
}
