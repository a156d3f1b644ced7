package com.botanical.ingestion.tracing;

/**
 * One traced unit of ingestion work. Closing the span ends it, so callers open
 * it in try-with-resources around the provider call or store write.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
