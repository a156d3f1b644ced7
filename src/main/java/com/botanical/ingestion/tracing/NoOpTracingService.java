package com.botanical.ingestion.tracing;

import com.botanical.ingestion.core.model.Provider;

import java.util.Map;

/**
 * Used when tracing is disabled. Hands out one shared span and skips building
 * attribute maps on the hot provider and ingest paths.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return DisabledSpan.INSTANCE;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return DisabledSpan.INSTANCE;
    }

    @Override
    public Span startProviderSpan(Provider provider, String endpoint) {
        return DisabledSpan.INSTANCE;
    }

    @Override
    public Span startIngestSpan(Provider source, String scientificName, String title) {
        return DisabledSpan.INSTANCE;
    }

    @Override
    public Span startReconcileSpan(String runId) {
        return DisabledSpan.INSTANCE;
    }

    enum DisabledSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
            // disabled
        }

        @Override
        public void setAttribute(String key, long value) {
            // disabled
        }

        @Override
        public void setStatus(SpanStatus status) {
            // disabled
        }

        @Override
        public void recordException(Throwable t) {
            // disabled
        }

        @Override
        public void close() {
            // disabled
        }
    }
}
