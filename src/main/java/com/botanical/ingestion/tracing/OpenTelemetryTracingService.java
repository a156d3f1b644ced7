package com.botanical.ingestion.tracing;

import com.botanical.ingestion.core.model.Provider;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Emits ingestion spans through OpenTelemetry. Provider calls become
 * {@link SpanKind#CLIENT} spans carrying the HTTP method and URL path; ingest
 * and reconcile spans are {@link SpanKind#INTERNAL}.
 *
 * <p>Needs {@code opentelemetry-api} at runtime, which this library declares optional.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_NAME = "com.botanical.ingestion";

    static final String ATTR_HTTP_METHOD = "http.request.method";
    static final String ATTR_URL_PATH = "url.path";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Uses the tracer of whatever SDK the application registered globally.
     */
    public static OpenTelemetryTracingService fromGlobal() {
        return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String operationName) {
        return start(tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL));
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return start(builder);
    }

    @Override
    public Span startProviderSpan(Provider provider, String endpoint) {
        SpanBuilder builder = tracer.spanBuilder(PROVIDER_REQUEST + " " + provider.key())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(ATTR_PROVIDER, provider.key())
                .setAttribute(ATTR_ENDPOINT, endpoint)
                .setAttribute(ATTR_HTTP_METHOD, "GET")
                .setAttribute(ATTR_URL_PATH, endpoint);
        return start(builder);
    }

    private static Span start(SpanBuilder builder) {
        return new ExportedSpan(builder.startSpan());
    }

    private static final class ExportedSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        ExportedSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
