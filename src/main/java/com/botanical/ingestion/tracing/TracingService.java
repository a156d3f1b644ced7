package com.botanical.ingestion.tracing;

import com.botanical.ingestion.core.model.Provider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Span factory for provider calls, herb ingestion and reconcile runs.
 * {@link NoOpTracingService} is the default, so nothing here needs a tracing
 * library on the classpath.
 */
public interface TracingService {

    String PROVIDER_REQUEST = "provider.request";
    String HERB_INGEST = "herb.ingest";
    String HERB_RECONCILE = "herb.reconcile";

    String ATTR_PROVIDER = "botanical.provider";
    String ATTR_ENDPOINT = "botanical.endpoint";
    String ATTR_SCIENTIFIC_NAME = "botanical.herb.scientific_name";
    String ATTR_TITLE = "botanical.herb.title";
    String ATTR_RUN_ID = "botanical.reconcile.run_id";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts a span around one logical provider call, retries included.
     */
    default Span startProviderSpan(Provider provider, String endpoint) {
        return startSpan(PROVIDER_REQUEST, Map.of(ATTR_PROVIDER, provider.key(), ATTR_ENDPOINT, endpoint));
    }

    /**
     * Starts a span around the ingestion of one provider payload. Blank names are left out.
     */
    default Span startIngestSpan(Provider source, String scientificName, String title) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ATTR_PROVIDER, source.key());
        if (scientificName != null && !scientificName.isBlank()) {
            attributes.put(ATTR_SCIENTIFIC_NAME, scientificName);
        }
        if (title != null && !title.isBlank()) {
            attributes.put(ATTR_TITLE, title);
        }
        return startSpan(HERB_INGEST, attributes);
    }

    default Span startReconcileSpan(String runId) {
        return startSpan(HERB_RECONCILE, Map.of(ATTR_RUN_ID, runId));
    }
}
