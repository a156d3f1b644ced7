package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.EnrichmentPayload;
import com.botanical.ingestion.core.model.Provider;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A plant-data source that can enrich a herb by name.
 */
public interface BotanicalProvider {

    Provider getProvider();

    /**
     * Whether a credential is configured. Calls on an unconfigured provider
     * fail with {@link ProviderConfigurationException}.
     */
    boolean isConfigured();

    /**
     * Finds the provider's best match for a herb and extracts it.
     *
     * @param scientificName the herb's scientific name
     * @param commonName     fallback search term, may be {@code null}
     * @return the extracted payload, or empty when the provider knows no such plant
     * @throws ProviderException when the provider cannot be reached or rejects the call
     */
    Optional<EnrichmentPayload> enrich(String scientificName, String commonName);

    /**
     * Runs {@link #enrich(String, String)} on the common pool.
     */
    default CompletableFuture<Optional<EnrichmentPayload>> enrichAsync(String scientificName, String commonName) {
        return CompletableFuture.supplyAsync(() -> enrich(scientificName, commonName));
    }

    RetryStats getStats();

    CircuitState getCircuitState();

    /**
     * Closes the circuit and zeroes the counters.
     */
    void reset();
}
