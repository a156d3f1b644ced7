package com.botanical.ingestion.core.model;

/**
 * Raw per-source payload kept on a herb for provenance.
 * Each provider has exactly one concrete shape: {@link TrefleData} or {@link PerenualData}.
 */
public interface ProviderData {

    /**
     * The provider this payload came from.
     */
    Provider provider();
}
