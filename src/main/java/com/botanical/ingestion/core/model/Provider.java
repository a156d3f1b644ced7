package com.botanical.ingestion.core.model;

/**
 * External plant-data sources a herb record can be enriched from.
 */
public enum Provider {
    TREFLE("trefle", "Trefle"),
    PERENUAL("perenual", "Perenual");

    private final String key;
    private final String displayName;

    Provider(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Lowercase identifier used in cache keys, metric tags and log lines.
     */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }
}
