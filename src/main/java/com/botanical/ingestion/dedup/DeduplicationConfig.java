package com.botanical.ingestion.dedup;

import com.botanical.ingestion.resolution.HerbResolver;

/**
 * Configuration for {@link HerbDeduplicationService}.
 *
 * @param scanPageSize records compared by scientific name per lookup
 * @param corpusLimit  records loaded by one reconciliation run
 * @param lockKey      lock serializing ingestion and reconciliation
 */
public record DeduplicationConfig(int scanPageSize, int corpusLimit, String lockKey) {

    public DeduplicationConfig {
        if (scanPageSize <= 0) {
            throw new IllegalArgumentException("scanPageSize must be > 0");
        }
        if (corpusLimit <= 0) {
            throw new IllegalArgumentException("corpusLimit must be > 0");
        }
        if (lockKey == null || lockKey.isBlank()) {
            throw new IllegalArgumentException("lockKey is required");
        }
    }

    /**
     * Default configuration: 1,000-record name scan, 10,000-record reconciliation corpus.
     */
    public static DeduplicationConfig defaults() {
        return new DeduplicationConfig(HerbResolver.DEFAULT_SCAN_PAGE_SIZE, 10_000, "herb-ingestion");
    }
}
