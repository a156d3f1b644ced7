package com.botanical.ingestion.dedup;

/**
 * Counters from one {@link HerbDeduplicationService#bulkReconcile()} run.
 *
 * @param processed records that belonged to a duplicate group
 * @param merged    duplicates folded into their group's primary
 * @param deleted   duplicates removed from the store
 * @param errors    duplicate groups that failed part-way
 */
public record ReconcileResult(int processed, int merged, int deleted, int errors) {

    public static ReconcileResult empty() {
        return new ReconcileResult(0, 0, 0, 0);
    }

    public boolean hasErrors() {
        return errors > 0;
    }
}
