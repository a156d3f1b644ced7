package com.botanical.ingestion.store;

import com.botanical.ingestion.core.model.Herb;

import java.util.List;

/**
 * Persistent collection of canonical herb records.
 *
 * <p>The ingestion core reads and writes through this interface only; the
 * concrete store (CMS, database, in-memory) is supplied by the caller.
 * Failures are reported as unchecked exceptions and are not retried here.</p>
 */
public interface HerbStore {

    /**
     * Returns up to {@code limit} records matching {@code query}, in a stable order.
     */
    List<Herb> find(HerbQuery query, int limit);

    /**
     * Persists a new record and returns it with its assigned ID.
     */
    Herb create(Herb herb);

    /**
     * Replaces the record with the given ID and returns the stored version.
     *
     * @throws HerbStoreException if no record has that ID
     */
    Herb update(String id, Herb herb);

    /**
     * Deletes the record with the given ID.
     *
     * @throws HerbStoreException if no record has that ID
     */
    void delete(String id);
}
