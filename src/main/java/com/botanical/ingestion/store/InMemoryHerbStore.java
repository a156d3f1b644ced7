package com.botanical.ingestion.store;

import com.botanical.ingestion.core.model.Herb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Thread-safe in-memory {@link HerbStore}. Records are returned in insertion order.
 * Intended for tests and local runs.
 */
public class InMemoryHerbStore implements HerbStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryHerbStore.class);

    private final Map<String, Herb> herbs = new LinkedHashMap<>();

    @Override
    public synchronized List<Herb> find(HerbQuery query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Herb> result = new ArrayList<>();
        for (Herb herb : herbs.values()) {
            if (query.test(herb)) {
                result.add(herb);
                if (result.size() >= limit) {
                    break;
                }
            }
        }
        return result;
    }

    @Override
    public synchronized Herb create(Herb herb) {
        String id = herb.getId() != null ? herb.getId() : UUID.randomUUID().toString();
        if (herbs.containsKey(id)) {
            throw new HerbStoreException("Herb already exists: " + id);
        }
        Herb stored = Herb.builder(herb).id(id).build();
        herbs.put(id, stored);
        log.debug("herb.stored id={} title={}", id, stored.getTitle());
        return stored;
    }

    @Override
    public synchronized Herb update(String id, Herb herb) {
        if (!herbs.containsKey(id)) {
            throw new HerbStoreException("Herb not found: " + id);
        }
        Herb stored = Herb.builder(herb).id(id).build();
        herbs.put(id, stored);
        return stored;
    }

    @Override
    public synchronized void delete(String id) {
        if (herbs.remove(id) == null) {
            throw new HerbStoreException("Herb not found: " + id);
        }
        log.debug("herb.deleted id={}", id);
    }

    public synchronized Optional<Herb> findById(String id) {
        return Optional.ofNullable(herbs.get(id));
    }

    public synchronized int size() {
        return herbs.size();
    }
}
