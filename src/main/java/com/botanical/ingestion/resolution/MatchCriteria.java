package com.botanical.ingestion.resolution;

import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.Provider;

import java.util.EnumMap;
import java.util.Map;

/**
 * Identity evidence for an incoming record.
 *
 * @param sourceIds      provider-assigned IDs, any subset of providers
 * @param scientificName raw scientific name, may be {@code null}
 * @param commonName     common name as it would appear as a title, may be {@code null}
 */
public record MatchCriteria(Map<Provider, Long> sourceIds, String scientificName, String commonName) {

    public MatchCriteria {
        sourceIds = sourceIds != null ? Map.copyOf(sourceIds) : Map.of();
    }

    public static MatchCriteria of(Herb incoming) {
        return new MatchCriteria(
                incoming.getBotanicalInfo().sourceIds(),
                incoming.getScientificName(),
                incoming.getTitle());
    }

    public static MatchCriteria bySourceId(Provider provider, long sourceId) {
        Map<Provider, Long> ids = new EnumMap<>(Provider.class);
        ids.put(provider, sourceId);
        return new MatchCriteria(ids, null, null);
    }

    public static MatchCriteria byNames(String scientificName, String commonName) {
        return new MatchCriteria(Map.of(), scientificName, commonName);
    }
}
