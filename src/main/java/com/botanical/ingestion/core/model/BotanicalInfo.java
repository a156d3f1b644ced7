package com.botanical.ingestion.core.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Taxonomy and per-provider provenance of a herb.
 *
 * <p>{@code sourceIds}, {@code sourceSlugs}, {@code providerData} and
 * {@code lastSyncedAt} are keyed by {@link Provider}; a provider absent from a
 * map has never contributed to the record.</p>
 */
public record BotanicalInfo(
        String scientificName,
        String family,
        String genus,
        String species,
        Map<Provider, Long> sourceIds,
        Map<Provider, String> sourceSlugs,
        Map<Provider, ProviderData> providerData,
        List<String> synonyms,
        List<String> origin,
        Map<Provider, Instant> lastSyncedAt
) {

    public BotanicalInfo {
        sourceIds = ModelCollections.copyByProvider(sourceIds);
        sourceSlugs = ModelCollections.copyByProvider(sourceSlugs);
        providerData = ModelCollections.copyByProvider(providerData);
        synonyms = ModelCollections.copyOrEmpty(synonyms);
        origin = ModelCollections.copyOrEmpty(origin);
        lastSyncedAt = ModelCollections.copyByProvider(lastSyncedAt);
    }

    public static BotanicalInfo empty() {
        return builder().build();
    }

    public Optional<Long> sourceId(Provider provider) {
        return Optional.ofNullable(sourceIds.get(provider));
    }

    /**
     * Number of providers that have contributed a source ID.
     */
    public int sourceCount() {
        return sourceIds.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(BotanicalInfo info) {
        return new Builder()
                .scientificName(info.scientificName)
                .family(info.family)
                .genus(info.genus)
                .species(info.species)
                .sourceIds(info.sourceIds)
                .sourceSlugs(info.sourceSlugs)
                .providerData(info.providerData)
                .synonyms(info.synonyms)
                .origin(info.origin)
                .lastSyncedAt(info.lastSyncedAt);
    }

    public static class Builder {
        private String scientificName;
        private String family;
        private String genus;
        private String species;
        private final Map<Provider, Long> sourceIds = new EnumMap<>(Provider.class);
        private final Map<Provider, String> sourceSlugs = new EnumMap<>(Provider.class);
        private final Map<Provider, ProviderData> providerData = new EnumMap<>(Provider.class);
        private List<String> synonyms;
        private List<String> origin;
        private final Map<Provider, Instant> lastSyncedAt = new EnumMap<>(Provider.class);

        public Builder scientificName(String scientificName) {
            this.scientificName = scientificName;
            return this;
        }

        public Builder family(String family) {
            this.family = family;
            return this;
        }

        public Builder genus(String genus) {
            this.genus = genus;
            return this;
        }

        public Builder species(String species) {
            this.species = species;
            return this;
        }

        public Builder sourceIds(Map<Provider, Long> sourceIds) {
            this.sourceIds.clear();
            this.sourceIds.putAll(sourceIds);
            return this;
        }

        public Builder sourceId(Provider provider, Long id) {
            if (id != null) {
                this.sourceIds.put(provider, id);
            }
            return this;
        }

        public Builder sourceSlugs(Map<Provider, String> sourceSlugs) {
            this.sourceSlugs.clear();
            this.sourceSlugs.putAll(sourceSlugs);
            return this;
        }

        public Builder sourceSlug(Provider provider, String slug) {
            if (slug != null) {
                this.sourceSlugs.put(provider, slug);
            }
            return this;
        }

        public Builder providerData(Map<Provider, ProviderData> providerData) {
            this.providerData.clear();
            this.providerData.putAll(providerData);
            return this;
        }

        public Builder providerData(ProviderData data) {
            if (data != null) {
                this.providerData.put(data.provider(), data);
            }
            return this;
        }

        public Builder synonyms(List<String> synonyms) {
            this.synonyms = synonyms;
            return this;
        }

        public Builder origin(List<String> origin) {
            this.origin = origin;
            return this;
        }

        public Builder lastSyncedAt(Map<Provider, Instant> lastSyncedAt) {
            this.lastSyncedAt.clear();
            this.lastSyncedAt.putAll(lastSyncedAt);
            return this;
        }

        public Builder lastSyncedAt(Provider provider, Instant syncedAt) {
            if (syncedAt != null) {
                this.lastSyncedAt.put(provider, syncedAt);
            }
            return this;
        }

        public BotanicalInfo build() {
            return new BotanicalInfo(scientificName, family, genus, species, sourceIds, sourceSlugs,
                    providerData, synonyms, origin, lastSyncedAt);
        }
    }
}
