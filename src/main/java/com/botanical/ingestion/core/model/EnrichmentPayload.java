package com.botanical.ingestion.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Provider-agnostic result of extracting a provider's plant detail response.
 * Produced by the provider clients, consumed by the deduplication service.
 */
public record EnrichmentPayload(
        Provider provider,
        Long sourceId,
        String sourceSlug,
        String commonName,
        String scientificName,
        String family,
        String genus,
        List<String> synonyms,
        List<String> origin,
        boolean medicinal,
        boolean edible,
        ToxicityInfo toxicity,
        Cultivation cultivation,
        List<HerbImage> images,
        ProviderData providerData,
        Instant syncedAt
) {

    public EnrichmentPayload {
        Objects.requireNonNull(provider, "provider is required");
        synonyms = ModelCollections.copyOrEmpty(synonyms);
        origin = ModelCollections.copyOrEmpty(origin);
        images = ModelCollections.copyOrEmpty(images);
        toxicity = toxicity != null ? toxicity : ToxicityInfo.none();
        if (providerData != null && providerData.provider() != provider) {
            throw new IllegalArgumentException("providerData from " + providerData.provider()
                    + " cannot be attached to a " + provider + " payload");
        }
    }

    public static Builder builder(Provider provider) {
        return new Builder(provider);
    }

    public static class Builder {
        private final Provider provider;
        private Long sourceId;
        private String sourceSlug;
        private String commonName;
        private String scientificName;
        private String family;
        private String genus;
        private List<String> synonyms;
        private List<String> origin;
        private boolean medicinal;
        private boolean edible;
        private ToxicityInfo toxicity;
        private Cultivation cultivation;
        private List<HerbImage> images;
        private ProviderData providerData;
        private Instant syncedAt;

        private Builder(Provider provider) {
            this.provider = provider;
        }

        public Builder sourceId(Long sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder sourceSlug(String sourceSlug) {
            this.sourceSlug = sourceSlug;
            return this;
        }

        public Builder commonName(String commonName) {
            this.commonName = commonName;
            return this;
        }

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

        public Builder synonyms(List<String> synonyms) {
            this.synonyms = synonyms;
            return this;
        }

        public Builder origin(List<String> origin) {
            this.origin = origin;
            return this;
        }

        public Builder medicinal(boolean medicinal) {
            this.medicinal = medicinal;
            return this;
        }

        public Builder edible(boolean edible) {
            this.edible = edible;
            return this;
        }

        public Builder toxicity(ToxicityInfo toxicity) {
            this.toxicity = toxicity;
            return this;
        }

        public Builder cultivation(Cultivation cultivation) {
            this.cultivation = cultivation;
            return this;
        }

        public Builder images(List<HerbImage> images) {
            this.images = images;
            return this;
        }

        public Builder providerData(ProviderData providerData) {
            this.providerData = providerData;
            return this;
        }

        public Builder syncedAt(Instant syncedAt) {
            this.syncedAt = syncedAt;
            return this;
        }

        public EnrichmentPayload build() {
            return new EnrichmentPayload(provider, sourceId, sourceSlug, commonName, scientificName,
                    family, genus, synonyms, origin, medicinal, edible, toxicity, cultivation,
                    images, providerData, syncedAt);
        }
    }
}
