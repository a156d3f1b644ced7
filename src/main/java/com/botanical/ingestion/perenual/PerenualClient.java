package com.botanical.ingestion.perenual;

import com.botanical.ingestion.client.ResilientProviderClient;
import com.botanical.ingestion.core.model.Cultivation;
import com.botanical.ingestion.core.model.EnrichmentPayload;
import com.botanical.ingestion.core.model.HerbImage;
import com.botanical.ingestion.core.model.PerenualData;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.core.model.ToxicityInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client for the Perenual plant care database.
 */
public class PerenualClient extends ResilientProviderClient {
    private static final Logger log = LoggerFactory.getLogger(PerenualClient.class);

    public static final String DEFAULT_BASE_URL = "https://perenual.com/api";
    public static final Duration DEFAULT_SPACING = Duration.ofMillis(1000);
    public static final int DEFAULT_PAGE_SIZE = 20;

    private static final String UNKNOWN = "Unknown";
    private static final String IMAGE_CAPTION_SUFFIX = " - from Perenual plant database";

    private PerenualClient(Builder builder) {
        super(Provider.PERENUAL, "key", builder);
    }

    public PerenualListResponse getSpeciesList(int page, int pageSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page", page);
        params.put("per_page", pageSize);
        return execute("/species-list", params, PerenualListResponse.class);
    }

    public PerenualListResponse getSpeciesListCached(int page, int pageSize) {
        return getSpeciesListCached(page, pageSize, null);
    }

    public PerenualListResponse getSpeciesListCached(int page, int pageSize, Duration ttl) {
        return executeCached(cacheKey("species-list", page, pageSize), ttl, PerenualListResponse.class,
                () -> getSpeciesList(page, pageSize));
    }

    public PerenualSpeciesDetail getSpeciesDetails(long speciesId) {
        return execute("/species/details/" + pathSegment(speciesId), Map.of(), PerenualSpeciesDetail.class);
    }

    public PerenualSpeciesDetail getSpeciesDetailsCached(long speciesId) {
        return getSpeciesDetailsCached(speciesId, null);
    }

    public PerenualSpeciesDetail getSpeciesDetailsCached(long speciesId, Duration ttl) {
        return executeCached(cacheKey("species", speciesId), ttl, PerenualSpeciesDetail.class,
                () -> getSpeciesDetails(speciesId));
    }

    public PerenualListResponse searchSpecies(String query, int page, int pageSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("page", page);
        params.put("per_page", pageSize);
        return execute("/species-list", params, PerenualListResponse.class);
    }

    public PerenualListResponse searchSpeciesFiltered(SpeciesFilter filter) {
        return execute("/species-list", filter.toParams(), PerenualListResponse.class);
    }

    /**
     * Exact (case-insensitive) match against any of a species' scientific names,
     * else the first scientific-name result, else the first common-name result.
     */
    public Optional<PerenualSpecies> findBestMatch(String scientificName, String commonName) {
        Objects.requireNonNull(scientificName, "scientificName is required");
        List<PerenualSpecies> results = searchSpecies(scientificName, 1, DEFAULT_PAGE_SIZE).data();
        if (!results.isEmpty()) {
            return Optional.of(results.stream()
                    .filter(species -> species.scientificName() != null && species.scientificName().stream()
                            .anyMatch(scientificName::equalsIgnoreCase))
                    .findFirst()
                    .orElse(results.get(0)));
        }
        if (commonName != null && !commonName.isBlank()) {
            List<PerenualSpecies> commonResults = searchSpecies(commonName, 1, DEFAULT_PAGE_SIZE).data();
            if (!commonResults.isEmpty()) {
                return Optional.of(commonResults.get(0));
            }
        }
        log.debug("perenual.noMatch scientificName={} commonName={}", scientificName, commonName);
        return Optional.empty();
    }

    @Override
    public Optional<EnrichmentPayload> enrich(String scientificName, String commonName) {
        Objects.requireNonNull(scientificName, "scientificName is required");
        Optional<PerenualSpecies> match = findBestMatch(scientificName, commonName);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        PerenualSpeciesDetail detail = getSpeciesDetailsCached(match.get().id());
        return Optional.ofNullable(detail).map(this::extractEnrichmentData);
    }

    /**
     * Converts a Perenual species detail into a provider-agnostic payload,
     * filling documented defaults for every missing field.
     */
    public EnrichmentPayload extractEnrichmentData(PerenualSpeciesDetail species) {
        String scientificName = species.primaryScientificName();
        String commonName = species.commonName() != null && !species.commonName().isBlank()
                ? species.commonName()
                : scientificName;
        boolean toxicToHumans = species.isPoisonousToHumans();
        boolean toxicToPets = species.isPoisonousToPets();

        Cultivation cultivation = Cultivation.builder()
                .cycle(orDefault(species.cycle(), UNKNOWN))
                .watering(orDefault(species.watering(), "Average"))
                .wateringPeriod(species.wateringPeriod())
                .sunlight(orEmpty(species.sunlight()))
                .soil(orEmpty(species.soil()))
                .hardiness(
                        species.hardiness() != null ? orDefault(species.hardiness().min(), "0") : "0",
                        species.hardiness() != null ? orDefault(species.hardiness().max(), "0") : "0")
                .maintenance(orDefault(species.maintenance(), UNKNOWN))
                .careLevel(orDefault(species.careLevel(), UNKNOWN))
                .growthRate(orDefault(species.growthRate(), UNKNOWN))
                .indoor(Boolean.TRUE.equals(species.indoor()))
                .droughtTolerant(Boolean.TRUE.equals(species.droughtTolerant()))
                .saltTolerant(Boolean.TRUE.equals(species.saltTolerant()))
                .propagation(orEmpty(species.propagation()))
                .pruningMonths(orEmpty(species.pruningMonth()))
                .build();

        PerenualSpeciesDetail.Benchmark benchmark = species.wateringGeneralBenchmark();
        PerenualData data = new PerenualData(
                orEmpty(species.otherName()),
                species.type(),
                orEmpty(species.attracts()),
                toxicToHumans,
                toxicToPets,
                benchmark != null ? benchmark.value() : null,
                benchmark != null ? benchmark.unit() : null,
                species.careLevel(),
                species.description(),
                orEmpty(species.pestSusceptibility()),
                Boolean.TRUE.equals(species.flowers()),
                Boolean.TRUE.equals(species.invasive()),
                Boolean.TRUE.equals(species.tropical()),
                Boolean.TRUE.equals(species.rare()));

        String imageUrl = species.defaultImage() != null ? species.defaultImage().regularUrl() : null;
        List<HerbImage> images = imageUrl != null && !imageUrl.isBlank()
                ? List.of(new HerbImage(null, imageUrl, commonName + IMAGE_CAPTION_SUFFIX, "photograph",
                        Provider.PERENUAL.displayName()))
                : List.of();

        return EnrichmentPayload.builder(Provider.PERENUAL)
                .sourceId(species.id())
                .commonName(commonName)
                .scientificName(scientificName)
                .family(orDefault(species.family(), UNKNOWN))
                .genus(genusOf(scientificName))
                .synonyms(orEmpty(species.otherName()))
                .origin(orEmpty(species.origin()))
                .medicinal(Boolean.TRUE.equals(species.medicinal()))
                .edible(Boolean.TRUE.equals(species.edibleFruit()) || Boolean.TRUE.equals(species.edibleLeaf()))
                .toxicity(new ToxicityInfo(toxicToHumans || toxicToPets ? "poisonous" : "none",
                        toxicToHumans, toxicToPets))
                .cultivation(cultivation)
                .images(images)
                .providerData(data)
                .syncedAt(clock.instant())
                .build();
    }

    private static String genusOf(String scientificName) {
        if (scientificName == null || scientificName.isBlank()) {
            return UNKNOWN;
        }
        return scientificName.trim().split("\\s+")[0];
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ResilientProviderClient.Builder<Builder> {

        private Builder() {
            super(DEFAULT_BASE_URL, DEFAULT_SPACING);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public PerenualClient build() {
            return new PerenualClient(this);
        }
    }
}
