package com.botanical.ingestion.trefle;

import com.botanical.ingestion.client.ResilientProviderClient;
import com.botanical.ingestion.core.model.Cultivation;
import com.botanical.ingestion.core.model.EnrichmentPayload;
import com.botanical.ingestion.core.model.HerbImage;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.core.model.ToxicityInfo;
import com.botanical.ingestion.core.model.TrefleData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client for the Trefle botanical database.
 *
 * <pre>
 * TrefleClient trefle = TrefleClient.builder()
 *     .apiKey(System.getenv("TREFLE_API_KEY"))
 *     .cache(new CaffeineResponseCache(CacheConfig.defaults()))
 *     .build();
 *
 * Optional&lt;EnrichmentPayload&gt; payload = trefle.enrich("Panax ginseng", "Ginseng");
 * </pre>
 */
public class TrefleClient extends ResilientProviderClient {
    private static final Logger log = LoggerFactory.getLogger(TrefleClient.class);

    public static final String DEFAULT_BASE_URL = "https://trefle.io/api/v1";
    public static final Duration DEFAULT_SPACING = Duration.ofMillis(500);
    public static final int DEFAULT_PAGE_SIZE = 20;

    private static final String IMAGE_CAPTION_SUFFIX = " - from Trefle botanical database";

    private TrefleClient(Builder builder) {
        super(Provider.TREFLE, "token", builder);
    }

    public TrefleListResponse searchPlants(String query, int page, int pageSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("page", page);
        params.put("limit", pageSize);
        return execute("/plants/search", params, TrefleListResponse.class);
    }

    public TrefleListResponse searchByScientificName(String scientificName) {
        return searchPlants(scientificName, 1, DEFAULT_PAGE_SIZE);
    }

    public TreflePlantResponse getPlantById(long plantId) {
        return execute("/plants/" + pathSegment(plantId), Map.of(), TreflePlantResponse.class);
    }

    public TreflePlantResponse getPlantBySlug(String slug) {
        Objects.requireNonNull(slug, "slug is required");
        return execute("/plants/" + pathSegment(slug), Map.of(), TreflePlantResponse.class);
    }

    public TrefleListResponse getPlants(int page, int pageSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page", page);
        params.put("limit", pageSize);
        return execute("/plants", params, TrefleListResponse.class);
    }

    public TrefleListResponse getPlantsCached(int page, int pageSize) {
        return getPlantsCached(page, pageSize, null);
    }

    public TrefleListResponse getPlantsCached(int page, int pageSize, Duration ttl) {
        return executeCached(cacheKey("plants", page, pageSize), ttl, TrefleListResponse.class,
                () -> getPlants(page, pageSize));
    }

    public TreflePlantResponse getPlantByIdCached(long plantId) {
        return getPlantByIdCached(plantId, null);
    }

    public TreflePlantResponse getPlantByIdCached(long plantId, Duration ttl) {
        return executeCached(cacheKey("plant", plantId), ttl, TreflePlantResponse.class,
                () -> getPlantById(plantId));
    }

    /**
     * Finds the plant that best matches the given names: an exact (case-insensitive)
     * scientific-name hit, else the first scientific-name result, else the first
     * common-name result.
     */
    public Optional<TreflePlant> findBestMatch(String scientificName, String commonName) {
        Objects.requireNonNull(scientificName, "scientificName is required");
        List<TreflePlant> results = searchByScientificName(scientificName).data();
        if (!results.isEmpty()) {
            return Optional.of(results.stream()
                    .filter(plant -> scientificName.equalsIgnoreCase(plant.scientificName()))
                    .findFirst()
                    .orElse(results.get(0)));
        }
        if (commonName != null && !commonName.isBlank()) {
            List<TreflePlant> commonResults = searchPlants(commonName, 1, DEFAULT_PAGE_SIZE).data();
            if (!commonResults.isEmpty()) {
                return Optional.of(commonResults.get(0));
            }
        }
        log.debug("trefle.noMatch scientificName={} commonName={}", scientificName, commonName);
        return Optional.empty();
    }

    public ScientificNameValidation validateScientificName(String scientificName) {
        Objects.requireNonNull(scientificName, "scientificName is required");
        List<TreflePlant> results = searchByScientificName(scientificName).data();
        if (results.isEmpty()) {
            return ScientificNameValidation.notFound();
        }
        Optional<TreflePlant> exact = results.stream()
                .filter(plant -> scientificName.equalsIgnoreCase(plant.scientificName()))
                .findFirst();
        if (exact.isPresent()) {
            return new ScientificNameValidation(true, List.of(), exact.get());
        }
        List<String> suggestions = results.stream()
                .limit(3)
                .map(TreflePlant::scientificName)
                .toList();
        return new ScientificNameValidation(false, suggestions, results.get(0));
    }

    @Override
    public Optional<EnrichmentPayload> enrich(String scientificName, String commonName) {
        Objects.requireNonNull(scientificName, "scientificName is required");
        Optional<TreflePlant> match = findBestMatch(scientificName, commonName);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        TreflePlantResponse details = getPlantByIdCached(match.get().id());
        if (details == null || details.data() == null) {
            return Optional.empty();
        }
        return Optional.of(extractEnrichmentData(details.data()));
    }

    /**
     * Converts a Trefle plant detail into a provider-agnostic payload.
     * Tolerates missing sections: absent lists become empty, toxicity becomes "none".
     */
    public EnrichmentPayload extractEnrichmentData(TreflePlantDetail plant) {
        TreflePlantDetail.MainSpecies species = plant.mainSpecies();
        TreflePlantDetail.Specifications specs = species != null ? species.specifications() : null;
        TreflePlantDetail.Distribution distribution = species != null ? species.distribution() : null;

        List<String> nativeRegions = distribution != null ? orEmpty(distribution.nativeRegions()) : List.of();
        List<String> introducedRegions = distribution != null ? orEmpty(distribution.introducedRegions()) : List.of();
        String toxicity = specs != null && specs.toxicity() != null ? specs.toxicity() : "none";
        String commonName = firstNonBlank(plant.commonName(), species != null ? species.commonName() : null,
                plant.scientificName());

        TrefleData data = new TrefleData(
                plant.author(),
                plant.year(),
                plant.bibliography(),
                plant.familyCommonName(),
                nativeRegions,
                introducedRegions,
                species != null ? orEmpty(species.ediblePart()) : List.of(),
                species != null && Boolean.TRUE.equals(species.vegetable()),
                toxicity,
                specs != null ? specs.growthHabit() : null,
                specs != null ? specs.growthForm() : null,
                specs != null ? specs.growthRate() : null,
                specs != null && specs.averageHeight() != null ? specs.averageHeight().cm() : null,
                specs != null && specs.maximumHeight() != null ? specs.maximumHeight().cm() : null,
                colors(species != null ? species.flower() : null),
                colors(species != null ? species.foliage() : null),
                colors(species != null ? species.fruitOrSeed() : null),
                plant.sources() != null
                        ? plant.sources().stream()
                                .map(source -> source.name() != null ? source.name() : source.id())
                                .toList()
                        : List.of());

        String imageUrl = firstNonBlank(plant.imageUrl(), species != null ? species.imageUrl() : null);
        List<HerbImage> images = imageUrl != null
                ? List.of(new HerbImage(null, imageUrl, commonName + IMAGE_CAPTION_SUFFIX, "photograph",
                        Provider.TREFLE.displayName()))
                : List.of();

        return EnrichmentPayload.builder(Provider.TREFLE)
                .sourceId(plant.id())
                .sourceSlug(plant.slug())
                .commonName(commonName)
                .scientificName(plant.scientificName())
                .family(firstNonBlank(plant.familyName(), "Unknown"))
                .genus(firstNonBlank(plant.genusName(), "Unknown"))
                .synonyms(species != null ? species.synonymNames() : List.of())
                .origin(nativeRegions)
                .medicinal(false)
                .edible(species != null && Boolean.TRUE.equals(species.edible()))
                .toxicity(new ToxicityInfo(toxicity, false, false))
                .cultivation(specs != null && specs.growthRate() != null
                        ? Cultivation.builder().growthRate(specs.growthRate()).build()
                        : null)
                .images(images)
                .providerData(data)
                .syncedAt(clock.instant())
                .build();
    }

    private static List<String> colors(TreflePlantDetail.Colors colors) {
        return colors != null ? orEmpty(colors.color()) : List.of();
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
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

        public TrefleClient build() {
            return new TrefleClient(this);
        }
    }
}
