package com.botanical.ingestion.perenual;

import com.botanical.ingestion.cache.CacheConfig;
import com.botanical.ingestion.cache.CaffeineResponseCache;
import com.botanical.ingestion.client.ProviderApiException;
import com.botanical.ingestion.client.RetryConfig;
import com.botanical.ingestion.client.StubHttpClient;
import com.botanical.ingestion.core.model.Cultivation;
import com.botanical.ingestion.core.model.EnrichmentPayload;
import com.botanical.ingestion.core.model.PerenualData;
import com.botanical.ingestion.core.model.Provider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PerenualClient")
class PerenualClientTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static final String SPECIES_LIST = """
            {"data": [
              {"id": 11, "common_name": "Dwarf ginseng", "scientific_name": ["Panax trifolius"],
               "other_name": [], "cycle": "Perennial"},
              {"id": 12, "common_name": "Ginseng", "scientific_name": ["Panax schinseng", "Panax ginseng"],
               "other_name": ["Korean ginseng"], "cycle": "Perennial"}
             ],
             "to": 2, "per_page": 20, "current_page": 1, "from": 1, "last_page": 3, "total": 45}
            """;

    private static final String GINSENG_DETAIL = """
            {"id": 12, "common_name": "Ginseng",
             "scientific_name": ["Panax ginseng"], "other_name": ["Korean ginseng", "Ren shen"],
             "family": "Araliaceae", "origin": ["Korea", "China"], "type": "herb",
             "cycle": "Perennial", "watering": "Average", "watering_period": "week",
             "watering_general_benchmark": {"value": "5-7", "unit": "days"},
             "attracts": [], "propagation": ["Seed"],
             "hardiness": {"min": "3", "max": "7"},
             "sunlight": ["part shade"], "soil": ["Loamy"], "pruning_month": ["March"],
             "maintenance": "Low", "care_level": "Medium", "growth_rate": "Low",
             "drought_tolerant": false, "salt_tolerant": false, "indoor": false,
             "medicinal": true, "edible_fruit": false, "edible_leaf": true,
             "poisonous_to_humans": 0, "poisonous_to_pets": 1,
             "pest_susceptibility": ["Aphids", "Root rot"],
             "flowers": true, "invasive": false, "tropical": false, "rare": true,
             "description": "Slow-growing perennial with a fleshy root.",
             "default_image": {"license": 45, "regular_url": "https://perenual.com/images/ginseng.jpg"}}
            """;

    private StubHttpClient http;

    @BeforeEach
    void setUp() {
        http = new StubHttpClient();
    }

    private PerenualClient.Builder clientBuilder() {
        return PerenualClient.builder()
                .baseUrl(StubHttpClient.BASE_URL)
                .apiKey("perenual-key")
                .httpClient(http.client())
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .sleeper(duration -> { })
                .retryConfig(new RetryConfig(2, Duration.ZERO, Duration.ZERO));
    }

    private PerenualClient client() {
        return clientBuilder().build();
    }

    @Nested
    @DisplayName("Requests")
    class Requests {

        @Test
        @DisplayName("Species list sends the key and paging parameters")
        void listParameters() {
            http.respond("/species-list", 200, SPECIES_LIST);

            PerenualListResponse response = client().getSpeciesList(2, 30);

            assertEquals(2, response.data().size());
            assertTrue(response.hasNextPage());
            Map<String, String> params = StubHttpClient.queryParams(http.lastRequest());
            assertEquals("perenual-key", params.get("key"));
            assertEquals("2", params.get("page"));
            assertEquals("30", params.get("per_page"));
            assertFalse(params.containsKey("token"));
        }

        @Test
        @DisplayName("Filtered search sends only the flags that are set, as 1 or 0")
        void filteredSearch() {
            http.respond("/species-list", 200, SPECIES_LIST);

            client().searchSpeciesFiltered(SpeciesFilter.builder()
                    .query("ginseng")
                    .medicinal(true)
                    .poisonous(false)
                    .build());

            Map<String, String> params = StubHttpClient.queryParams(http.lastRequest());
            assertEquals("ginseng", params.get("q"));
            assertEquals("1", params.get("medicinal"));
            assertEquals("0", params.get("poisonous"));
            assertFalse(params.containsKey("edible"));
            assertFalse(params.containsKey("indoor"));
            assertEquals("20", params.get("per_page"));
        }

        @Test
        @DisplayName("Cached species list is fetched once per page")
        void cachedList() {
            http.respond("/species-list", 200, SPECIES_LIST);
            PerenualClient client = clientBuilder().cache(new CaffeineResponseCache(CacheConfig.defaults())).build();

            client.getSpeciesListCached(1, 20);
            client.getSpeciesListCached(1, 20);
            client.getSpeciesListCached(2, 20);

            assertEquals(2, http.requestCount("/species-list"));
        }

        @Test
        @DisplayName("Provider error message is carried on the exception")
        void errorMessage() {
            http.respond("/species/details/99", 401, "{\"message\":\"Invalid API key\"}");

            ProviderApiException e = assertThrows(ProviderApiException.class,
                    () -> client().getSpeciesDetails(99));

            assertEquals(401, e.getStatusCode());
            assertFalse(e.isRetryable());
            assertTrue(e.getMessage().contains("Invalid API key"), e.getMessage());
            assertEquals(1, http.requestCount("/species/details/99"));
        }
    }

    @Nested
    @DisplayName("Matching and enrichment")
    class Enrichment {

        @Test
        @DisplayName("A null scientific name is rejected before any request")
        void nullScientificName() {
            PerenualClient client = client();

            assertThrows(NullPointerException.class, () -> client.findBestMatch(null, "ginseng"));
            assertThrows(NullPointerException.class, () -> client.enrich(null, "ginseng"));
            assertTrue(http.requests().isEmpty());
        }

        @Test
        @DisplayName("Matches on any listed scientific name")
        void matchesAnyScientificName() {
            http.respond("/species-list", 200, SPECIES_LIST);

            PerenualSpecies match = client().findBestMatch("panax ginseng", null).orElseThrow();

            assertEquals(12, match.id());
        }

        @Test
        @DisplayName("Enrich extracts the detail of the best match")
        void enrich() {
            http.respond("/species-list", 200, SPECIES_LIST)
                    .respond("/species/details/12", 200, GINSENG_DETAIL);

            EnrichmentPayload payload = client().enrich("Panax ginseng", "Ginseng").orElseThrow();

            assertEquals(Provider.PERENUAL, payload.provider());
            assertEquals(Long.valueOf(12), payload.sourceId());
            assertNull(payload.sourceSlug());
            assertEquals("Ginseng", payload.commonName());
            assertEquals("Panax ginseng", payload.scientificName());
            assertEquals("Araliaceae", payload.family());
            assertEquals("Panax", payload.genus());
            assertEquals(List.of("Korean ginseng", "Ren shen"), payload.synonyms());
            assertEquals(List.of("Korea", "China"), payload.origin());
            assertTrue(payload.medicinal());
            assertTrue(payload.edible());
            assertEquals("poisonous", payload.toxicity().level());
            assertFalse(payload.toxicity().toxicToHumans());
            assertTrue(payload.toxicity().toxicToPets());
            assertEquals(NOW, payload.syncedAt());
            assertEquals("Ginseng - from Perenual plant database", payload.images().get(0).caption());

            Cultivation cultivation = payload.cultivation();
            assertEquals("Perennial", cultivation.cycle());
            assertEquals("3", cultivation.hardinessMin());
            assertEquals("7", cultivation.hardinessMax());
            assertEquals(List.of("part shade"), cultivation.sunlight());
            assertEquals(List.of("March"), cultivation.pruningMonths());
            assertEquals(Boolean.FALSE, cultivation.indoor());

            PerenualData data = (PerenualData) payload.providerData();
            assertEquals("5-7", data.wateringBenchmarkValue());
            assertEquals("days", data.wateringBenchmarkUnit());
            assertEquals(List.of("Aphids", "Root rot"), data.pestSusceptibility());
            assertTrue(data.rare());
            assertTrue(data.poisonousToPets());
        }

        @Test
        @DisplayName("Extraction fills documented defaults for a bare record")
        void extractionDefaults() throws Exception {
            PerenualSpeciesDetail bare = new ObjectMapper().readValue(
                    "{\"id\": 5, \"scientific_name\": [\"Mentha piperita\"]}", PerenualSpeciesDetail.class);

            EnrichmentPayload payload = client().extractEnrichmentData(bare);

            assertEquals("Mentha piperita", payload.commonName());
            assertEquals("Mentha", payload.genus());
            assertEquals("Unknown", payload.family());
            assertTrue(payload.toxicity().isNone());
            assertFalse(payload.edible());
            assertTrue(payload.images().isEmpty());

            Cultivation cultivation = payload.cultivation();
            assertEquals("Unknown", cultivation.cycle());
            assertEquals("Average", cultivation.watering());
            assertEquals("0", cultivation.hardinessMin());
            assertEquals("0", cultivation.hardinessMax());
            assertEquals("Unknown", cultivation.careLevel());
            assertEquals(List.of(), cultivation.sunlight());
            assertEquals(Boolean.FALSE, cultivation.droughtTolerant());
        }

        @Test
        @DisplayName("Poisonous flags accept booleans as well as 0/1")
        void booleanPoisonFlags() throws Exception {
            PerenualSpeciesDetail detail = new ObjectMapper().readValue(
                    "{\"id\": 6, \"scientific_name\": [\"Digitalis purpurea\"], \"poisonous_to_humans\": true}",
                    PerenualSpeciesDetail.class);

            assertTrue(detail.isPoisonousToHumans());
            assertFalse(detail.isPoisonousToPets());
        }
    }
}
