package com.botanical.ingestion.dedup;

import com.botanical.ingestion.core.model.BotanicalInfo;
import com.botanical.ingestion.core.model.EnrichmentPayload;
import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.HerbStatus;
import com.botanical.ingestion.core.model.PerenualData;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.core.model.ToxicityInfo;
import com.botanical.ingestion.core.model.TrefleData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HerbMapperTest {

    private static final Instant SYNCED = Instant.parse("2024-03-01T12:00:00Z");

    private final HerbMapper mapper = new HerbMapper();

    private static TrefleData trefleData(List<String> edibleParts) {
        return new TrefleData("C.A.Mey.", 1843, null, "Ginseng family", List.of("Korea"), List.of(),
                edibleParts, false, null, null, null, null, null, null, List.of(), List.of(), List.of(), List.of());
    }

    private static PerenualData perenualData(String description, List<String> pests) {
        return new PerenualData(List.of(), "Herb", List.of(), false, true, null, null, "Medium",
                description, pests, false, false, false, false);
    }

    @Nested
    @DisplayName("toHerb")
    class ToHerb {

        @Test
        @DisplayName("Maps a Trefle payload into a draft herb")
        void trefle() {
            TrefleData data = trefleData(List.of("roots"));
            EnrichmentPayload payload = EnrichmentPayload.builder(Provider.TREFLE)
                    .sourceId(42L)
                    .sourceSlug("panax-ginseng")
                    .commonName("Asian Ginseng")
                    .scientificName("Panax ginseng C.A.Mey.")
                    .family("Araliaceae")
                    .genus("Panax")
                    .origin(List.of("Korea", "China", "Russia", "Japan", "Mongolia", "Nepal"))
                    .edible(true)
                    .providerData(data)
                    .syncedAt(SYNCED)
                    .build();

            Herb herb = mapper.toHerb(payload);

            assertNull(herb.getId());
            assertEquals("Asian Ginseng", herb.getTitle());
            assertEquals("asian-ginseng", herb.getSlug());
            assertEquals(HerbStatus.DRAFT, herb.getStatus());
            assertEquals("Native to: Korea, China, Russia, Japan, Mongolia", herb.getHabitat());

            BotanicalInfo info = herb.getBotanicalInfo();
            assertEquals("Panax ginseng C.A.Mey.", info.scientificName());
            assertEquals("ginseng", info.species());
            assertEquals(Long.valueOf(42L), info.sourceIds().get(Provider.TREFLE));
            assertEquals("panax-ginseng", info.sourceSlugs().get(Provider.TREFLE));
            assertEquals(data, info.providerData().get(Provider.TREFLE));
            assertEquals(SYNCED, info.lastSyncedAt().get(Provider.TREFLE));
            assertFalse(info.sourceIds().containsKey(Provider.PERENUAL));

            assertEquals(List.of("Non-toxic according to Trefle database", "Edible plant", "Edible parts: roots"),
                    herb.getSafetyInfo().warnings());
        }

        @Test
        @DisplayName("Maps Perenual description and pests")
        void perenual() {
            EnrichmentPayload payload = EnrichmentPayload.builder(Provider.PERENUAL)
                    .sourceId(7L)
                    .commonName("Peppermint")
                    .scientificName("Mentha x piperita")
                    .toxicity(new ToxicityInfo("none", false, true))
                    .medicinal(true)
                    .providerData(perenualData("A hybrid mint", List.of("Aphids", "Spider mites")))
                    .build();

            Herb herb = mapper.toHerb(payload);

            assertEquals("A hybrid mint", herb.getDescription());
            assertEquals("Susceptible to: Aphids, Spider mites", herb.getPestManagement());
            assertNull(herb.getHabitat());
            assertEquals(List.of("Toxic to pets", "Medicinal use reported by Perenual"),
                    herb.getSafetyInfo().warnings());
        }

        @Test
        @DisplayName("Falls back to the scientific name for the title")
        void scientificNameTitle() {
            Herb herb = mapper.toHerb(EnrichmentPayload.builder(Provider.TREFLE)
                    .sourceId(1L)
                    .commonName(" ")
                    .scientificName("Arnica montana")
                    .build());

            assertEquals("Arnica montana", herb.getTitle());
            assertEquals("arnica-montana", herb.getSlug());
        }

        @Test
        @DisplayName("Rejects a payload without any name")
        void noName() {
            EnrichmentPayload payload = EnrichmentPayload.builder(Provider.TREFLE).sourceId(1L).build();
            assertThrows(IllegalArgumentException.class, () -> mapper.toHerb(payload));
        }
    }

    @Nested
    @DisplayName("safetyWarnings")
    class SafetyWarnings {

        @Test
        @DisplayName("Reports the provider toxicity level and flags")
        void toxic() {
            EnrichmentPayload payload = EnrichmentPayload.builder(Provider.TREFLE)
                    .commonName("Foxglove")
                    .toxicity(new ToxicityInfo("high", true, true))
                    .build();

            assertEquals(List.of("Trefle toxicity level: high", "Toxic to humans", "Toxic to pets"),
                    HerbMapper.safetyWarnings(payload));
        }

        @Test
        @DisplayName("Edible parts are only listed for Trefle data")
        void edibleWithoutParts() {
            EnrichmentPayload payload = EnrichmentPayload.builder(Provider.TREFLE)
                    .commonName("Basil")
                    .edible(true)
                    .providerData(trefleData(List.of()))
                    .build();

            assertEquals(List.of("Non-toxic according to Trefle database", "Edible plant"),
                    HerbMapper.safetyWarnings(payload));
        }
    }

    @Test
    @DisplayName("slugify collapses punctuation and trims dashes")
    void slugify() {
        assertEquals("st-john-s-wort", HerbMapper.slugify("St. John's Wort"));
        assertEquals("aloe-vera", HerbMapper.slugify("  Aloe   Vera!! "));
        assertNull(HerbMapper.slugify("***"));
        assertNull(HerbMapper.slugify(null));
    }
}
