package com.botanical.ingestion.resolution;

import com.botanical.ingestion.core.model.BotanicalInfo;
import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.rules.ScientificNameNormalizer;
import com.botanical.ingestion.store.InMemoryHerbStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HerbResolverTest {

    private InMemoryHerbStore store;
    private HerbResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryHerbStore();
        resolver = new HerbResolver(store, new ScientificNameNormalizer());
    }

    private Herb stored(String title, String scientificName, Provider provider, Long sourceId) {
        BotanicalInfo.Builder info = BotanicalInfo.builder().scientificName(scientificName);
        if (provider != null) {
            info.sourceId(provider, sourceId);
        }
        return store.create(Herb.builder().title(title).botanicalInfo(info.build()).build());
    }

    @Nested
    @DisplayName("Match priority")
    class Priority {

        @Test
        @DisplayName("Source ID wins over scientific name and title")
        void sourceIdFirst() {
            stored("Ginseng", "Panax ginseng", null, null);
            Herb byId = stored("Asian ginseng", "Panax quinquefolius", Provider.TREFLE, 42L);

            Optional<HerbMatch> match = resolver.find(
                    new MatchCriteria(Map.of(Provider.TREFLE, 42L), "Panax ginseng", "Ginseng"));

            assertEquals(MatchType.SOURCE_ID, match.orElseThrow().matchType());
            assertEquals(byId.getId(), match.get().herb().getId());
        }

        @Test
        @DisplayName("Source IDs are per provider")
        void sourceIdPerProvider() {
            stored("Ginseng", "Panax ginseng", Provider.TREFLE, 42L);

            assertTrue(resolver.find(MatchCriteria.bySourceId(Provider.PERENUAL, 42L)).isEmpty());
            assertTrue(resolver.find(MatchCriteria.bySourceId(Provider.TREFLE, 42L)).isPresent());
        }

        @Test
        @DisplayName("Scientific name wins over title")
        void scientificNameBeforeTitle() {
            stored("Ginseng", "Panax quinquefolius", null, null);
            Herb byName = stored("Korean ginseng", "Panax ginseng C.A.Mey.", null, null);

            HerbMatch match = resolver.find(MatchCriteria.byNames("Panax ginseng", "Ginseng")).orElseThrow();

            assertEquals(MatchType.SCIENTIFIC_NAME, match.matchType());
            assertEquals(byName.getId(), match.herb().getId());
        }

        @Test
        @DisplayName("Falls back to exact title")
        void titleFallback() {
            Herb herb = stored("Ginseng", null, null, null);

            HerbMatch match = resolver.find(MatchCriteria.byNames("Panax ginseng", "Ginseng")).orElseThrow();

            assertEquals(MatchType.COMMON_NAME, match.matchType());
            assertEquals(herb.getId(), match.herb().getId());
            assertTrue(resolver.find(MatchCriteria.byNames(null, "ginseng")).isEmpty());
        }
    }

    @Test
    @DisplayName("No evidence finds nothing")
    void emptyCriteria() {
        stored("Ginseng", "Panax ginseng", Provider.TREFLE, 1L);
        assertTrue(resolver.find(new MatchCriteria(null, null, null)).isEmpty());
    }

    @Test
    @DisplayName("Criteria built from a herb carry its IDs and names")
    void criteriaOfHerb() {
        Herb herb = Herb.builder()
                .title("Ginseng")
                .botanicalInfo(BotanicalInfo.builder()
                        .scientificName("Panax ginseng")
                        .sourceId(Provider.PERENUAL, 7L)
                        .build())
                .build();

        MatchCriteria criteria = MatchCriteria.of(herb);

        assertEquals(Map.of(Provider.PERENUAL, 7L), criteria.sourceIds());
        assertEquals("Panax ginseng", criteria.scientificName());
        assertEquals("Ginseng", criteria.commonName());
    }

    @Test
    @DisplayName("Scientific-name scan only sees the first page")
    void scanPageLimit() {
        HerbResolver small = new HerbResolver(store, new ScientificNameNormalizer(), 2);
        stored("A", "Achillea millefolium", null, null);
        stored("B", "Arnica montana", null, null);
        stored("C", "Panax ginseng", null, null);

        assertTrue(small.find(MatchCriteria.byNames("Panax ginseng", null)).isEmpty());
        assertTrue(resolver.find(MatchCriteria.byNames("Panax ginseng", null)).isPresent());
    }

    @Test
    @DisplayName("Page size must be positive")
    void invalidPageSize() {
        assertThrows(IllegalArgumentException.class,
                () -> new HerbResolver(store, new ScientificNameNormalizer(), 0));
    }
}
