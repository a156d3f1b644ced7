package com.botanical.ingestion.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScientificNameNormalizerTest {

    private final ScientificNameNormalizer normalizer = new ScientificNameNormalizer();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource({
                "Panax ginseng C.A.Mey.,            panax ginseng",
                "'  Panax   GINSENG  ',             panax ginseng",
                "Panax ginseng var. coreensis,      panax ginseng",
                "Arnica montana subsp. atlantica,   arnica montana",
                "Echinacea purpurea (L.) Moench,    echinacea purpurea",
                "Mentha x piperita L.,              mentha x piperita",
                "Achillea millefolium L.,           achillea millefolium",
                "Salvia officinalis Linnaeus,       salvia officinalis",
                "Aloe vera (L.) Burm.f.,            aloe vera",
                "Hypericum perforatum,              hypericum perforatum"
        })
        @DisplayName("Strips authors and infraspecific ranks")
        void strips(String input, String expected) {
            assertEquals(expected, normalizer.normalize(input));
        }

        @Test
        @DisplayName("Blank and null yield the empty string")
        void blank() {
            assertEquals("", normalizer.normalize(null));
            assertEquals("", normalizer.normalize("   "));
        }

        @Test
        @DisplayName("Normalization is idempotent")
        void idempotent() {
            String once = normalizer.normalize("Panax ginseng C.A.Mey. var. coreensis");
            assertEquals(once, normalizer.normalize(once));
        }
    }

    @Nested
    @DisplayName("extractGenusSpecies")
    class Extract {

        @Test
        @DisplayName("Returns genus and species of a binomial")
        void binomial() {
            assertEquals(new GenusSpecies("panax", "ginseng"),
                    normalizer.extractGenusSpecies("Panax ginseng C.A.Mey.").orElseThrow());
        }

        @Test
        @DisplayName("Single token has no genus and species")
        void singleToken() {
            assertTrue(normalizer.extractGenusSpecies("Panax").isEmpty());
            assertTrue(normalizer.extractGenusSpecies("").isEmpty());
        }
    }

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("Author and rank variants match")
        void variantsMatch() {
            assertTrue(normalizer.matches("Panax ginseng", "Panax ginseng C.A.Mey."));
            assertTrue(normalizer.matches("Panax ginseng", "PANAX GINSENG var. coreensis"));
        }

        @Test
        @DisplayName("Shared genus and species match despite trailing tokens")
        void genusSpeciesMatch() {
            assertTrue(normalizer.matches("Panax ginseng", "Panax ginseng Meyer"));
        }

        @Test
        @DisplayName("Different species or blank names do not match")
        void nonMatches() {
            assertFalse(normalizer.matches("Panax ginseng", "Panax quinquefolius"));
            assertFalse(normalizer.matches(null, "Panax ginseng"));
            assertFalse(normalizer.matches("", ""));
        }
    }

    @Test
    @DisplayName("Custom rules run in priority order")
    void customRules() {
        ScientificNameNormalizer custom = new ScientificNameNormalizer(List.of(
                NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()));

        assertEquals("cc", custom.normalize("ab"));
    }
}
