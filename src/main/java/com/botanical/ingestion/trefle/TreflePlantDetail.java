package com.botanical.ingestion.trefle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Full Trefle plant record, including its main species.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TreflePlantDetail(
        long id,
        @JsonProperty("common_name") String commonName,
        String slug,
        @JsonProperty("scientific_name") String scientificName,
        Integer year,
        String bibliography,
        String author,
        @JsonProperty("family_common_name") String familyCommonName,
        @JsonProperty("image_url") String imageUrl,
        JsonNode genus,
        JsonNode family,
        @JsonProperty("main_species") MainSpecies mainSpecies,
        List<Source> sources
) {

    public String genusName() {
        return JsonNames.nameOf(genus);
    }

    public String familyName() {
        return JsonNames.nameOf(family);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MainSpecies(
            Long id,
            @JsonProperty("common_name") String commonName,
            String slug,
            @JsonProperty("scientific_name") String scientificName,
            @JsonProperty("image_url") String imageUrl,
            List<JsonNode> synonyms,
            Distribution distribution,
            Boolean edible,
            @JsonProperty("edible_part") List<String> ediblePart,
            Boolean vegetable,
            Colors flower,
            Colors foliage,
            @JsonProperty("fruit_or_seed") Colors fruitOrSeed,
            Specifications specifications
    ) {

        public List<String> synonymNames() {
            return JsonNames.namesOf(synonyms);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Distribution(
            @JsonProperty("native") List<String> nativeRegions,
            @JsonProperty("introduced") List<String> introducedRegions
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Colors(List<String> color) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Specifications(
            @JsonProperty("growth_form") String growthForm,
            @JsonProperty("growth_habit") String growthHabit,
            @JsonProperty("growth_rate") String growthRate,
            @JsonProperty("average_height") Measurement averageHeight,
            @JsonProperty("maximum_height") Measurement maximumHeight,
            String toxicity
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Measurement(Double cm) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Source(String id, String name, String url, String citation,
                         @JsonProperty("last_update") String lastUpdate) {}
}
