package com.botanical.ingestion.trefle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Plant summary as returned by Trefle list and search endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TreflePlant(
        long id,
        @JsonProperty("common_name") String commonName,
        String slug,
        @JsonProperty("scientific_name") String scientificName,
        Integer year,
        String bibliography,
        String author,
        String status,
        String rank,
        @JsonProperty("family_common_name") String familyCommonName,
        @JsonProperty("genus_id") Long genusId,
        @JsonProperty("image_url") String imageUrl,
        List<JsonNode> synonyms,
        JsonNode genus,
        JsonNode family
) {

    public String genusName() {
        return JsonNames.nameOf(genus);
    }

    public String familyName() {
        return JsonNames.nameOf(family);
    }

    public List<String> synonymNames() {
        return JsonNames.namesOf(synonyms);
    }
}
