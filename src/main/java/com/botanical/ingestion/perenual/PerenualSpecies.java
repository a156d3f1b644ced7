package com.botanical.ingestion.perenual;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Species summary as returned by the Perenual species list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerenualSpecies(
        long id,
        @JsonProperty("common_name") String commonName,
        @JsonProperty("scientific_name") List<String> scientificName,
        @JsonProperty("other_name") List<String> otherName,
        String cycle,
        String watering,
        List<String> sunlight,
        @JsonProperty("default_image") PerenualImage defaultImage
) {

    /**
     * First listed scientific name, or {@code null}.
     */
    public String primaryScientificName() {
        return scientificName != null && !scientificName.isEmpty() ? scientificName.get(0) : null;
    }
}
