package com.botanical.ingestion.perenual;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Perenual {@code default_image} block.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerenualImage(
        Integer license,
        @JsonProperty("license_name") String licenseName,
        @JsonProperty("original_url") String originalUrl,
        @JsonProperty("regular_url") String regularUrl,
        @JsonProperty("medium_url") String mediumUrl,
        @JsonProperty("small_url") String smallUrl,
        String thumbnail
) {}
