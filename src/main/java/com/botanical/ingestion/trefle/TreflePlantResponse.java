package com.botanical.ingestion.trefle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Envelope of the Trefle single-plant endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TreflePlantResponse(TreflePlantDetail data) {}
