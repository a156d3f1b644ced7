package com.botanical.ingestion.perenual;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Paginated Perenual species list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerenualListResponse(
        List<PerenualSpecies> data,
        Integer to,
        @JsonProperty("per_page") Integer perPage,
        @JsonProperty("current_page") Integer currentPage,
        Integer from,
        @JsonProperty("last_page") Integer lastPage,
        Integer total
) {

    public PerenualListResponse {
        data = data != null ? List.copyOf(data) : List.of();
    }

    public boolean hasNextPage() {
        return currentPage != null && lastPage != null && currentPage < lastPage;
    }
}
