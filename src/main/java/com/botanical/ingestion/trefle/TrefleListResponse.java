package com.botanical.ingestion.trefle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Paginated Trefle list or search response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrefleListResponse(List<TreflePlant> data, Links links, Meta meta) {

    public TrefleListResponse {
        data = data != null ? List.copyOf(data) : List.of();
    }

    public long total() {
        return meta != null ? meta.total() : data.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Links(String self, String first, String last, String next, String prev) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(long total) {}
}
