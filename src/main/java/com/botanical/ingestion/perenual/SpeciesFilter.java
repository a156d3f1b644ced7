package com.botanical.ingestion.perenual;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filters for {@link PerenualClient#searchSpeciesFiltered(SpeciesFilter)}.
 * Unset flags are not sent; set flags are sent as {@code 1} or {@code 0}.
 */
public record SpeciesFilter(
        String query,
        Boolean medicinal,
        Boolean edible,
        Boolean poisonous,
        Boolean indoor,
        int page,
        int pageSize
) {

    public SpeciesFilter {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
    }

    Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (query != null && !query.isBlank()) {
            params.put("q", query);
        }
        putFlag(params, "medicinal", medicinal);
        putFlag(params, "edible", edible);
        putFlag(params, "poisonous", poisonous);
        putFlag(params, "indoor", indoor);
        params.put("page", page);
        params.put("per_page", pageSize);
        return params;
    }

    private static void putFlag(Map<String, Object> params, String name, Boolean value) {
        if (value != null) {
            params.put(name, value ? 1 : 0);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String query;
        private Boolean medicinal;
        private Boolean edible;
        private Boolean poisonous;
        private Boolean indoor;
        private int page = 1;
        private int pageSize = PerenualClient.DEFAULT_PAGE_SIZE;

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder medicinal(boolean medicinal) {
            this.medicinal = medicinal;
            return this;
        }

        public Builder edible(boolean edible) {
            this.edible = edible;
            return this;
        }

        public Builder poisonous(boolean poisonous) {
            this.poisonous = poisonous;
            return this;
        }

        public Builder indoor(boolean indoor) {
            this.indoor = indoor;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public SpeciesFilter build() {
            return new SpeciesFilter(query, medicinal, edible, poisonous, indoor, page, pageSize);
        }
    }
}
