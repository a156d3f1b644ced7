package com.botanical.ingestion.perenual;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Full Perenual species record.
 *
 * <p>The poisonous flags arrive as {@code 0/1} on most records and as booleans
 * on some, so they are kept as raw JSON and read through {@link #isFlagSet(JsonNode)}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerenualSpeciesDetail(
        long id,
        @JsonProperty("common_name") String commonName,
        @JsonProperty("scientific_name") List<String> scientificName,
        @JsonProperty("other_name") List<String> otherName,
        String family,
        List<String> origin,
        String type,
        String cycle,
        String watering,
        @JsonProperty("watering_period") String wateringPeriod,
        @JsonProperty("watering_general_benchmark") Benchmark wateringGeneralBenchmark,
        List<String> attracts,
        List<String> propagation,
        Hardiness hardiness,
        List<String> sunlight,
        List<String> soil,
        @JsonProperty("pruning_month") List<String> pruningMonth,
        String maintenance,
        @JsonProperty("care_level") String careLevel,
        @JsonProperty("growth_rate") String growthRate,
        @JsonProperty("drought_tolerant") Boolean droughtTolerant,
        @JsonProperty("salt_tolerant") Boolean saltTolerant,
        Boolean indoor,
        Boolean medicinal,
        @JsonProperty("edible_fruit") Boolean edibleFruit,
        @JsonProperty("edible_leaf") Boolean edibleLeaf,
        @JsonProperty("poisonous_to_humans") JsonNode poisonousToHumans,
        @JsonProperty("poisonous_to_pets") JsonNode poisonousToPets,
        @JsonProperty("pest_susceptibility") List<String> pestSusceptibility,
        Boolean flowers,
        Boolean invasive,
        Boolean tropical,
        Boolean rare,
        String description,
        @JsonProperty("default_image") PerenualImage defaultImage
) {

    public String primaryScientificName() {
        return scientificName != null && !scientificName.isEmpty() ? scientificName.get(0) : null;
    }

    public boolean isPoisonousToHumans() {
        return isFlagSet(poisonousToHumans);
    }

    public boolean isPoisonousToPets() {
        return isFlagSet(poisonousToPets);
    }

    static boolean isFlagSet(JsonNode node) {
        if (node == null || node.isNull()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.isNumber() && node.intValue() == 1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hardiness(String min, String max) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Benchmark(String value, String unit) {}
}
