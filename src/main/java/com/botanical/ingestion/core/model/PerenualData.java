package com.botanical.ingestion.core.model;

import java.util.List;

/**
 * Perenual-specific care details that have no canonical field on the herb record.
 */
public record PerenualData(
        List<String> otherNames,
        String type,
        List<String> attracts,
        boolean poisonousToHumans,
        boolean poisonousToPets,
        String wateringBenchmarkValue,
        String wateringBenchmarkUnit,
        String careLevel,
        String description,
        List<String> pestSusceptibility,
        boolean flowers,
        boolean invasive,
        boolean tropical,
        boolean rare
) implements ProviderData {

    public PerenualData {
        otherNames = ModelCollections.copyOrEmpty(otherNames);
        attracts = ModelCollections.copyOrEmpty(attracts);
        pestSusceptibility = ModelCollections.copyOrEmpty(pestSusceptibility);
    }

    @Override
    public Provider provider() {
        return Provider.PERENUAL;
    }
}
