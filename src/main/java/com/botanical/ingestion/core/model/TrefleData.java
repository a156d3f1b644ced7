package com.botanical.ingestion.core.model;

import java.util.List;

/**
 * Trefle-specific botanical details that have no canonical field on the herb record.
 */
public record TrefleData(
        String author,
        Integer year,
        String bibliography,
        String familyCommonName,
        List<String> nativeRegions,
        List<String> introducedRegions,
        List<String> edibleParts,
        boolean vegetable,
        String toxicity,
        String growthHabit,
        String growthForm,
        String growthRate,
        Double averageHeightCm,
        Double maximumHeightCm,
        List<String> flowerColor,
        List<String> foliageColor,
        List<String> fruitColor,
        List<String> sources
) implements ProviderData {

    public TrefleData {
        nativeRegions = ModelCollections.copyOrEmpty(nativeRegions);
        introducedRegions = ModelCollections.copyOrEmpty(introducedRegions);
        edibleParts = ModelCollections.copyOrEmpty(edibleParts);
        flowerColor = ModelCollections.copyOrEmpty(flowerColor);
        foliageColor = ModelCollections.copyOrEmpty(foliageColor);
        fruitColor = ModelCollections.copyOrEmpty(fruitColor);
        sources = ModelCollections.copyOrEmpty(sources);
        toxicity = ModelCollections.isBlank(toxicity) ? "none" : toxicity;
    }

    @Override
    public Provider provider() {
        return Provider.TREFLE;
    }
}
