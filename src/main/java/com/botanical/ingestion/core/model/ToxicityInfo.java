package com.botanical.ingestion.core.model;

/**
 * Toxicity as reported by a provider.
 *
 * @param level         free-text level, {@code "none"} when the provider is silent
 * @param toxicToHumans whether the provider flags the plant as poisonous to humans
 * @param toxicToPets   whether the provider flags the plant as poisonous to pets
 */
public record ToxicityInfo(String level, boolean toxicToHumans, boolean toxicToPets) {

    public ToxicityInfo {
        level = ModelCollections.isBlank(level) ? "none" : level;
    }

    public static ToxicityInfo none() {
        return new ToxicityInfo("none", false, false);
    }

    public boolean isNone() {
        return "none".equalsIgnoreCase(level) && !toxicToHumans && !toxicToPets;
    }
}
