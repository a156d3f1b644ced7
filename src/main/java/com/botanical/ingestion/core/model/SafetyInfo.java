package com.botanical.ingestion.core.model;

import java.util.List;

/**
 * Safety notes attached to a herb.
 */
public record SafetyInfo(List<String> warnings, List<String> contraindications, List<String> interactions) {

    public SafetyInfo {
        warnings = ModelCollections.copyOrEmpty(warnings);
        contraindications = ModelCollections.copyOrEmpty(contraindications);
        interactions = ModelCollections.copyOrEmpty(interactions);
    }

    public static SafetyInfo empty() {
        return new SafetyInfo(List.of(), List.of(), List.of());
    }

    public static SafetyInfo ofWarnings(List<String> warnings) {
        return new SafetyInfo(warnings, List.of(), List.of());
    }

    public boolean isEmpty() {
        return warnings.isEmpty() && contraindications.isEmpty() && interactions.isEmpty();
    }
}
