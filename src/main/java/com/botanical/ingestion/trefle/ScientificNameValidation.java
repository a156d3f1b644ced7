package com.botanical.ingestion.trefle;

import java.util.List;
import java.util.Optional;

/**
 * Result of checking a scientific name against Trefle.
 *
 * @param valid       true when Trefle has a plant with exactly this name
 * @param suggestions up to three candidate names when the name is not exact
 * @param match       the exact match, or the closest search result; may be {@code null}
 */
public record ScientificNameValidation(boolean valid, List<String> suggestions, TreflePlant match) {

    public ScientificNameValidation {
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public static ScientificNameValidation notFound() {
        return new ScientificNameValidation(false, List.of(), null);
    }

    public Optional<TreflePlant> getMatch() {
        return Optional.ofNullable(match);
    }
}
