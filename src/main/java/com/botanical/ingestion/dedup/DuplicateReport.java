package com.botanical.ingestion.dedup;

import java.util.List;

/**
 * Read-only listing of herbs that share a normalized scientific name.
 */
public record DuplicateReport(boolean hasDuplicate, List<Entry> duplicates) {

    public DuplicateReport {
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
    }

    public static DuplicateReport none() {
        return new DuplicateReport(false, List.of());
    }

    /**
     * One member of a duplicate group.
     *
     * @param sources provider names that contributed to the record, or {@code "Manual"}
     */
    public record Entry(String id, String title, String scientificName, String normalizedName, List<String> sources) {

        public Entry {
            sources = sources != null ? List.copyOf(sources) : List.of();
        }
    }
}
