package com.botanical.ingestion.dedup;

import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.resolution.MatchType;

import java.util.Optional;

/**
 * Outcome of ingesting one provider record.
 *
 * @param herb      the stored herb, as returned by the store
 * @param created   true when a new draft was created, false when an existing record was updated
 * @param matchType how the existing record was found; {@code null} when created
 */
public record IngestResult(Herb herb, boolean created, MatchType matchType) {

    public static IngestResult created(Herb herb) {
        return new IngestResult(herb, true, null);
    }

    public static IngestResult updated(Herb herb, MatchType matchType) {
        return new IngestResult(herb, false, matchType);
    }

    public Optional<MatchType> getMatchType() {
        return Optional.ofNullable(matchType);
    }
}
