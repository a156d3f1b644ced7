package com.botanical.ingestion.store;

import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.Provider;

import java.util.Objects;

/**
 * Equality filter over herb records. At most one criterion is set;
 * {@link #all()} sets none.
 *
 * @param provider provider whose source ID is matched, with {@code sourceId}
 * @param sourceId provider-assigned ID
 * @param title    exact title
 */
public record HerbQuery(Provider provider, Long sourceId, String title) {

    public HerbQuery {
        if ((provider == null) != (sourceId == null)) {
            throw new IllegalArgumentException("provider and sourceId must be given together");
        }
        if (sourceId != null && title != null) {
            throw new IllegalArgumentException("a query filters by source ID or by title, not both");
        }
    }

    public static HerbQuery bySourceId(Provider provider, long sourceId) {
        return new HerbQuery(Objects.requireNonNull(provider, "provider"), sourceId, null);
    }

    public static HerbQuery byTitle(String title) {
        return new HerbQuery(null, null, Objects.requireNonNull(title, "title"));
    }

    public static HerbQuery all() {
        return new HerbQuery(null, null, null);
    }

    public boolean isAll() {
        return sourceId == null && title == null;
    }

    /**
     * Evaluates this filter against a record, for stores without a native query language.
     */
    public boolean test(Herb herb) {
        if (sourceId != null) {
            return herb.getBotanicalInfo().sourceId(provider).map(sourceId::equals).orElse(false);
        }
        if (title != null) {
            return title.equals(herb.getTitle());
        }
        return true;
    }
}
