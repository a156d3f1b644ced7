package com.botanical.ingestion.core.model;

/**
 * Editorial status of a canonical herb record.
 */
public enum HerbStatus {
    /**
     * Created by ingestion, not yet reviewed by an editor.
     */
    DRAFT,

    /**
     * Visible on the site.
     */
    PUBLISHED
}
