package com.botanical.ingestion.resolution;

/**
 * How an incoming record was matched to an existing herb, in priority order.
 */
public enum MatchType {
    /** Same provider, same provider-assigned ID. */
    SOURCE_ID,
    /** Scientific names match after normalization. */
    SCIENTIFIC_NAME,
    /** Exact title match on the common name. */
    COMMON_NAME
}
