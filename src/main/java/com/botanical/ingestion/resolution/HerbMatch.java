package com.botanical.ingestion.resolution;

import com.botanical.ingestion.core.model.Herb;

/**
 * An existing herb found for an incoming record, with the rule that found it.
 */
public record HerbMatch(Herb herb, MatchType matchType) {}
