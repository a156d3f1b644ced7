package com.botanical.ingestion.rules;

/**
 * The first two tokens of a normalized scientific name.
 */
public record GenusSpecies(String genus, String species) {}
