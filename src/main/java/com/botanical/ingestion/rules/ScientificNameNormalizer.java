package com.botanical.ingestion.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Normalizes botanical scientific names so that spelling variants of the same
 * species compare equal.
 *
 * <p>{@code "Panax ginseng C.A.Mey."}, {@code "panax  ginseng"} and
 * {@code "Panax ginseng var. coreensis"} all normalize to {@code "panax ginseng"}.
 * Normalization is pure, total and idempotent: blank or {@code null} input
 * yields {@code ""}.</p>
 */
public class ScientificNameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ScientificNameNormalizer.class);

    private final List<NormalizationRule> rules;

    public ScientificNameNormalizer() {
        this(defaultRules());
    }

    public ScientificNameNormalizer(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Rules for author citations and infraspecific ranks. Each rule strips the
     * matched token and everything after it.
     */
    public static List<NormalizationRule> defaultRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("parenthetical-author")
                        .pattern("\\s+\\(.*$")
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("author-citation")
                        .pattern("\\s+(mill\\.|l\\.|dc\\.|c\\.a\\.mey\\.|sw\\.|willd\\.|ait\\.|lam\\.|thunb\\.|linn\\.|linnaeus\\b).*$")
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("variety")
                        .pattern("\\s+var\\.\\s+.*$")
                        .priority(30)
                        .build(),
                NormalizationRule.builder()
                        .name("subspecies")
                        .pattern("\\s+subsp\\.\\s+.*$")
                        .priority(30)
                        .build()
        );
    }

    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = name.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }
        return result.trim();
    }

    /**
     * Genus and species of a name, or empty when it has fewer than two tokens.
     */
    public Optional<GenusSpecies> extractGenusSpecies(String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = normalized.split(" ");
        if (parts.length < 2) {
            return Optional.empty();
        }
        return Optional.of(new GenusSpecies(parts[0], parts[1]));
    }

    /**
     * True when both names are non-blank and either normalize identically or
     * share genus and species.
     */
    public boolean matches(String name1, String name2) {
        if (name1 == null || name1.isBlank() || name2 == null || name2.isBlank()) {
            return false;
        }
        String normalized1 = normalize(name1);
        String normalized2 = normalize(name2);
        if (!normalized1.isEmpty() && normalized1.equals(normalized2)) {
            return true;
        }
        Optional<GenusSpecies> parts1 = extractGenusSpecies(name1);
        Optional<GenusSpecies> parts2 = extractGenusSpecies(name2);
        return parts1.isPresent() && parts1.equals(parts2);
    }
}
