package com.botanical.ingestion.dedup;

import com.botanical.ingestion.core.model.BotanicalInfo;
import com.botanical.ingestion.core.model.EnrichmentPayload;
import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.HerbStatus;
import com.botanical.ingestion.core.model.PerenualData;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.core.model.SafetyInfo;
import com.botanical.ingestion.core.model.ToxicityInfo;
import com.botanical.ingestion.core.model.TrefleData;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a provider payload into the herb record it would become if nothing matched.
 */
public class HerbMapper {

    static final int HABITAT_REGION_LIMIT = 5;

    public Herb toHerb(EnrichmentPayload payload) {
        String title = firstNonBlank(payload.commonName(), payload.scientificName());
        if (title == null) {
            throw new IllegalArgumentException(payload.provider().displayName()
                    + " payload " + payload.sourceId() + " has neither a common nor a scientific name");
        }
        Provider provider = payload.provider();

        BotanicalInfo botanicalInfo = BotanicalInfo.builder()
                .scientificName(payload.scientificName())
                .family(payload.family())
                .genus(payload.genus())
                .species(speciesEpithet(payload.scientificName()))
                .sourceId(provider, payload.sourceId())
                .sourceSlug(provider, payload.sourceSlug())
                .providerData(payload.providerData())
                .synonyms(payload.synonyms())
                .origin(payload.origin())
                .lastSyncedAt(provider, payload.syncedAt())
                .build();

        Herb.Builder herb = Herb.builder()
                .title(title)
                .slug(slugify(title))
                .status(HerbStatus.DRAFT)
                .botanicalInfo(botanicalInfo)
                .cultivation(payload.cultivation())
                .habitat(habitat(payload.origin()))
                .photoGallery(payload.images())
                .safetyInfo(SafetyInfo.ofWarnings(safetyWarnings(payload)));

        if (payload.providerData() instanceof PerenualData perenual) {
            herb.description(blankToNull(perenual.description()));
            if (!perenual.pestSusceptibility().isEmpty()) {
                herb.pestManagement("Susceptible to: " + String.join(", ", perenual.pestSusceptibility()));
            }
        }
        return herb.build();
    }

    /**
     * Lowercase, ASCII alphanumerics separated by single hyphens.
     */
    public static String slugify(String text) {
        if (text == null) {
            return null;
        }
        String slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? null : slug;
    }

    static String habitat(List<String> origin) {
        if (origin == null || origin.isEmpty()) {
            return null;
        }
        return "Native to: " + String.join(", ", origin.subList(0, Math.min(HABITAT_REGION_LIMIT, origin.size())));
    }

    static List<String> safetyWarnings(EnrichmentPayload payload) {
        String source = payload.provider().displayName();
        ToxicityInfo toxicity = payload.toxicity();
        List<String> warnings = new ArrayList<>();

        if (!"none".equalsIgnoreCase(toxicity.level())) {
            warnings.add(source + " toxicity level: " + toxicity.level());
        } else if (!toxicity.toxicToHumans() && !toxicity.toxicToPets()) {
            warnings.add("Non-toxic according to " + source + " database");
        }
        if (toxicity.toxicToHumans()) {
            warnings.add("Toxic to humans");
        }
        if (toxicity.toxicToPets()) {
            warnings.add("Toxic to pets");
        }
        if (payload.edible()) {
            warnings.add("Edible plant");
            if (payload.providerData() instanceof TrefleData trefle && !trefle.edibleParts().isEmpty()) {
                warnings.add("Edible parts: " + String.join(", ", trefle.edibleParts()));
            }
        }
        if (payload.medicinal()) {
            warnings.add("Medicinal use reported by " + source);
        }
        return warnings;
    }

    private static String speciesEpithet(String scientificName) {
        if (scientificName == null) {
            return null;
        }
        String[] parts = scientificName.trim().split("\\s+");
        return parts.length >= 2 ? parts[1].toLowerCase(Locale.ROOT) : null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
