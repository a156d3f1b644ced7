package com.botanical.ingestion.merge;

import com.botanical.ingestion.core.model.BotanicalInfo;
import com.botanical.ingestion.core.model.Cultivation;
import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.HerbImage;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.core.model.SafetyInfo;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds an incoming herb into an existing one without losing information.
 *
 * <p>The merge is pure and idempotent: {@code merge(x, x).equals(x)}.</p>
 * <ul>
 *   <li>Scalars keep the existing value and only fill gaps.</li>
 *   <li>Per-provider source IDs, slugs, raw data and sync times take the incoming value.</li>
 *   <li>Lists are unioned, case-insensitively for strings, existing entries first.</li>
 *   <li>Free-text notes are appended with a separator unless already present.</li>
 *   <li>Cultivation is overlaid field by field.</li>
 *   <li>{@code id} and {@code status} always come from the existing record.</li>
 * </ul>
 */
public class HerbMerger {

    public static final String NOTE_SEPARATOR = "\n\n---\n\n";

    public Herb merge(Herb existing, Herb incoming) {
        BotanicalInfo current = existing.getBotanicalInfo();
        BotanicalInfo update = incoming.getBotanicalInfo();

        BotanicalInfo botanicalInfo = BotanicalInfo.builder()
                .scientificName(preferFilled(current.scientificName(), update.scientificName()))
                .family(preferFilled(current.family(), update.family()))
                .genus(preferFilled(current.genus(), update.genus()))
                .species(preferFilled(current.species(), update.species()))
                .sourceIds(overlay(current.sourceIds(), update.sourceIds()))
                .sourceSlugs(overlay(current.sourceSlugs(), update.sourceSlugs()))
                .providerData(overlay(current.providerData(), update.providerData()))
                .synonyms(combine(current.synonyms(), update.synonyms()))
                .origin(combine(current.origin(), update.origin()))
                .lastSyncedAt(overlay(current.lastSyncedAt(), update.lastSyncedAt()))
                .build();

        SafetyInfo safety = new SafetyInfo(
                combine(existing.getSafetyInfo().warnings(), incoming.getSafetyInfo().warnings()),
                combine(existing.getSafetyInfo().contraindications(), incoming.getSafetyInfo().contraindications()),
                combine(existing.getSafetyInfo().interactions(), incoming.getSafetyInfo().interactions()));

        return Herb.builder(existing)
                .title(preferFilled(existing.getTitle(), incoming.getTitle()))
                .slug(preferFilled(existing.getSlug(), incoming.getSlug()))
                .description(preferFilled(existing.getDescription(), incoming.getDescription()))
                .botanicalInfo(botanicalInfo)
                .cultivation(mergeCultivation(existing.getCultivation(), incoming.getCultivation()))
                .cultivationNotes(appendNote(existing.getCultivationNotes(), incoming.getCultivationNotes()))
                .pestManagement(appendNote(existing.getPestManagement(), incoming.getPestManagement()))
                .habitat(appendNote(existing.getHabitat(), incoming.getHabitat()))
                .photoGallery(combineImages(existing.getPhotoGallery(), incoming.getPhotoGallery()))
                .safetyInfo(safety)
                .build();
    }

    /**
     * Union of two string lists. Every existing entry is kept as-is; an incoming
     * entry is added only if no entry with the same text, ignoring case, is already present.
     */
    public static List<String> combine(List<String> existing, List<String> incoming) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (existing != null) {
            for (String value : existing) {
                if (value != null) {
                    result.add(value);
                    seen.add(value.toLowerCase(Locale.ROOT));
                }
            }
        }
        if (incoming != null) {
            for (String value : incoming) {
                if (value != null && seen.add(value.toLowerCase(Locale.ROOT))) {
                    result.add(value);
                }
            }
        }
        return result;
    }

    /**
     * Union of two galleries. An incoming image is dropped when an image already
     * kept shares its url or its id; one with neither is compared by value.
     */
    public static List<HerbImage> combineImages(List<HerbImage> existing, List<HerbImage> incoming) {
        List<HerbImage> result = new ArrayList<>();
        Set<String> urls = new HashSet<>();
        Set<String> ids = new HashSet<>();
        if (existing != null) {
            for (HerbImage image : existing) {
                if (image != null) {
                    keep(image, result, urls, ids);
                }
            }
        }
        if (incoming != null) {
            for (HerbImage image : incoming) {
                if (image == null) {
                    continue;
                }
                boolean duplicate = image.hasUrl() || image.hasId()
                        ? (image.hasUrl() && urls.contains(image.url())) || (image.hasId() && ids.contains(image.id()))
                        : result.contains(image);
                if (!duplicate) {
                    keep(image, result, urls, ids);
                }
            }
        }
        return result;
    }

    private static void keep(HerbImage image, List<HerbImage> result, Set<String> urls, Set<String> ids) {
        result.add(image);
        if (image.hasUrl()) {
            urls.add(image.url());
        }
        if (image.hasId()) {
            ids.add(image.id());
        }
    }

    /**
     * Appends {@code incoming} to {@code existing} with {@link #NOTE_SEPARATOR},
     * unless either is blank or {@code existing} already contains it.
     */
    static String appendNote(String existing, String incoming) {
        if (isBlank(incoming)) {
            return existing;
        }
        if (isBlank(existing)) {
            return incoming;
        }
        if (existing.contains(incoming)) {
            return existing;
        }
        return existing + NOTE_SEPARATOR + incoming;
    }

    private static Cultivation mergeCultivation(Cultivation existing, Cultivation incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return existing;
        }
        if (existing == null || existing.isEmpty()) {
            return incoming;
        }
        return existing.overlay(incoming);
    }

    private static <V> Map<Provider, V> overlay(Map<Provider, V> existing, Map<Provider, V> incoming) {
        Map<Provider, V> result = new EnumMap<>(Provider.class);
        result.putAll(existing);
        result.putAll(incoming);
        return result;
    }

    private static String preferFilled(String existing, String incoming) {
        return isBlank(existing) ? incoming : existing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
