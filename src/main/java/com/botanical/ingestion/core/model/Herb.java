package com.botanical.ingestion.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical herb record: the single representation of one real-world plant species.
 * Immutable; use {@link #builder(Herb)} to derive a modified copy.
 */
public class Herb {
    private final String id;
    private final String title;
    private final String slug;
    private final String description;
    private final HerbStatus status;
    private final BotanicalInfo botanicalInfo;
    private final Cultivation cultivation;
    private final String cultivationNotes;
    private final String pestManagement;
    private final String habitat;
    private final List<HerbImage> photoGallery;
    private final SafetyInfo safetyInfo;

    private Herb(Builder builder) {
        this.id = builder.id;
        this.title = builder.title;
        this.slug = builder.slug;
        this.description = builder.description;
        this.status = builder.status != null ? builder.status : HerbStatus.DRAFT;
        this.botanicalInfo = builder.botanicalInfo != null ? builder.botanicalInfo : BotanicalInfo.empty();
        this.cultivation = builder.cultivation != null ? builder.cultivation : Cultivation.empty();
        this.cultivationNotes = builder.cultivationNotes;
        this.pestManagement = builder.pestManagement;
        this.habitat = builder.habitat;
        this.photoGallery = ModelCollections.copyOrEmpty(builder.photoGallery);
        this.safetyInfo = builder.safetyInfo != null ? builder.safetyInfo : SafetyInfo.empty();
    }

    /**
     * Store-assigned identifier; {@code null} until the record has been created.
     */
    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getSlug() {
        return slug;
    }

    public String getDescription() {
        return description;
    }

    public HerbStatus getStatus() {
        return status;
    }

    public BotanicalInfo getBotanicalInfo() {
        return botanicalInfo;
    }

    public String getScientificName() {
        return botanicalInfo.scientificName();
    }

    public Cultivation getCultivation() {
        return cultivation;
    }

    public String getCultivationNotes() {
        return cultivationNotes;
    }

    public String getPestManagement() {
        return pestManagement;
    }

    public String getHabitat() {
        return habitat;
    }

    public List<HerbImage> getPhotoGallery() {
        return photoGallery;
    }

    public SafetyInfo getSafetyInfo() {
        return safetyInfo;
    }

    public boolean isPublished() {
        return status == HerbStatus.PUBLISHED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Herb herb = (Herb) o;
        return Objects.equals(id, herb.id)
                && Objects.equals(title, herb.title)
                && Objects.equals(slug, herb.slug)
                && Objects.equals(description, herb.description)
                && status == herb.status
                && Objects.equals(botanicalInfo, herb.botanicalInfo)
                && Objects.equals(cultivation, herb.cultivation)
                && Objects.equals(cultivationNotes, herb.cultivationNotes)
                && Objects.equals(pestManagement, herb.pestManagement)
                && Objects.equals(habitat, herb.habitat)
                && Objects.equals(photoGallery, herb.photoGallery)
                && Objects.equals(safetyInfo, herb.safetyInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, slug, description, status, botanicalInfo, cultivation,
                cultivationNotes, pestManagement, habitat, photoGallery, safetyInfo);
    }

    @Override
    public String toString() {
        return "Herb{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", scientificName='" + botanicalInfo.scientificName() + '\'' +
                ", status=" + status +
                ", sourceIds=" + botanicalInfo.sourceIds() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Herb herb) {
        return new Builder()
                .id(herb.id)
                .title(herb.title)
                .slug(herb.slug)
                .description(herb.description)
                .status(herb.status)
                .botanicalInfo(herb.botanicalInfo)
                .cultivation(herb.cultivation)
                .cultivationNotes(herb.cultivationNotes)
                .pestManagement(herb.pestManagement)
                .habitat(herb.habitat)
                .photoGallery(herb.photoGallery)
                .safetyInfo(herb.safetyInfo);
    }

    public static class Builder {
        private String id;
        private String title;
        private String slug;
        private String description;
        private HerbStatus status;
        private BotanicalInfo botanicalInfo;
        private Cultivation cultivation;
        private String cultivationNotes;
        private String pestManagement;
        private String habitat;
        private List<HerbImage> photoGallery;
        private SafetyInfo safetyInfo;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(HerbStatus status) {
            this.status = status;
            return this;
        }

        public Builder botanicalInfo(BotanicalInfo botanicalInfo) {
            this.botanicalInfo = botanicalInfo;
            return this;
        }

        public Builder cultivation(Cultivation cultivation) {
            this.cultivation = cultivation;
            return this;
        }

        public Builder cultivationNotes(String cultivationNotes) {
            this.cultivationNotes = cultivationNotes;
            return this;
        }

        public Builder pestManagement(String pestManagement) {
            this.pestManagement = pestManagement;
            return this;
        }

        public Builder habitat(String habitat) {
            this.habitat = habitat;
            return this;
        }

        public Builder photoGallery(List<HerbImage> photoGallery) {
            this.photoGallery = photoGallery;
            return this;
        }

        public Builder safetyInfo(SafetyInfo safetyInfo) {
            this.safetyInfo = safetyInfo;
            return this;
        }

        public Herb build() {
            return new Herb(this);
        }
    }
}
