package com.botanical.ingestion.core.model;

/**
 * An entry in a herb's photo gallery. Two images are the same image when they
 * share a non-blank URL or a non-blank id.
 */
public record HerbImage(String id, String url, String caption, String type, String source) {

    public boolean hasUrl() {
        return !ModelCollections.isBlank(url);
    }

    public boolean hasId() {
        return !ModelCollections.isBlank(id);
    }

    public boolean sameAs(HerbImage other) {
        if (other == null) {
            return false;
        }
        return (hasUrl() && url.equals(other.url)) || (hasId() && id.equals(other.id));
    }
}
