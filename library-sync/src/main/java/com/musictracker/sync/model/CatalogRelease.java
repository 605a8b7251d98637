package com.musictracker.sync.model;

import java.util.List;

/**
 * A collection entry as listed on a Discogs collection page. The full release is only
 * fetched for entries that turn out to be new.
 */
public record CatalogRelease(String releaseId, String title, List<String> artists) implements ExternalRecord {

    public CatalogRelease {
        artists = artists == null ? List.of() : List.copyOf(artists);
    }

    @Override
    public String naturalKey() {
        return releaseId;
    }

    @Override
    public String label() {
        String title = this.title == null ? "Unknown" : this.title;
        return artists.isEmpty() ? title : artists.get(0) + " - " + title;
    }
}
