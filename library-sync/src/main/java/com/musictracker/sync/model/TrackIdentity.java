package com.musictracker.sync.model;

import java.util.Locale;

/**
 * The logical track a listening event refers to.
 */
public record TrackIdentity(String artist, String album, String title) {

    /** Normalised {@code artist|album|title}, the form stored and compared. */
    public String key() {
        return normalise(artist) + "|" + normalise(album) + "|" + normalise(title);
    }

    private static String normalise(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
