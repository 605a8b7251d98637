package com.musictracker.sync.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * The two collections the service imports. Each kind has at most one running job.
 */
public enum SyncKind {

    /** A user's Discogs collection, keyed by release id. */
    CATALOG("discogs", false),

    /** A user's Last.fm scrobbles, keyed by track identity and timestamp. */
    HISTORY("lastfm", true);

    private final String dependency;
    private final boolean windowed;

    SyncKind(String dependency, boolean windowed) {
        this.dependency = dependency;
        this.windowed = windowed;
    }

    /** Name of the upstream dependency, also the circuit breaker name. */
    public String dependency() {
        return dependency;
    }

    /** Whether the time-window duplicate rule applies to this kind. */
    public boolean isWindowed() {
        return windowed;
    }

    public String pathName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncKind fromPath(String value) {
        return Arrays.stream(values())
                .filter(k -> k.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sync kind: " + value));
    }
}
