package com.musictracker.sync.service;

import java.time.Duration;

/**
 * Read side of the local store as seen by the duplicate checks.
 */
public interface DuplicateLookup {

    boolean existsByNaturalKey(String naturalKey);

    /**
     * Whether a persisted play of {@code trackKey} lies strictly less than {@code window}
     * away from {@code timestamp}, in either direction.
     */
    default boolean existsWithinWindow(String trackKey, long timestamp, Duration window) {
        return false;
    }
}
