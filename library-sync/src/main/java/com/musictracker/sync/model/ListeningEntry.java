package com.musictracker.sync.model;

import lombok.Builder;
import lombok.Data;

/**
 * One play in the listening history.
 */
@Data
@Builder
public class ListeningEntry {

    private TrackIdentity track;

    /** Epoch seconds */
    private long timestamp;

    /** {@code yyyy-MM-dd HH:mm} in UTC */
    private String date;

    private String source;

    private boolean loved;

    public String naturalKey() {
        return Scrobble.naturalKey(track.key(), timestamp);
    }
}
