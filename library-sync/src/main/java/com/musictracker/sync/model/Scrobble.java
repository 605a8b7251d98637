package com.musictracker.sync.model;

/**
 * One Last.fm listening event.
 *
 * @param timestamp    epoch seconds of the play
 * @param playbackDate provider's display date, kept for logging only
 */
public record Scrobble(TrackIdentity track, long timestamp, String playbackDate) implements WindowedRecord {

    public static String naturalKey(String trackKey, long timestamp) {
        return trackKey + "@" + timestamp;
    }

    @Override
    public String naturalKey() {
        return naturalKey(track.key(), timestamp);
    }

    @Override
    public String trackKey() {
        return track.key();
    }

    @Override
    public String label() {
        return track.artist() + " - " + track.title();
    }
}
