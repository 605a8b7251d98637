package com.musictracker.sync.model;

/**
 * A record that describes an event in time. Two events for the same track close
 * enough together are treated as the same physical play.
 */
public interface WindowedRecord extends ExternalRecord {

    /** Normalised track identity shared by every play of the same track. */
    String trackKey();

    /** Epoch seconds. */
    long timestamp();
}
