package com.musictracker.sync.model;

/**
 * One item as reported by a provider, before it becomes a local entity.
 */
public interface ExternalRecord {

    /** Stable identity of the item, independent of when it was fetched. */
    String naturalKey();

    /** Short human-readable label shown in progress output. */
    String label();
}
