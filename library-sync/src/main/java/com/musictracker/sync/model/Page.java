package com.musictracker.sync.model;

import java.util.List;

/**
 * One page returned by a provider's paginated collection endpoint.
 *
 * @param number     1-based page number that was requested
 * @param records    records on the page, in provider order
 * @param hasMore    whether the provider reports pages after this one
 * @param totalCount size of the whole collection, or null when the provider doesn't say
 */
public record Page<R extends ExternalRecord>(int number, List<R> records, boolean hasMore, Long totalCount) {

    public Page {
        records = List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** First and last natural key; two pages with the same boundary are the same page. */
    public String boundary() {
        if (records.isEmpty()) {
            return "";
        }
        return records.get(0).naturalKey() + ".." + records.get(records.size() - 1).naturalKey();
    }
}
