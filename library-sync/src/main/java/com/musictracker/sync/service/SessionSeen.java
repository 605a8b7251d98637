package com.musictracker.sync.service;

import com.musictracker.sync.model.ExternalRecord;
import com.musictracker.sync.model.WindowedRecord;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Records accepted earlier in the current run, including those still waiting for their
 * checkpoint. Owned by the job worker; not thread-safe.
 */
public class SessionSeen {

    private final Set<String> naturalKeys = new HashSet<>();
    private final Map<String, NavigableSet<Long>> playsByTrack = new HashMap<>();

    public void accept(ExternalRecord record) {
        naturalKeys.add(record.naturalKey());
        if (record instanceof WindowedRecord windowed) {
            playsByTrack.computeIfAbsent(windowed.trackKey(), k -> new TreeSet<>()).add(windowed.timestamp());
        }
    }

    public boolean contains(String naturalKey) {
        return naturalKeys.contains(naturalKey);
    }

    public boolean withinWindow(String trackKey, long timestamp, Duration window) {
        NavigableSet<Long> plays = playsByTrack.get(trackKey);
        if (plays == null) {
            return false;
        }
        long span = window.toSeconds();
        Long before = plays.floor(timestamp);
        Long after = plays.ceiling(timestamp);
        return (before != null && timestamp - before < span)
                || (after != null && after - timestamp < span);
    }

    public int size() {
        return naturalKeys.size();
    }
}
