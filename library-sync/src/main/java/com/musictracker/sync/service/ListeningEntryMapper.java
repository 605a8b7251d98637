package com.musictracker.sync.service;

import com.musictracker.sync.model.ListeningEntry;
import com.musictracker.sync.model.Scrobble;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Maps a Last.fm scrobble to a listening history entry.
 */
@Component
public class ListeningEntryMapper {

    static final String SOURCE = "lastfm";

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    public ListeningEntry map(Scrobble scrobble) {
        return ListeningEntry.builder()
                .track(scrobble.track())
                .timestamp(scrobble.timestamp())
                .date(DATE_FORMAT.format(Instant.ofEpochSecond(scrobble.timestamp())))
                .source(SOURCE)
                .loved(false)
                .build();
    }
}
