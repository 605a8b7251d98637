package com.musictracker.sync.service;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.model.ListeningEntry;
import com.musictracker.sync.model.Scrobble;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.output.LibraryStore;
import com.musictracker.sync.resilience.RequestThrottle;
import com.musictracker.sync.resilience.RetryPolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Last.fm scrobbles into the listening history, with the time-window duplicate rule.
 */
@Component
public class HistoryPipeline implements SyncPipeline<Scrobble, ListeningEntry> {

    private final LibraryStore store;
    private final ListeningEntryMapper mapper;
    private final LibrarySyncProperties properties;

    private final PaginatedFetcher<Scrobble> fetcher;
    private final DeduplicationGuard guard;

    public HistoryPipeline(LastFmClient client,
                           @Qualifier("lastFmRetryPolicy") RetryPolicy retryPolicy,
                           @Qualifier("lastFmThrottle") RequestThrottle throttle,
                           ListeningEntryMapper mapper,
                           LibraryStore store,
                           LibrarySyncProperties properties) {
        this.store = store;
        this.mapper = mapper;
        this.properties = properties;
        this.fetcher = new PaginatedFetcher<>(client, retryPolicy, throttle);
        this.guard = new DeduplicationGuard(this, properties.getSync().getDedupWindow());
    }

    @Override
    public SyncKind kind() {
        return SyncKind.HISTORY;
    }

    @Override
    public PaginatedFetcher<Scrobble> fetcher() {
        return fetcher;
    }

    @Override
    public int pageSize() {
        return properties.getLastfm().getPageSize();
    }

    @Override
    public int checkpointSize() {
        return properties.getSync().getHistoryCheckpointSize();
    }

    @Override
    public Set<String> existingKeys() {
        return store.existingNaturalKeys(SyncKind.HISTORY);
    }

    @Override
    public DeduplicationGuard deduplicationGuard() {
        return guard;
    }

    /** Natural key is {@code trackKey@epochSeconds}. */
    @Override
    public boolean existsByNaturalKey(String naturalKey) {
        int at = naturalKey.lastIndexOf('@');
        if (at < 0) return false;
        return store.playExists(naturalKey.substring(0, at), Long.parseLong(naturalKey.substring(at + 1)));
    }

    @Override
    public boolean existsWithinWindow(String trackKey, long timestamp, Duration window) {
        return store.playWithinWindow(trackKey, timestamp, window);
    }

    @Override
    public ListeningEntry transform(Scrobble scrobble) {
        return mapper.map(scrobble);
    }

    @Override
    public void write(ListeningEntry entry) {
        store.insertListeningEntry(entry);
    }
}
