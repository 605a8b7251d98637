package com.musictracker.sync.service;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.model.Album;
import com.musictracker.sync.model.CatalogRelease;
import com.musictracker.sync.model.DiscogsRelease;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.output.LibraryStore;
import com.musictracker.sync.resilience.RequestThrottle;
import com.musictracker.sync.resilience.RetryPolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Discogs collection into the albums table. Only new releases cost a detail call.
 */
@Component
public class CatalogPipeline implements SyncPipeline<CatalogRelease, Album> {

    private final DiscogsClient client;
    private final RetryPolicy retryPolicy;
    private final RequestThrottle throttle;
    private final AlbumMapper mapper;
    private final LibraryStore store;
    private final LibrarySyncProperties properties;

    private final PaginatedFetcher<CatalogRelease> fetcher;
    private final DeduplicationGuard guard;

    public CatalogPipeline(DiscogsClient client,
                           @Qualifier("discogsRetryPolicy") RetryPolicy retryPolicy,
                           @Qualifier("discogsThrottle") RequestThrottle throttle,
                           AlbumMapper mapper,
                           LibraryStore store,
                           LibrarySyncProperties properties) {
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.throttle = throttle;
        this.mapper = mapper;
        this.store = store;
        this.properties = properties;
        this.fetcher = new PaginatedFetcher<>(client, retryPolicy, throttle);
        this.guard = new DeduplicationGuard(this);
    }

    @Override
    public SyncKind kind() {
        return SyncKind.CATALOG;
    }

    @Override
    public PaginatedFetcher<CatalogRelease> fetcher() {
        return fetcher;
    }

    @Override
    public int pageSize() {
        return properties.getDiscogs().getPageSize();
    }

    @Override
    public int checkpointSize() {
        return properties.getSync().getCatalogCheckpointSize();
    }

    @Override
    public Set<String> existingKeys() {
        return store.existingNaturalKeys(SyncKind.CATALOG);
    }

    @Override
    public DeduplicationGuard deduplicationGuard() {
        return guard;
    }

    @Override
    public boolean existsByNaturalKey(String naturalKey) {
        return store.albumExists(naturalKey);
    }

    @Override
    public Album transform(CatalogRelease release) {
        throttle.acquire();
        DiscogsRelease detail = retryPolicy.execute("release " + release.releaseId(),
                () -> client.fetchRelease(release.releaseId()));
        return mapper.map(detail);
    }

    @Override
    public void write(Album album) {
        store.insertAlbum(album);
    }
}
