package com.musictracker.sync.service;

import com.musictracker.sync.model.ExternalRecord;
import com.musictracker.sync.model.SyncKind;

import java.util.Set;

/**
 * Everything a {@link SyncJob} needs to import one kind: where records come from, how
 * duplicates are recognised, how a record becomes a local entity and how it is written.
 *
 * @param <R> provider record
 * @param <E> local entity
 */
public interface SyncPipeline<R extends ExternalRecord, E> extends DuplicateLookup {

    SyncKind kind();

    PaginatedFetcher<R> fetcher();

    int pageSize();

    /** Accepted records per committed checkpoint. */
    int checkpointSize();

    /** Natural keys already stored, computed fresh for every run. */
    Set<String> existingKeys();

    DeduplicationGuard deduplicationGuard();

    /**
     * Build the local entity. May call the provider again (detail lookups).
     *
     * @throws com.musictracker.sync.exception.RecordProcessingException if the record is unusable
     * @throws com.musictracker.sync.exception.ProviderException         if a detail call fails
     */
    E transform(R record);

    /** Write one entity; runs inside the checkpoint transaction. */
    void write(E entity);
}
