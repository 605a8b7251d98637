package com.musictracker.sync.service;

import com.musictracker.sync.exception.ProviderException;
import com.musictracker.sync.model.ExternalRecord;
import com.musictracker.sync.model.Page;

/**
 * A provider's paginated collection endpoint.
 *
 * Implementations are thin: one HTTP call per page, failures translated into the
 * {@link ProviderException} hierarchy. Throttling and retries are applied by the caller.
 */
public interface CollectionSource<R extends ExternalRecord> {

    /** Dependency name, shared with the circuit breaker. */
    String dependency();

    /**
     * @param page     1-based page number
     * @param pageSize records per page, capped by the provider
     * @throws ProviderException on any failure
     */
    Page<R> fetchPage(int page, int pageSize);
}
