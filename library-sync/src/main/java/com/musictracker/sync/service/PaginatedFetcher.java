package com.musictracker.sync.service;

import com.musictracker.sync.exception.CircuitOpenException;
import com.musictracker.sync.exception.RateLimitedException;
import com.musictracker.sync.exception.RetryableProviderException;
import com.musictracker.sync.model.ExternalRecord;
import com.musictracker.sync.model.Page;
import com.musictracker.sync.resilience.RequestThrottle;
import com.musictracker.sync.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a provider's pages and yields the records not already known locally.
 *
 * Pages are requested lazily, one at a time, as the consumer pulls records. Every request
 * waits for the provider's throttle and goes through the {@link RetryPolicy}.
 *
 * Pagination stops when the provider reports no more pages, repeats a page it already
 * returned, signals a rate limit, or once {@code limit} records have been yielded. An empty
 * page ends it only when the provider reports nothing after it. The listener can cancel
 * between page requests. A page that still fails after retries also ends pagination, unless
 * nothing has been fetched yet: then the provider is unreachable and the failure propagates.
 * Terminal provider errors always propagate.
 */
@Slf4j
public class PaginatedFetcher<R extends ExternalRecord> {

    /** Callbacks on the consumer's thread, in record order. */
    public interface Listener<R extends ExternalRecord> {

        default void onPage(Page<R> page) {
        }

        /** A record in the skip-set, dropped without a detail call. */
        default void onKnownSkipped(R record) {
        }

        default void onStoppedEarly(String reason) {
        }

        /** Checked before every page request; true stops pagination. */
        default boolean isCancelled() {
            return false;
        }
    }

    private final CollectionSource<R> source;
    private final RetryPolicy retryPolicy;
    private final RequestThrottle throttle;

    public PaginatedFetcher(CollectionSource<R> source, RetryPolicy retryPolicy, RequestThrottle throttle) {
        this.source = source;
        this.retryPolicy = retryPolicy;
        this.throttle = throttle;
    }

    public Stream<R> fetchAll(int pageSize, Set<String> skipSet, Integer limit) {
        return fetchAll(pageSize, skipSet, limit, new Listener<>() {
        });
    }

    /**
     * @param skipSet natural keys already stored; matching records are not yielded
     * @param limit   maximum number of records to yield, or null for the whole collection
     * @return a finite, single-use sequence
     */
    public Stream<R> fetchAll(int pageSize, Set<String> skipSet, Integer limit, Listener<R> listener) {
        PageIterator iterator = new PageIterator(pageSize, Set.copyOf(skipSet), limit, listener);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private final class PageIterator implements Iterator<R> {

        private final int pageSize;
        private final Set<String> skipSet;
        private final Integer limit;
        private final Listener<R> listener;

        private final Deque<R> buffer = new ArrayDeque<>();
        private final Set<String> seenBoundaries = new HashSet<>();
        private int nextPage = 1;
        private int pagesFetched;
        private int yielded;
        private boolean exhausted;

        PageIterator(int pageSize, Set<String> skipSet, Integer limit, Listener<R> listener) {
            this.pageSize = pageSize;
            this.skipSet = skipSet;
            this.limit = limit;
            this.listener = listener;
        }

        @Override
        public boolean hasNext() {
            while (true) {
                if (limit != null && yielded >= limit) {
                    return false;
                }
                if (buffer.isEmpty()) {
                    if (exhausted) {
                        return false;
                    }
                    if (listener.isCancelled()) {
                        log.info("{} pagination cancelled before page {}", source.dependency(), nextPage);
                        exhausted = true;
                        return false;
                    }
                    fetchNextPage();
                    continue;
                }
                R head = buffer.peek();
                if (skipSet.contains(head.naturalKey())) {
                    buffer.poll();
                    listener.onKnownSkipped(head);
                    continue;
                }
                return true;
            }
        }

        @Override
        public R next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            yielded++;
            return buffer.poll();
        }

        private void fetchNextPage() {
            int number = nextPage++;
            throttle.acquire();

            Page<R> page;
            try {
                page = retryPolicy.execute("page " + number, () -> source.fetchPage(number, pageSize));
            } catch (RateLimitedException e) {
                stop("rate limited on page " + number + ", keeping " + pagesFetched + " pages");
                return;
            } catch (RetryableProviderException | CircuitOpenException e) {
                if (pagesFetched == 0) {
                    throw e;
                }
                stop("page " + number + " failed: " + e.getMessage());
                return;
            }

            pagesFetched++;
            if (page.isEmpty()) {
                // a page can be empty after the client drops non-scrobbles; only the provider ends it
                if (page.hasMore()) {
                    log.info("{} page {} has no usable records, continuing", source.dependency(), number);
                } else {
                    log.info("{} page {} is empty, end of collection", source.dependency(), number);
                    exhausted = true;
                }
                return;
            }
            if (!seenBoundaries.add(page.boundary())) {
                stop("page " + number + " repeats an earlier page (" + page.boundary() + ")");
                return;
            }

            log.info("{} page {}: {} records", source.dependency(), number, page.records().size());
            listener.onPage(page);
            buffer.addAll(page.records());
            if (!page.hasMore()) {
                exhausted = true;
            }
        }

        private void stop(String reason) {
            log.warn("{} pagination stopped early: {}", source.dependency(), reason);
            exhausted = true;
            listener.onStoppedEarly(reason);
        }
    }
}
