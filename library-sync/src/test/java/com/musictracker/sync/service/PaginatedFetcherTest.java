package com.musictracker.sync.service;

import com.musictracker.sync.exception.CircuitOpenException;
import com.musictracker.sync.exception.RateLimitedException;
import com.musictracker.sync.exception.RetryableProviderException;
import com.musictracker.sync.exception.TerminalProviderException;
import com.musictracker.sync.model.CatalogRelease;
import com.musictracker.sync.model.Page;
import com.musictracker.sync.resilience.CircuitBreaker;
import com.musictracker.sync.resilience.MutableClock;
import com.musictracker.sync.resilience.RequestThrottle;
import com.musictracker.sync.resilience.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginatedFetcherTest {

    private MutableClock clock;
    private RetryPolicy retryPolicy;
    private RequestThrottle throttle;
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        CircuitBreaker breaker = new CircuitBreaker("discogs", 50, 1, Duration.ofMinutes(5), clock);
        retryPolicy = new RetryPolicy(breaker, 3, Duration.ofMillis(1), Duration.ofMillis(2), 2.0);
        throttle = new RequestThrottle(Duration.ofMillis(500), clock, duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        });
    }

    @Test
    void yieldsEveryRecordAcrossPages() {
        FakeCollectionSource<CatalogRelease> source = source(25);

        List<String> ids = fetcher(source).fetchAll(10, Set.of(), null)
                .map(CatalogRelease::releaseId)
                .toList();

        assertThat(ids).hasSize(25).startsWith("1", "2").endsWith("25");
        assertThat(source.requestedPages()).containsExactly(1, 2, 3);
    }

    @Test
    void waitsBetweenPageRequests() {
        fetcher(source(25)).fetchAll(10, Set.of(), null).count();

        // first request goes straight through
        assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(500));
    }

    @Test
    void knownRecordsAreOmittedAndReported() {
        List<String> skipped = new ArrayList<>();
        PaginatedFetcher.Listener<CatalogRelease> listener = new PaginatedFetcher.Listener<>() {
            @Override
            public void onKnownSkipped(CatalogRelease record) {
                skipped.add(record.releaseId());
            }
        };

        List<String> ids = fetcher(source(10)).fetchAll(5, Set.of("2", "7"), null, listener)
                .map(CatalogRelease::releaseId)
                .toList();

        assertThat(ids).containsExactly("1", "3", "4", "5", "6", "8", "9", "10");
        assertThat(skipped).containsExactly("2", "7");
    }

    @Test
    void stopsOnceLimitRecordsYielded() {
        FakeCollectionSource<CatalogRelease> source = source(100);

        List<String> ids = fetcher(source).fetchAll(10, Set.of("1", "2"), 12)
                .map(CatalogRelease::releaseId)
                .toList();

        assertThat(ids).hasSize(12).first().isEqualTo("3");
        assertThat(source.requestedPages()).containsExactly(1, 2);
    }

    @Test
    void pagesAreFetchedLazily() {
        FakeCollectionSource<CatalogRelease> source = source(100);

        fetcher(source).fetchAll(10, Set.of(), null).limit(3).toList();

        assertThat(source.requestedPages()).containsExactly(1);
    }

    @Test
    void rateLimitKeepsWhatWasFetched() {
        FakeCollectionSource<CatalogRelease> source = source(50)
                .failOnPage(3, () -> new RateLimitedException("discogs", "429"));
        List<String> reasons = new ArrayList<>();

        List<CatalogRelease> records = fetcher(source).fetchAll(10, Set.of(), null, stopListener(reasons)).toList();

        assertThat(records).hasSize(20);
        assertThat(source.requestedPages()).containsExactly(1, 2, 3);
        assertThat(reasons).hasSize(1);
        assertThat(reasons.get(0)).contains("rate limited");
    }

    @Test
    void pageStillFailingAfterRetriesEndsPaginationEarly() {
        FakeCollectionSource<CatalogRelease> source = source(50)
                .failOnPage(2, () -> new RetryableProviderException("discogs", "HTTP 503"));

        List<CatalogRelease> records = fetcher(source).fetchAll(10, Set.of(), null).toList();

        assertThat(records).hasSize(10);
        assertThat(source.requestedPages()).containsExactly(1, 2, 2, 2);
    }

    @Test
    void unreachableProviderOnFirstPagePropagates() {
        FakeCollectionSource<CatalogRelease> source = source(50)
                .failOnPage(1, () -> new RetryableProviderException("discogs", "connection refused"));

        assertThatThrownBy(() -> fetcher(source).fetchAll(10, Set.of(), null).toList())
                .isInstanceOf(RetryableProviderException.class);
    }

    @Test
    void openCircuitOnFirstPagePropagates() {
        FakeCollectionSource<CatalogRelease> source = source(50)
                .failOnPage(1, () -> new CircuitOpenException("discogs", Duration.ofMinutes(1)));

        assertThatThrownBy(() -> fetcher(source).fetchAll(10, Set.of(), null).toList())
                .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void terminalErrorPropagatesEvenAfterPages() {
        FakeCollectionSource<CatalogRelease> source = source(50)
                .failOnPage(2, () -> new TerminalProviderException("discogs", 401, "bad token"));

        assertThatThrownBy(() -> fetcher(source).fetchAll(10, Set.of(), null).toList())
                .isInstanceOf(TerminalProviderException.class);
        assertThat(source.requestedPages()).containsExactly(1, 2);
    }

    @Test
    void repeatedPageStopsPagination() {
        FakeCollectionSource<CatalogRelease> source = source(30).repeatAfter(2);

        List<CatalogRelease> records = fetcher(source).fetchAll(10, Set.of(), null).toList();

        assertThat(records).hasSize(20);
        assertThat(source.requestedPages()).containsExactly(1, 2, 3);
    }

    @Test
    void emptyCollectionYieldsNothing() {
        FakeCollectionSource<CatalogRelease> source = source(0);

        assertThat(fetcher(source).fetchAll(10, Set.of(), null)).isEmpty();
        assertThat(source.requestedPages()).containsExactly(1);
    }

    @Test
    void emptyPageWithMoreToComeDoesNotEndPagination() {
        List<Integer> requested = new ArrayList<>();
        CollectionSource<CatalogRelease> source = new CollectionSource<>() {
            @Override
            public String dependency() {
                return "lastfm";
            }

            @Override
            public Page<CatalogRelease> fetchPage(int page, int pageSize) {
                requested.add(page);
                return switch (page) {
                    case 1 -> new Page<>(1, List.of(release(1), release(2)), true, null);
                    case 2 -> new Page<>(2, List.of(), true, null);
                    default -> new Page<>(page, List.of(release(3)), false, null);
                };
            }
        };

        List<String> ids = new PaginatedFetcher<>(source, retryPolicy, throttle)
                .fetchAll(2, Set.of(), null)
                .map(CatalogRelease::releaseId)
                .toList();

        assertThat(ids).containsExactly("1", "2", "3");
        assertThat(requested).containsExactly(1, 2, 3);
    }

    @Test
    void cancellationIsObservedBetweenPagesOfKnownRecords() {
        FakeCollectionSource<CatalogRelease> source = source(50);
        Set<String> known = IntStream.rangeClosed(1, 50).mapToObj(String::valueOf).collect(Collectors.toSet());
        PaginatedFetcher.Listener<CatalogRelease> listener = new PaginatedFetcher.Listener<>() {
            @Override
            public boolean isCancelled() {
                return source.requestedPages().contains(2);
            }
        };

        assertThat(fetcher(source).fetchAll(10, known, null, listener)).isEmpty();
        assertThat(source.requestedPages()).containsExactly(1, 2);
    }

    @Test
    void reportsEachPageToListener() {
        List<Integer> pages = new ArrayList<>();
        PaginatedFetcher.Listener<CatalogRelease> listener = new PaginatedFetcher.Listener<>() {
            @Override
            public void onPage(Page<CatalogRelease> page) {
                pages.add(page.number());
                assertThat(page.totalCount()).isEqualTo(25L);
            }
        };

        fetcher(source(25)).fetchAll(10, Set.of(), null, listener).count();

        assertThat(pages).containsExactly(1, 2, 3);
    }

    private PaginatedFetcher<CatalogRelease> fetcher(FakeCollectionSource<CatalogRelease> source) {
        return new PaginatedFetcher<>(source, retryPolicy, throttle);
    }

    private static CatalogRelease release(int i) {
        return new CatalogRelease(String.valueOf(i), "Album " + i, List.of("Artist " + i));
    }

    private static FakeCollectionSource<CatalogRelease> source(int size) {
        List<CatalogRelease> releases = IntStream.rangeClosed(1, size)
                .mapToObj(PaginatedFetcherTest::release)
                .toList();
        return new FakeCollectionSource<>("discogs", releases);
    }

    private static PaginatedFetcher.Listener<CatalogRelease> stopListener(List<String> reasons) {
        return new PaginatedFetcher.Listener<>() {
            @Override
            public void onStoppedEarly(String reason) {
                reasons.add(reason);
            }
        };
    }
}
