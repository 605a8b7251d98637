package com.musictracker.sync.service;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.exception.RetryableProviderException;
import com.musictracker.sync.model.CatalogRelease;
import com.musictracker.sync.model.DiscogsCollectionResponse;
import com.musictracker.sync.model.DiscogsRelease;
import com.musictracker.sync.model.Page;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Thin client over the Discogs REST API.
 *
 * Authenticated users get 60 requests per minute; the collection walk and the per-release
 * detail calls are spaced by the caller's throttle. A 429 becomes a
 * {@link com.musictracker.sync.exception.RateLimitedException}.
 */
@Service
@Slf4j
public class DiscogsClient implements CollectionSource<CatalogRelease> {

    public static final String DEPENDENCY = "discogs";

    private final RestTemplate restTemplate;
    private final LibrarySyncProperties properties;

    public DiscogsClient(@Qualifier("discogsRestTemplate") RestTemplate restTemplate,
                         LibrarySyncProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public String dependency() {
        return DEPENDENCY;
    }

    /**
     * Fetch one page of the user's collection (folder 0 = all releases).
     */
    @Override
    public Page<CatalogRelease> fetchPage(int page, int pageSize) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getDiscogs().getBaseUrl() + "/users/{username}/collection/folders/0/releases")
                .queryParam("page", page)
                .queryParam("per_page", pageSize)
                .buildAndExpand(properties.getDiscogs().getUsername())
                .toUriString();

        DiscogsCollectionResponse response = get(url, DiscogsCollectionResponse.class);
        if (response == null) {
            throw new RetryableProviderException(DEPENDENCY, "Empty collection response for page " + page);
        }

        List<CatalogRelease> releases = response.getReleases().stream()
                .filter(item -> item.getId() != null)
                .map(this::toCatalogRelease)
                .toList();

        DiscogsCollectionResponse.Pagination pagination = response.getPagination();
        boolean hasMore = pagination != null && pagination.getPage() < pagination.getPages();
        Long total = pagination != null ? pagination.getItems() : null;

        log.debug("Discogs page {}: {} releases (pages: {})", page, releases.size(),
                pagination != null ? pagination.getPages() : "?");
        return new Page<>(page, releases, hasMore, total);
    }

    /**
     * Fetch the full release. A 404 means the release was removed from Discogs.
     */
    public DiscogsRelease fetchRelease(String releaseId) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getDiscogs().getBaseUrl() + "/releases/{id}")
                .buildAndExpand(releaseId)
                .toUriString();

        DiscogsRelease release = get(url, DiscogsRelease.class);
        if (release == null) {
            throw new RetryableProviderException(DEPENDENCY, "Empty release response for " + releaseId);
        }
        return release;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T get(String url, Class<T> type) {
        log.debug("Calling Discogs API: {}", url);
        try {
            return restTemplate.getForObject(url, type);
        } catch (RestClientException e) {
            throw ProviderErrors.translate(DEPENDENCY, url, e);
        }
    }

    private CatalogRelease toCatalogRelease(DiscogsCollectionResponse.Item item) {
        DiscogsCollectionResponse.BasicInformation info = item.getBasicInformation();
        if (info == null) {
            return new CatalogRelease(String.valueOf(item.getId()), null, List.of());
        }
        List<String> artists = info.getArtists().stream()
                .map(DiscogsRelease.Name::getName)
                .filter(Objects::nonNull)
                .toList();
        return new CatalogRelease(String.valueOf(item.getId()), info.getTitle(), artists);
    }
}
