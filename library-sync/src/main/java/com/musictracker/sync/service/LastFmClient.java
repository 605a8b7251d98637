package com.musictracker.sync.service;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.exception.ProviderException;
import com.musictracker.sync.exception.RateLimitedException;
import com.musictracker.sync.exception.RetryableProviderException;
import com.musictracker.sync.exception.TerminalProviderException;
import com.musictracker.sync.model.LastFmRecentTracksResponse;
import com.musictracker.sync.model.Page;
import com.musictracker.sync.model.Scrobble;
import com.musictracker.sync.model.TrackIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Thin client for Last.fm {@code user.getRecentTracks}.
 *
 * Last.fm reports most errors as a JSON body with a numeric {@code error} code, on either
 * a 4xx or a 200. Codes 29 (rate limit) and 8/11/16 (temporary) are not the caller's fault.
 */
@Service
@Slf4j
public class LastFmClient implements CollectionSource<Scrobble> {

    public static final String DEPENDENCY = "lastfm";

    static final int MAX_PAGE_SIZE = 200;

    private static final int RATE_LIMIT_EXCEEDED = 29;
    private static final Set<Integer> TEMPORARY_ERRORS = Set.of(8, 11, 16);
    // invalid authentication, invalid session, invalid API key, suspended API key
    private static final Set<Integer> CREDENTIAL_ERRORS = Set.of(4, 9, 10, 26);
    private static final String UNKNOWN = "Unknown";

    private final RestTemplate restTemplate;
    private final LibrarySyncProperties properties;

    public LastFmClient(@Qualifier("lastFmRestTemplate") RestTemplate restTemplate,
                        LibrarySyncProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public String dependency() {
        return DEPENDENCY;
    }

    /**
     * Fetch one page of scrobbles, newest first. The now-playing track and entries without
     * a play date are dropped.
     */
    @Override
    public Page<Scrobble> fetchPage(int page, int pageSize) {
        LibrarySyncProperties.LastFm config = properties.getLastfm();
        String url = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .queryParam("method", "user.getrecenttracks")
                .queryParam("user", config.getUsername())
                .queryParam("api_key", config.getApiKey())
                .queryParam("limit", Math.min(pageSize, MAX_PAGE_SIZE))
                .queryParam("page", page)
                .queryParam("format", "json")
                .toUriString();

        LastFmRecentTracksResponse response = get(url);
        if (response == null) {
            throw new RetryableProviderException(DEPENDENCY, "Empty recent tracks response for page " + page);
        }
        if (response.getError() != null) {
            throw bodyError(response, 200);
        }
        LastFmRecentTracksResponse.RecentTracks recent = response.getRecentTracks();
        if (recent == null) {
            throw new TerminalProviderException(DEPENDENCY, 0, "Missing recenttracks in response for page " + page);
        }

        List<Scrobble> scrobbles = new ArrayList<>();
        for (LastFmRecentTracksResponse.Track track : recent.getTrack()) {
            if (track.isNowPlaying() || track.getDate() == null || track.getDate().getUts() == null) {
                continue;
            }
            scrobbles.add(toScrobble(track));
        }

        LastFmRecentTracksResponse.Attr attr = recent.getAttr();
        boolean hasMore = attr != null && attr.getPage() < attr.getTotalPages();
        Long total = attr != null ? attr.getTotal() : null;

        log.debug("Last.fm page {}: {} scrobbles (pages: {})", page, scrobbles.size(),
                attr != null ? attr.getTotalPages() : "?");
        return new Page<>(page, scrobbles, hasMore, total);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private LastFmRecentTracksResponse get(String url) {
        log.debug("Calling Last.fm API: method=user.getrecenttracks user={}", properties.getLastfm().getUsername());
        try {
            return restTemplate.getForObject(url, LastFmRecentTracksResponse.class);
        } catch (HttpClientErrorException e) {
            LastFmRecentTracksResponse body = readErrorBody(e);
            if (body != null && body.getError() != null) {
                throw bodyError(body, e.getStatusCode().value());
            }
            throw ProviderErrors.translate(DEPENDENCY, url, e);
        } catch (RestClientException e) {
            throw ProviderErrors.translate(DEPENDENCY, url, e);
        }
    }

    private LastFmRecentTracksResponse readErrorBody(HttpClientErrorException e) {
        try {
            return e.getResponseBodyAs(LastFmRecentTracksResponse.class);
        } catch (RuntimeException parseFailure) {
            log.debug("Last.fm error body not readable: {}", parseFailure.getMessage());
            return null;
        }
    }

    private ProviderException bodyError(LastFmRecentTracksResponse body, int httpStatus) {
        int code = body.getError();
        String message = "Last.fm error " + code + ": " + body.getMessage();
        if (code == RATE_LIMIT_EXCEEDED) {
            return new RateLimitedException(DEPENDENCY, message);
        }
        if (TEMPORARY_ERRORS.contains(code)) {
            return new RetryableProviderException(DEPENDENCY, message);
        }
        int status = CREDENTIAL_ERRORS.contains(code) ? 403 : httpStatus;
        return new TerminalProviderException(DEPENDENCY, status, message);
    }

    private Scrobble toScrobble(LastFmRecentTracksResponse.Track track) {
        TrackIdentity identity = new TrackIdentity(
                textOrUnknown(track.getArtist()),
                textOrUnknown(track.getAlbum()),
                StringUtils.hasText(track.getName()) ? track.getName().trim() : UNKNOWN);
        return new Scrobble(identity, track.getDate().getUts(), track.getDate().getText());
    }

    private static String textOrUnknown(LastFmRecentTracksResponse.Text text) {
        return text != null && StringUtils.hasText(text.getText()) ? text.getText().trim() : UNKNOWN;
    }
}
