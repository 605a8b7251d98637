package com.musictracker.sync.service;

import com.musictracker.sync.config.HttpClientConfig;
import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.exception.RateLimitedException;
import com.musictracker.sync.exception.RetryableProviderException;
import com.musictracker.sync.exception.TerminalProviderException;
import com.musictracker.sync.model.Page;
import com.musictracker.sync.model.Scrobble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LastFmClientTest {

    private static final String BASE = "https://ws.audioscrobbler.com/2.0/";

    private MockRestServiceServer server;
    private LastFmClient client;

    @BeforeEach
    void setUp() {
        LibrarySyncProperties properties = new LibrarySyncProperties();
        properties.getLastfm().setUsername("listener");
        properties.getLastfm().setApiKey("api-key");

        RestTemplate restTemplate = new HttpClientConfig(properties).lastFmRestTemplate(new RestTemplateBuilder());
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new LastFmClient(restTemplate, properties);
    }

    @Test
    void recentTracksAreMappedWithoutNowPlaying() {
        server.expect(requestTo(startsWith(BASE)))
                .andExpect(queryParam("method", "user.getrecenttracks"))
                .andExpect(queryParam("user", "listener"))
                .andExpect(queryParam("api_key", "api-key"))
                .andExpect(queryParam("page", "2"))
                .andExpect(queryParam("limit", "50"))
                .andExpect(queryParam("format", "json"))
                .andRespond(withSuccess("""
                        {"recenttracks": {
                          "track": [
                            {"name": "Live Now", "artist": {"#text": "Band"}, "album": {"#text": "Now"},
                             "@attr": {"nowplaying": "true"}},
                            {"name": "Teardrop ", "artist": {"#text": "Massive Attack"}, "album": {"#text": "Mezzanine"},
                             "date": {"uts": "1700000000", "#text": "14 Nov 2023, 22:13"}},
                            {"name": "Untitled", "artist": {"#text": "Unknown Artist"}, "album": {"#text": ""},
                             "date": {"uts": "1699999000", "#text": "14 Nov 2023, 21:56"}},
                            {"name": "No date", "artist": {"#text": "Someone"}}
                          ],
                          "@attr": {"user": "listener", "page": "2", "perPage": "50", "totalPages": "7", "total": "320"}
                        }}
                        """, MediaType.APPLICATION_JSON));

        Page<Scrobble> page = client.fetchPage(2, 50);

        server.verify();
        assertThat(page.records()).hasSize(2);
        assertThat(page.hasMore()).isTrue();
        assertThat(page.totalCount()).isEqualTo(320L);

        Scrobble first = page.records().get(0);
        assertThat(first.track().title()).isEqualTo("Teardrop");
        assertThat(first.timestamp()).isEqualTo(1_700_000_000L);
        assertThat(first.naturalKey()).isEqualTo("massive attack|mezzanine|teardrop@1700000000");
        assertThat(page.records().get(1).track().album()).isEqualTo("Unknown");
    }

    @Test
    void singleTrackObjectIsAccepted() {
        server.expect(requestTo(startsWith(BASE)))
                .andRespond(withSuccess("""
                        {"recenttracks": {
                          "track": {"name": "Only", "artist": {"#text": "One"}, "album": {"#text": "Single"},
                                    "date": {"uts": "1600000000", "#text": "13 Sep 2020, 12:26"}},
                          "@attr": {"page": "1", "perPage": "200", "totalPages": "1", "total": "1"}
                        }}
                        """, MediaType.APPLICATION_JSON));

        Page<Scrobble> page = client.fetchPage(1, 200);

        assertThat(page.records()).hasSize(1);
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void pageSizeIsCappedAtProviderMaximum() {
        server.expect(requestTo(startsWith(BASE)))
                .andExpect(queryParam("limit", String.valueOf(LastFmClient.MAX_PAGE_SIZE)))
                .andRespond(withSuccess("""
                        {"recenttracks": {"track": [], "@attr": {"page": "1", "totalPages": "0", "total": "0"}}}
                        """, MediaType.APPLICATION_JSON));

        assertThat(client.fetchPage(1, 1000).isEmpty()).isTrue();
        server.verify();
    }

    @Test
    void rateLimitReportedInBody() {
        server.expect(requestTo(startsWith(BASE)))
                .andRespond(withSuccess("""
                        {"error": 29, "message": "Rate Limit Exceeded"}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchPage(1, 200))
                .isInstanceOf(RateLimitedException.class)
                .hasMessageContaining("Rate Limit Exceeded");
    }

    @Test
    void temporaryErrorIsRetryable() {
        server.expect(requestTo(startsWith(BASE)))
                .andRespond(withSuccess("""
                        {"error": 16, "message": "There was a temporary error processing your request"}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchPage(1, 200)).isInstanceOf(RetryableProviderException.class);
    }

    @Test
    void invalidApiKeyIsCredentialFailure() {
        server.expect(requestTo(startsWith(BASE)))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\": 10, \"message\": \"Invalid API key\"}"));

        assertThatThrownBy(() -> client.fetchPage(1, 200))
                .isInstanceOfSatisfying(TerminalProviderException.class, e -> {
                    assertThat(e.isCredentialFailure()).isTrue();
                    assertThat(e.getProvider()).isEqualTo("lastfm");
                });
    }

    @Test
    void unknownUserIsTerminal() {
        server.expect(requestTo(startsWith(BASE)))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\": 6, \"message\": \"User not found\"}"));

        assertThatThrownBy(() -> client.fetchPage(1, 200))
                .isInstanceOfSatisfying(TerminalProviderException.class,
                        e -> assertThat(e.isCredentialFailure()).isFalse());
    }
}
