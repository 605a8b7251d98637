package com.musictracker.sync.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for {@code user.getRecentTracks}. Last.fm reports errors in the body
 * ({@code error} and {@code message}), sometimes with an HTTP 200.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LastFmRecentTracksResponse {

    private Integer error;
    private String message;

    @JsonProperty("recenttracks")
    private RecentTracks recentTracks;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecentTracks {

        // A single scrobble comes back as an object, not a one-element array
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<Track> track = new ArrayList<>();

        @JsonProperty("@attr")
        private Attr attr;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attr {
        private int page;

        @JsonProperty("totalPages")
        private int totalPages;

        @JsonProperty("perPage")
        private int perPage;

        private long total;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Track {
        private String name;
        private Text artist;
        private Text album;
        private Date date;

        @JsonProperty("@attr")
        private TrackAttr attr;

        public boolean isNowPlaying() {
            return attr != null && "true".equalsIgnoreCase(attr.getNowplaying());
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Text {
        @JsonProperty("#text")
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Date {
        private Long uts;

        @JsonProperty("#text")
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrackAttr {
        private String nowplaying;
    }
}
