package com.musictracker.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for the {@code /releases/{id}} detail endpoint.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscogsRelease {

    private Long id;
    private String title;
    private Integer year;
    private String uri;

    private List<Name> artists = new ArrayList<>();
    private List<Name> labels = new ArrayList<>();
    private List<String> genres = new ArrayList<>();
    private List<String> styles = new ArrayList<>();
    private List<Image> images = new ArrayList<>();
    private List<Format> formats = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Name {
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Image {
        private String type;
        private String uri;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Format {
        private String name;
        private List<String> descriptions = new ArrayList<>();
    }
}
