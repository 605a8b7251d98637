package com.musictracker.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for one page of {@code /users/{username}/collection/folders/0/releases}.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscogsCollectionResponse {

    private Pagination pagination;

    private List<Item> releases = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pagination {
        private int page;
        private int pages;

        @JsonProperty("per_page")
        private int perPage;

        private Long items;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private Long id;

        @JsonProperty("basic_information")
        private BasicInformation basicInformation;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BasicInformation {
        private String title;
        private Integer year;
        private List<DiscogsRelease.Name> artists = new ArrayList<>();
    }
}
