package com.musictracker.sync.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Album ready for insertion into the library.
 *
 * Catalog imports always carry a {@code discogsId}; it is the dedup key for the catalog kind.
 */
@Data
@Builder
public class Album {

    private String title;

    /** Null when the provider reports no year (Discogs uses 0). */
    private Integer year;

    /** Vinyl, CD, Digital or Unknown */
    private String support;

    private String source;

    private String discogsId;
    private String discogsUrl;
    private String coverImage;

    /** Comma-separated label names */
    private String labels;

    private String genres;

    /** Credited artists in provider order, never empty */
    private List<String> artists;

    private LocalDateTime importedAt;
}
