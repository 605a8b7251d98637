package com.musictracker.sync.service;

import com.musictracker.sync.exception.RecordProcessingException;
import com.musictracker.sync.model.Album;
import com.musictracker.sync.model.DiscogsRelease;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps a full Discogs release to the library's Album.
 */
@Component
@Slf4j
public class AlbumMapper {

    static final String SOURCE = "discogs";

    /**
     * @throws RecordProcessingException if the release has no title or no artist
     */
    public Album map(DiscogsRelease raw) {
        String title = emptyToNull(raw.getTitle());
        if (title == null) {
            throw new RecordProcessingException("Release " + raw.getId() + " has no title");
        }

        List<String> artists = raw.getArtists().stream()
                .map(DiscogsRelease.Name::getName)
                .map(this::cleanArtistName)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (artists.isEmpty()) {
            throw new RecordProcessingException("Release " + raw.getId() + " has no artist");
        }

        String cover = raw.getImages().isEmpty() ? null : emptyToNull(raw.getImages().get(0).getUri());

        return Album.builder()
                .title(title.trim())
                .year(raw.getYear() == null || raw.getYear() == 0 ? null : raw.getYear())
                .support(support(raw.getFormats()))
                .source(SOURCE)
                .discogsId(String.valueOf(raw.getId()))
                .discogsUrl(emptyToNull(raw.getUri()))
                .coverImage(cover)
                .labels(join(raw.getLabels().stream().map(DiscogsRelease.Name::getName).toList()))
                .genres(join(raw.getGenres()))
                .artists(artists)
                .importedAt(LocalDateTime.now())
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Physical support from the first format, e.g. "Vinyl", "LP" → "Vinyl".
     */
    String support(List<DiscogsRelease.Format> formats) {
        if (formats == null || formats.isEmpty() || formats.get(0).getName() == null) {
            return "Unknown";
        }
        String name = formats.get(0).getName().toLowerCase(Locale.ROOT);
        if (name.contains("vinyl") || name.contains("lp")) return "Vinyl";
        if (name.contains("cd")) return "CD";
        if (name.contains("file") || name.contains("digital")) return "Digital";
        return "Unknown";
    }

    /**
     * Discogs disambiguates homonyms with a numeric suffix: "Nirvana (2)" → "Nirvana".
     */
    private String cleanArtistName(String name) {
        String value = emptyToNull(name);
        if (value == null) return null;
        return value.replaceAll("\\s+\\(\\d+\\)$", "").trim();
    }

    private String join(List<String> values) {
        if (values == null) return null;
        String joined = values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? null : joined;
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
