package com.musictracker.sync.output;

import com.musictracker.sync.model.Album;
import com.musictracker.sync.model.CheckpointResult;
import com.musictracker.sync.model.JobStatus;
import com.musictracker.sync.model.ListeningEntry;
import com.musictracker.sync.model.RecordFailure;
import com.musictracker.sync.model.Scrobble;
import com.musictracker.sync.model.StagedRecord;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.model.SyncRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Local library tables written by the sync jobs.
 *
 * A checkpoint is one transaction; each record inside it runs in a nested transaction
 * (a JDBC savepoint), so a failing record rolls back only its own rows.
 */
@Component
@Slf4j
public class LibraryStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate checkpointTx;
    private final TransactionTemplate recordTx;

    public LibraryStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.checkpointTx = new TransactionTemplate(transactionManager);
        this.recordTx = new TransactionTemplate(transactionManager);
        this.recordTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    public void ensureSchema() {
        log.info("Ensuring library schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS artists
            (
                id      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                name    VARCHAR(500) NOT NULL UNIQUE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS albums
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                title           VARCHAR(500) NOT NULL,
                release_year    INTEGER,
                support         VARCHAR(50),
                source          VARCHAR(50),
                discogs_id      VARCHAR(64) UNIQUE,
                discogs_url     VARCHAR(1000),
                cover_image     VARCHAR(1000),
                labels          VARCHAR(1000),
                genres          VARCHAR(1000),
                imported_at     TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS album_artists
            (
                album_id    BIGINT NOT NULL REFERENCES albums (id),
                artist_id   BIGINT NOT NULL REFERENCES artists (id),
                PRIMARY KEY (album_id, artist_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tracks
            (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                album_id    BIGINT NOT NULL REFERENCES albums (id),
                title       VARCHAR(500) NOT NULL,
                UNIQUE (album_id, title)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS listening_history
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                track_id        BIGINT NOT NULL REFERENCES tracks (id),
                track_key       VARCHAR(1600) NOT NULL,
                artist_name     VARCHAR(500),
                album_title     VARCHAR(500),
                track_title     VARCHAR(500),
                played_ts       BIGINT NOT NULL,
                played_date     VARCHAR(16),
                source          VARCHAR(50),
                loved           BOOLEAN DEFAULT FALSE NOT NULL,
                UNIQUE (track_key, played_ts)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS sync_runs
            (
                run_id          VARCHAR(36) PRIMARY KEY,
                kind            VARCHAR(20) NOT NULL,
                requested_limit INTEGER,
                started_at      TIMESTAMP NOT NULL,
                completed_at    TIMESTAMP,
                status          VARCHAR(20) NOT NULL,
                records_seen    BIGINT NOT NULL,
                succeeded       BIGINT NOT NULL,
                skipped         BIGINT NOT NULL,
                errored         BIGINT NOT NULL,
                error_message   VARCHAR(2000)
            )
        """);

        log.info("Library schema ready.");
    }

    // ── Duplicate lookups ────────────────────────────────────────────────────

    /** Natural keys already stored for {@code kind}: the run's skip-set. */
    public Set<String> existingNaturalKeys(SyncKind kind) {
        List<String> keys = switch (kind) {
            case CATALOG -> jdbcTemplate.queryForList(
                    "SELECT discogs_id FROM albums WHERE discogs_id IS NOT NULL", String.class);
            case HISTORY -> jdbcTemplate.query(
                    "SELECT track_key, played_ts FROM listening_history",
                    (rs, i) -> Scrobble.naturalKey(rs.getString("track_key"), rs.getLong("played_ts")));
        };
        return new HashSet<>(keys);
    }

    public boolean albumExists(String discogsId) {
        return count("SELECT COUNT(*) FROM albums WHERE discogs_id = ?", discogsId) > 0;
    }

    public boolean playExists(String trackKey, long timestamp) {
        return count("SELECT COUNT(*) FROM listening_history WHERE track_key = ? AND played_ts = ?",
                trackKey, timestamp) > 0;
    }

    /** A stored play of the track strictly less than {@code window} before or after {@code timestamp}. */
    public boolean playWithinWindow(String trackKey, long timestamp, Duration window) {
        long span = window.toSeconds();
        return count("SELECT COUNT(*) FROM listening_history WHERE track_key = ? AND played_ts > ? AND played_ts < ?",
                trackKey, timestamp - span, timestamp + span) > 0;
    }

    // ── Checkpoint ───────────────────────────────────────────────────────────

    /**
     * Commit {@code staged} as one unit. A record whose write throws is rolled back to its
     * savepoint and reported; the others still commit.
     */
    public <E> CheckpointResult writeCheckpoint(List<StagedRecord<E>> staged, Consumer<E> writer) {
        if (staged.isEmpty()) return CheckpointResult.empty();

        List<RecordFailure> failures = new ArrayList<>();
        Integer written = checkpointTx.execute(status -> {
            int ok = 0;
            for (StagedRecord<E> record : staged) {
                try {
                    recordTx.executeWithoutResult(savepoint -> writer.accept(record.entity()));
                    ok++;
                } catch (RuntimeException e) {
                    log.warn("Write failed for {} [{}], rolled back: {}",
                            record.source().label(), record.source().naturalKey(), e.getMessage());
                    failures.add(RecordFailure.of(record.source(), e));
                }
            }
            return ok;
        });

        log.info("Checkpoint committed: {} written, {} failed", written, failures.size());
        return new CheckpointResult(Objects.requireNonNullElse(written, 0), failures);
    }

    // ── Entity writes ────────────────────────────────────────────────────────

    public void insertAlbum(Album album) {
        jdbcTemplate.update("""
                INSERT INTO albums (title, release_year, support, source, discogs_id, discogs_url,
                                    cover_image, labels, genres, imported_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                album.getTitle(),
                album.getYear(),
                album.getSupport(),
                album.getSource(),
                album.getDiscogsId(),
                album.getDiscogsUrl(),
                album.getCoverImage(),
                album.getLabels(),
                album.getGenres(),
                album.getImportedAt() != null ? Timestamp.valueOf(album.getImportedAt()) : null);

        long albumId = jdbcTemplate.queryForObject(
                "SELECT id FROM albums WHERE discogs_id = ?", Long.class, album.getDiscogsId());
        for (String artist : album.getArtists()) {
            linkArtist(albumId, findOrCreateArtist(artist));
        }
    }

    /**
     * Insert a play, creating the artist, album and track it refers to when missing.
     */
    public void insertListeningEntry(ListeningEntry entry) {
        long artistId = findOrCreateArtist(entry.getTrack().artist());
        long albumId = findOrCreateAlbum(entry.getTrack().album(), entry.getSource());
        linkArtist(albumId, artistId);
        long trackId = findOrCreateTrack(albumId, entry.getTrack().title());

        jdbcTemplate.update("""
                INSERT INTO listening_history (track_id, track_key, artist_name, album_title, track_title,
                                               played_ts, played_date, source, loved)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                trackId,
                entry.getTrack().key(),
                entry.getTrack().artist(),
                entry.getTrack().album(),
                entry.getTrack().title(),
                entry.getTimestamp(),
                entry.getDate(),
                entry.getSource(),
                entry.isLoved());
    }

    private long findOrCreateArtist(String name) {
        List<Long> ids = jdbcTemplate.queryForList("SELECT id FROM artists WHERE name = ?", Long.class, name);
        if (!ids.isEmpty()) return ids.get(0);
        jdbcTemplate.update("INSERT INTO artists (name) VALUES (?)", name);
        return jdbcTemplate.queryForObject("SELECT id FROM artists WHERE name = ?", Long.class, name);
    }

    private long findOrCreateAlbum(String title, String source) {
        List<Long> ids = jdbcTemplate.queryForList(
                "SELECT id FROM albums WHERE title = ? ORDER BY id", Long.class, title);
        if (!ids.isEmpty()) return ids.get(0);
        jdbcTemplate.update("INSERT INTO albums (title, support, source) VALUES (?, 'Unknown', ?)", title, source);
        return jdbcTemplate.queryForObject(
                "SELECT MAX(id) FROM albums WHERE title = ?", Long.class, title);
    }

    private long findOrCreateTrack(long albumId, String title) {
        String select = "SELECT id FROM tracks WHERE album_id = ? AND title = ?";
        List<Long> ids = jdbcTemplate.queryForList(select, Long.class, albumId, title);
        if (!ids.isEmpty()) return ids.get(0);
        jdbcTemplate.update("INSERT INTO tracks (album_id, title) VALUES (?, ?)", albumId, title);
        return jdbcTemplate.queryForObject(select, Long.class, albumId, title);
    }

    private void linkArtist(long albumId, long artistId) {
        if (count("SELECT COUNT(*) FROM album_artists WHERE album_id = ? AND artist_id = ?", albumId, artistId) == 0) {
            jdbcTemplate.update("INSERT INTO album_artists (album_id, artist_id) VALUES (?, ?)", albumId, artistId);
        }
    }

    // ── Duplicate cleanup ────────────────────────────────────────────────────

    public record PlayRow(long id, String trackKey, long timestamp) {
    }

    /** Every stored play, grouped by track and in play order. */
    public List<PlayRow> listeningPlaysInOrder() {
        return jdbcTemplate.query(
                "SELECT id, track_key, played_ts FROM listening_history ORDER BY track_key, played_ts, id",
                (rs, i) -> new PlayRow(rs.getLong("id"), rs.getString("track_key"), rs.getLong("played_ts")));
    }

    public int deleteListeningEntries(List<Long> ids) {
        if (ids.isEmpty()) return 0;
        int[][] counts = jdbcTemplate.batchUpdate("DELETE FROM listening_history WHERE id = ?", ids, 500,
                (ps, id) -> ps.setLong(1, id));
        int deleted = 0;
        for (int[] batch : counts) {
            for (int c : batch) {
                deleted += Math.max(c, 0);
            }
        }
        return deleted;
    }

    public long countListeningEntries() {
        return count("SELECT COUNT(*) FROM listening_history");
    }

    // ── Run audit ────────────────────────────────────────────────────────────

    public void writeSyncRun(SyncRun run) {
        jdbcTemplate.update("""
                INSERT INTO sync_runs (run_id, kind, requested_limit, started_at, completed_at, status,
                                       records_seen, succeeded, skipped, errored, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                run.getRunId(),
                run.getKind().name(),
                run.getRequestedLimit(),
                Timestamp.valueOf(run.getStartedAt()),
                run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()) : null,
                run.getStatus().name(),
                run.getRecordsSeen(),
                run.getSucceeded(),
                run.getSkipped(),
                run.getErrored(),
                truncate(run.getErrorMessage(), 2000));
    }

    /**
     * @param kind null for every kind
     */
    public List<SyncRun> latestRuns(SyncKind kind, int limit) {
        String columns = "SELECT run_id, kind, requested_limit, started_at, completed_at, status, "
                + "records_seen, succeeded, skipped, errored, error_message FROM sync_runs ";
        if (kind == null) {
            return jdbcTemplate.query(columns + "ORDER BY started_at DESC LIMIT ?", SYNC_RUN_MAPPER, limit);
        }
        return jdbcTemplate.query(columns + "WHERE kind = ? ORDER BY started_at DESC LIMIT ?",
                SYNC_RUN_MAPPER, kind.name(), limit);
    }

    private static final RowMapper<SyncRun> SYNC_RUN_MAPPER = (rs, i) -> {
        Timestamp completed = rs.getTimestamp("completed_at");
        int limitValue = rs.getInt("requested_limit");
        Integer requestedLimit = rs.wasNull() ? null : limitValue;
        return SyncRun.builder()
                .runId(rs.getString("run_id"))
                .kind(SyncKind.valueOf(rs.getString("kind")))
                .requestedLimit(requestedLimit)
                .startedAt(rs.getTimestamp("started_at").toLocalDateTime())
                .completedAt(completed != null ? completed.toLocalDateTime() : null)
                .status(JobStatus.valueOf(rs.getString("status")))
                .recordsSeen(rs.getLong("records_seen"))
                .succeeded(rs.getLong("succeeded"))
                .skipped(rs.getLong("skipped"))
                .errored(rs.getLong("errored"))
                .errorMessage(rs.getString("error_message"))
                .build();
    };

    // ── Helpers ──────────────────────────────────────────────────────────────

    private long count(String sql, Object... args) {
        Long result = jdbcTemplate.queryForObject(sql, Long.class, args);
        return result == null ? 0 : result;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
