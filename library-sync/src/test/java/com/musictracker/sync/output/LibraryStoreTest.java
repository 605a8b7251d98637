package com.musictracker.sync.output;

import com.musictracker.sync.model.Album;
import com.musictracker.sync.model.CatalogRelease;
import com.musictracker.sync.model.CheckpointResult;
import com.musictracker.sync.model.JobStatus;
import com.musictracker.sync.model.ListeningEntry;
import com.musictracker.sync.model.StagedRecord;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.model.SyncRun;
import com.musictracker.sync.model.TrackIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LibraryStoreTest {

    private static final long T0 = 1_700_000_000L;

    private JdbcTemplate jdbc;
    private LibraryStore store;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabase.newDataSource();
        jdbc = new JdbcTemplate(dataSource);
        store = TestDatabase.newStore(dataSource);
    }

    @Test
    void ensureSchemaCanRunTwice() {
        store.ensureSchema();

        assertThat(store.countListeningEntries()).isZero();
    }

    @Test
    void insertedAlbumIsPartOfCatalogSkipSet() {
        store.insertAlbum(album("1001", "Kid A", "Radiohead"));

        assertThat(store.existingNaturalKeys(SyncKind.CATALOG)).containsExactly("1001");
        assertThat(store.albumExists("1001")).isTrue();
        assertThat(store.albumExists("1002")).isFalse();
    }

    @Test
    void albumArtistsAreSharedByName() {
        store.insertAlbum(album("1001", "Kid A", "Radiohead"));
        store.insertAlbum(album("1002", "Amnesiac", "Radiohead"));

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM artists", Long.class)).isEqualTo(1L);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM album_artists", Long.class)).isEqualTo(2L);
    }

    @Test
    void listeningEntryCreatesTrackAndIsPartOfHistorySkipSet() {
        store.insertListeningEntry(entry("Portishead", "Dummy", "Roads", T0));

        String trackKey = new TrackIdentity("Portishead", "Dummy", "Roads").key();
        assertThat(store.existingNaturalKeys(SyncKind.HISTORY)).containsExactly(trackKey + "@" + T0);
        assertThat(store.playExists(trackKey, T0)).isTrue();
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM tracks", Long.class)).isEqualTo(1L);
    }

    @Test
    void secondPlayReusesTrack() {
        store.insertListeningEntry(entry("Portishead", "Dummy", "Roads", T0));
        store.insertListeningEntry(entry("Portishead", "Dummy", "Roads", T0 + 3600));

        assertThat(store.countListeningEntries()).isEqualTo(2);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM tracks", Long.class)).isEqualTo(1L);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM albums", Long.class)).isEqualTo(1L);
    }

    @Test
    void windowLookupIsStrictAndSymmetric() {
        store.insertListeningEntry(entry("Portishead", "Dummy", "Roads", T0));
        String trackKey = new TrackIdentity("Portishead", "Dummy", "Roads").key();
        Duration window = Duration.ofSeconds(600);

        assertThat(store.playWithinWindow(trackKey, T0 + 599, window)).isTrue();
        assertThat(store.playWithinWindow(trackKey, T0 - 599, window)).isTrue();
        assertThat(store.playWithinWindow(trackKey, T0 + 600, window)).isFalse();
        assertThat(store.playWithinWindow("other|track|key", T0, window)).isFalse();
    }

    @Test
    void checkpointRollsBackOnlyTheFailingRecord() {
        List<StagedRecord<Album>> staged = List.of(
                staged(album("1", "First", "A")),
                staged(album("2", "Broken", "B")),
                staged(album("3", "Third", "C")));

        CheckpointResult result = store.writeCheckpoint(staged, album -> {
            store.insertAlbum(album);
            if (album.getTitle().equals("Broken")) {
                throw new IllegalStateException("cover download failed");
            }
        });

        assertThat(result.written()).isEqualTo(2);
        assertThat(result.failures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.naturalKey()).isEqualTo("2");
                    assertThat(f.error()).isEqualTo("cover download failed");
                });
        assertThat(store.existingNaturalKeys(SyncKind.CATALOG)).containsExactlyInAnyOrder("1", "3");
        // the failed record's artist row went with it
        assertThat(jdbc.queryForList("SELECT name FROM artists", String.class)).containsExactlyInAnyOrder("A", "C");
    }

    @Test
    void constraintViolationInsideCheckpointIsRecordLevel() {
        store.insertAlbum(album("1", "Existing", "A"));

        CheckpointResult result = store.writeCheckpoint(
                List.of(staged(album("1", "Again", "A")), staged(album("2", "New", "B"))),
                store::insertAlbum);

        assertThat(result.written()).isEqualTo(1);
        assertThat(result.failures()).hasSize(1);
        assertThat(store.existingNaturalKeys(SyncKind.CATALOG)).containsExactlyInAnyOrder("1", "2");
    }

    @Test
    void emptyCheckpointWritesNothing() {
        CheckpointResult result = store.writeCheckpoint(List.<StagedRecord<Album>>of(), store::insertAlbum);

        assertThat(result.written()).isZero();
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void latestRunsNewestFirstAndFilteredByKind() {
        store.writeSyncRun(run("a", SyncKind.CATALOG, LocalDateTime.of(2024, 3, 1, 4, 0), null));
        store.writeSyncRun(run("b", SyncKind.HISTORY, LocalDateTime.of(2024, 3, 1, 5, 0), 100));
        store.writeSyncRun(run("c", SyncKind.CATALOG, LocalDateTime.of(2024, 3, 2, 4, 0), null));

        assertThat(store.latestRuns(null, 10)).extracting(SyncRun::getRunId).containsExactly("c", "b", "a");
        assertThat(store.latestRuns(SyncKind.CATALOG, 1)).extracting(SyncRun::getRunId).containsExactly("c");

        SyncRun history = store.latestRuns(SyncKind.HISTORY, 10).get(0);
        assertThat(history.getRequestedLimit()).isEqualTo(100);
        assertThat(history.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(store.latestRuns(SyncKind.CATALOG, 10).get(0).getRequestedLimit()).isNull();
    }

    @Test
    void deletesPlaysById() {
        store.insertListeningEntry(entry("A", "B", "C", T0));
        store.insertListeningEntry(entry("A", "B", "C", T0 + 10));
        List<Long> ids = store.listeningPlaysInOrder().stream().map(LibraryStore.PlayRow::id).toList();

        assertThat(store.deleteListeningEntries(ids.subList(1, 2))).isEqualTo(1);
        assertThat(store.countListeningEntries()).isEqualTo(1);
    }

    private static Album album(String discogsId, String title, String artist) {
        return Album.builder()
                .title(title)
                .year(2000)
                .support("Vinyl")
                .source("discogs")
                .discogsId(discogsId)
                .artists(List.of(artist))
                .importedAt(LocalDateTime.of(2024, 3, 1, 10, 0))
                .build();
    }

    private static StagedRecord<Album> staged(Album album) {
        return new StagedRecord<>(new CatalogRelease(album.getDiscogsId(), album.getTitle(), album.getArtists()), album);
    }

    private static ListeningEntry entry(String artist, String album, String title, long timestamp) {
        return ListeningEntry.builder()
                .track(new TrackIdentity(artist, album, title))
                .timestamp(timestamp)
                .date("2023-11-14 22:13")
                .source("lastfm")
                .build();
    }

    private static SyncRun run(String id, SyncKind kind, LocalDateTime startedAt, Integer limit) {
        return SyncRun.builder()
                .runId(id)
                .kind(kind)
                .requestedLimit(limit)
                .startedAt(startedAt)
                .completedAt(startedAt.plusMinutes(3))
                .status(JobStatus.COMPLETED)
                .recordsSeen(10)
                .succeeded(8)
                .skipped(2)
                .build();
    }
}
