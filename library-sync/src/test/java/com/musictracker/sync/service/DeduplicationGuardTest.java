package com.musictracker.sync.service;

import com.musictracker.sync.model.CatalogRelease;
import com.musictracker.sync.model.DedupDecision;
import com.musictracker.sync.model.Scrobble;
import com.musictracker.sync.model.TrackIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeduplicationGuardTest {

    private static final Duration WINDOW = Duration.ofSeconds(600);
    private static final TrackIdentity SONG = new TrackIdentity("Radiohead", "OK Computer", "Airbag");
    private static final long T0 = 1_700_000_000L;

    private final List<Scrobble> stored = new ArrayList<>();
    private DeduplicationGuard guard;
    private SessionSeen session;

    @BeforeEach
    void setUp() {
        DuplicateLookup lookup = new DuplicateLookup() {
            @Override
            public boolean existsByNaturalKey(String naturalKey) {
                return stored.stream().anyMatch(s -> s.naturalKey().equals(naturalKey));
            }

            @Override
            public boolean existsWithinWindow(String trackKey, long timestamp, Duration window) {
                return stored.stream().anyMatch(s -> s.trackKey().equals(trackKey)
                        && Math.abs(s.timestamp() - timestamp) < window.toSeconds());
            }
        };
        guard = new DeduplicationGuard(lookup, WINDOW);
        session = new SessionSeen();
    }

    @Test
    void unknownRecordIsNew() {
        assertThat(guard.decide(play(SONG, T0), session)).isEqualTo(DedupDecision.NEW);
    }

    @Test
    void storedNaturalKeyIsExactDuplicate() {
        stored.add(play(SONG, T0));

        assertThat(guard.decide(play(SONG, T0), session)).isEqualTo(DedupDecision.DUPLICATE_EXACT);
    }

    @Test
    void naturalKeyIgnoresCaseAndSurroundingSpace() {
        stored.add(play(SONG, T0));
        TrackIdentity sameSong = new TrackIdentity(" radiohead", "OK COMPUTER ", "airbag");

        assertThat(guard.decide(play(sameSong, T0), session)).isEqualTo(DedupDecision.DUPLICATE_EXACT);
    }

    @Test
    void storedPlayThreeHundredSecondsApartIsWindowDuplicate() {
        stored.add(play(SONG, T0));

        assertThat(guard.decide(play(SONG, T0 + 300), session)).isEqualTo(DedupDecision.DUPLICATE_WINDOW);
        assertThat(guard.decide(play(SONG, T0 - 300), session)).isEqualTo(DedupDecision.DUPLICATE_WINDOW);
    }

    @Test
    void storedPlaySevenHundredSecondsApartIsKept() {
        stored.add(play(SONG, T0));

        assertThat(guard.decide(play(SONG, T0 + 700), session)).isEqualTo(DedupDecision.NEW);
    }

    @Test
    void windowIsStrict() {
        stored.add(play(SONG, T0));

        assertThat(guard.decide(play(SONG, T0 + 600), session)).isEqualTo(DedupDecision.NEW);
    }

    @Test
    void otherTrackInsideWindowIsNew() {
        stored.add(play(SONG, T0));
        TrackIdentity other = new TrackIdentity("Radiohead", "OK Computer", "Paranoid Android");

        assertThat(guard.decide(play(other, T0 + 60), session)).isEqualTo(DedupDecision.NEW);
    }

    @Test
    void keyAcceptedEarlierInRunIsSessionDuplicate() {
        session.accept(play(SONG, T0));

        assertThat(guard.decide(play(SONG, T0), session)).isEqualTo(DedupDecision.DUPLICATE_SESSION);
    }

    @Test
    void playAcceptedEarlierInRunInsideWindowIsWindowDuplicate() {
        session.accept(play(SONG, T0));

        assertThat(guard.decide(play(SONG, T0 + 300), session)).isEqualTo(DedupDecision.DUPLICATE_WINDOW);
        assertThat(guard.decide(play(SONG, T0 + 700), session)).isEqualTo(DedupDecision.NEW);
    }

    @Test
    void exactMatchWinsOverSession() {
        stored.add(play(SONG, T0));
        session.accept(play(SONG, T0));

        assertThat(guard.decide(play(SONG, T0), session)).isEqualTo(DedupDecision.DUPLICATE_EXACT);
    }

    @Test
    void catalogGuardHasNoWindowRule() {
        List<String> storedIds = List.of("1001");
        DeduplicationGuard catalogGuard = new DeduplicationGuard(storedIds::contains);
        SessionSeen catalogSession = new SessionSeen();

        assertThat(catalogGuard.decide(release("1001"), catalogSession)).isEqualTo(DedupDecision.DUPLICATE_EXACT);
        assertThat(catalogGuard.decide(release("1002"), catalogSession)).isEqualTo(DedupDecision.NEW);

        catalogSession.accept(release("1002"));
        assertThat(catalogGuard.decide(release("1002"), catalogSession)).isEqualTo(DedupDecision.DUPLICATE_SESSION);
    }

    private static Scrobble play(TrackIdentity track, long timestamp) {
        return new Scrobble(track, timestamp, null);
    }

    private static CatalogRelease release(String id) {
        return new CatalogRelease(id, "Title " + id, List.of("Artist"));
    }
}
