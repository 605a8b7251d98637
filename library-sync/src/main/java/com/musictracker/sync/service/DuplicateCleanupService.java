package com.musictracker.sync.service;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.exception.SyncConflictException;
import com.musictracker.sync.model.JobProgress;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.output.LibraryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Removes stored plays that repeat an earlier play of the same track inside the dedup
 * window. The earliest play of each cluster is kept. Running it twice deletes nothing
 * the second time.
 *
 * The cleanup holds the history slot of the {@link ProgressStore} while it runs, so a
 * history import can't start until it is done. The previous history progress is put back
 * afterwards.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DuplicateCleanupService {

    private final LibraryStore store;
    private final ProgressStore progressStore;
    private final LibrarySyncProperties properties;
    private final Clock clock;

    public record CleanupResult(long totalInitial, int duplicatesDeleted, long totalFinal) {
    }

    /**
     * @throws SyncConflictException while a history import or another cleanup is running
     */
    @Transactional
    public CleanupResult cleanDuplicates() {
        JobProgress previous = progressStore.get(SyncKind.HISTORY);
        String claim = "cleanup-" + UUID.randomUUID();
        if (!progressStore.tryStart(SyncKind.HISTORY, claim, clock.instant())) {
            throw new SyncConflictException(SyncKind.HISTORY);
        }
        progressStore.update(SyncKind.HISTORY, p -> p.toBuilder().currentItemLabel("Cleaning duplicates").build());
        try {
            return removeDuplicates();
        } finally {
            progressStore.update(SyncKind.HISTORY, p -> claim.equals(p.getRunId()) ? previous : p);
        }
    }

    private CleanupResult removeDuplicates() {
        long totalInitial = store.countListeningEntries();
        log.info("Duplicate cleanup: {} listening entries before", totalInitial);

        long window = properties.getSync().getDedupWindow().toSeconds();
        List<Long> toDelete = new ArrayList<>();
        String currentTrack = null;
        long lastKept = 0;
        for (LibraryStore.PlayRow play : store.listeningPlaysInOrder()) {
            if (!play.trackKey().equals(currentTrack)) {
                currentTrack = play.trackKey();
                lastKept = play.timestamp();
                continue;
            }
            if (play.timestamp() - lastKept < window) {
                toDelete.add(play.id());
            } else {
                lastKept = play.timestamp();
            }
        }

        int deleted = store.deleteListeningEntries(toDelete);
        long totalFinal = store.countListeningEntries();
        log.info("Duplicate cleanup: {} deleted, {} remaining", deleted, totalFinal);
        return new CleanupResult(totalInitial, deleted, totalFinal);
    }
}
