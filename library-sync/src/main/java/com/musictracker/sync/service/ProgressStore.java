package com.musictracker.sync.service;

import com.musictracker.sync.model.JobProgress;
import com.musictracker.sync.model.SyncKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Current status of each job kind. One writer per kind (the running job), any number of
 * readers. Every change replaces the immutable {@link JobProgress} snapshot atomically.
 */
@Component
public class ProgressStore {

    private final Map<SyncKind, AtomicReference<JobProgress>> progress = new EnumMap<>(SyncKind.class);

    public ProgressStore() {
        for (SyncKind kind : SyncKind.values()) {
            progress.put(kind, new AtomicReference<>(JobProgress.idle(kind)));
        }
    }

    public JobProgress get(SyncKind kind) {
        return progress.get(kind).get();
    }

    /**
     * Move {@code kind} to STARTING unless a job of that kind is starting or running.
     *
     * @return false if another job holds the slot
     */
    public boolean tryStart(SyncKind kind, String runId, Instant startedAt) {
        AtomicReference<JobProgress> ref = progress.get(kind);
        JobProgress next = JobProgress.starting(kind, runId, startedAt);
        while (true) {
            JobProgress current = ref.get();
            if (current.getStatus().isActive()) {
                return false;
            }
            if (ref.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    public JobProgress update(SyncKind kind, UnaryOperator<JobProgress> change) {
        return progress.get(kind).updateAndGet(change);
    }
}
