package com.musictracker.sync.service;

import com.musictracker.sync.exception.SyncConflictException;
import com.musictracker.sync.model.ExternalRecord;
import com.musictracker.sync.model.JobProgress;
import com.musictracker.sync.model.JobStatus;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.model.SyncRun;
import com.musictracker.sync.output.LibraryStore;
import com.musictracker.sync.output.RunReportRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts, cancels and reports on sync jobs.
 *
 * At most one job per kind: the slot is claimed atomically in the {@link ProgressStore},
 * so a second trigger is rejected, never queued. Jobs run on {@code syncTaskExecutor} and
 * the caller returns as soon as the job is handed over.
 */
@Service
@Slf4j
public class SyncService {

    private final Map<SyncKind, SyncPipeline<?, ?>> pipelines = new EnumMap<>(SyncKind.class);
    private final Map<SyncKind, SyncJob<?, ?>> activeJobs = new ConcurrentHashMap<>();

    private final ProgressStore progressStore;
    private final LibraryStore libraryStore;
    private final RunReportRouter reports;
    private final TaskExecutor executor;
    private final Clock clock;

    public SyncService(List<SyncPipeline<?, ?>> pipelines,
                       ProgressStore progressStore,
                       LibraryStore libraryStore,
                       RunReportRouter reports,
                       @Qualifier("syncTaskExecutor") TaskExecutor executor,
                       Clock clock) {
        pipelines.forEach(p -> this.pipelines.put(p.kind(), p));
        this.progressStore = progressStore;
        this.libraryStore = libraryStore;
        this.reports = reports;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Start a job in the background.
     *
     * @param limit maximum number of new records to consider, or null for all
     * @return the progress right after the job was handed over (status STARTING or later)
     * @throws SyncConflictException if a job of this kind is starting or running
     */
    public JobProgress trigger(SyncKind kind, Integer limit) {
        SyncPipeline<?, ?> pipeline = pipelines.get(kind);
        if (pipeline == null) {
            throw new IllegalArgumentException("No pipeline configured for " + kind.pathName());
        }

        String runId = UUID.randomUUID().toString();
        if (!progressStore.tryStart(kind, runId, clock.instant())) {
            log.warn("{} sync already running, trigger rejected", kind.pathName());
            throw new SyncConflictException(kind);
        }

        SyncJob<?, ?> job = newJob(runId, limit, pipeline);
        activeJobs.put(kind, job);
        try {
            executor.execute(() -> {
                try {
                    job.run();
                } finally {
                    activeJobs.remove(kind, job);
                }
            });
        } catch (TaskRejectedException e) {
            activeJobs.remove(kind, job);
            progressStore.update(kind, p -> p.toBuilder()
                    .status(JobStatus.ERROR)
                    .finishedAt(clock.instant())
                    .message("Could not start: " + e.getMessage())
                    .build());
            throw e;
        }

        log.info("{} sync triggered (run {}, limit: {})", kind.pathName(), runId, limit != null ? limit : "none");
        return progressStore.get(kind);
    }

    /**
     * @return false if no job of this kind is running
     */
    public boolean cancel(SyncKind kind) {
        SyncJob<?, ?> job = activeJobs.get(kind);
        if (job == null) {
            return false;
        }
        job.cancel();
        return true;
    }

    public JobProgress progress(SyncKind kind) {
        return progressStore.get(kind);
    }

    /**
     * @param kind null for every kind
     */
    public List<SyncRun> recentRuns(SyncKind kind, int limit) {
        return libraryStore.latestRuns(kind, limit);
    }

    private <R extends ExternalRecord, E> SyncJob<R, E> newJob(String runId, Integer limit,
                                                              SyncPipeline<R, E> pipeline) {
        return new SyncJob<>(runId, limit, pipeline, libraryStore, progressStore, reports, clock);
    }
}
