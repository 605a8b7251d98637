package com.musictracker.sync.service;

import com.musictracker.sync.exception.CircuitOpenException;
import com.musictracker.sync.exception.ProviderException;
import com.musictracker.sync.exception.RateLimitedException;
import com.musictracker.sync.exception.TerminalProviderException;
import com.musictracker.sync.model.CheckpointResult;
import com.musictracker.sync.model.DedupDecision;
import com.musictracker.sync.model.ExternalRecord;
import com.musictracker.sync.model.JobProgress;
import com.musictracker.sync.model.JobStatus;
import com.musictracker.sync.model.Page;
import com.musictracker.sync.model.RecordFailure;
import com.musictracker.sync.model.StagedRecord;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.model.SyncRun;
import com.musictracker.sync.output.LibraryStore;
import com.musictracker.sync.output.RunReportRouter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * One import run of one kind, executed on a single worker thread.
 *
 * Records are pulled from the pipeline's fetcher in provider order. Each goes through the
 * duplicate guard; new ones are transformed and staged, and every {@code checkpointSize}
 * staged records are committed together. A record that fails to transform or write is
 * counted in {@code errored} and skipped. Provider failures that make the rest of the run
 * pointless (bad credentials, unreachable provider) end the run in ERROR; checkpoints
 * already committed stay.
 *
 * The job is the only writer of its kind's {@link JobProgress}.
 */
@Slf4j
public class SyncJob<R extends ExternalRecord, E> implements Runnable {

    static final String MDC_RUN_ID = "syncRunId";
    static final String CANCELLED = "Cancelled";

    private final String runId;
    private final Integer limit;
    private final SyncPipeline<R, E> pipeline;
    private final LibraryStore store;
    private final ProgressStore progressStore;
    private final RunReportRouter reports;
    private final Clock clock;

    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final SessionSeen session = new SessionSeen();
    private final List<StagedRecord<E>> staged = new ArrayList<>();
    private final List<RecordFailure> failures = new ArrayList<>();

    public SyncJob(String runId, Integer limit, SyncPipeline<R, E> pipeline, LibraryStore store,
                   ProgressStore progressStore, RunReportRouter reports, Clock clock) {
        this.runId = runId;
        this.limit = limit;
        this.pipeline = pipeline;
        this.store = store;
        this.progressStore = progressStore;
        this.reports = reports;
        this.clock = clock;
    }

    public String getRunId() {
        return runId;
    }

    /** Ask the worker to stop after the current record. Pending records are still committed. */
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            log.info("Cancellation requested for {} run {}", pipeline.kind().pathName(), runId);
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    @Override
    public void run() {
        MDC.put(MDC_RUN_ID, runId);
        try {
            execute();
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void execute() {
        SyncKind kind = pipeline.kind();
        log.info("Starting {} sync (limit: {})", kind.pathName(), limit != null ? limit : "none");

        JobStatus outcome = JobStatus.COMPLETED;
        String message = null;
        try {
            Set<String> skipSet = pipeline.existingKeys();
            log.info("{} {} records already in library", skipSet.size(), kind.pathName());

            progress(p -> p.toBuilder()
                    .status(JobStatus.RUNNING)
                    .currentItemLabel("Fetching from " + kind.dependency())
                    .build());

            Iterator<R> records = pipeline.fetcher()
                    .fetchAll(pipeline.pageSize(), skipSet, limit, new ProgressListener())
                    .iterator();

            while (!cancelRequested.get() && records.hasNext()) {
                if (!process(records.next())) {
                    break;
                }
            }
            flush();

            if (cancelRequested.get()) {
                outcome = JobStatus.ERROR;
                message = CANCELLED;
            }

        } catch (ProviderException e) {
            outcome = JobStatus.ERROR;
            message = describe(e);
            log.error("{} sync aborted: {}", kind.pathName(), message, e);
            flushAfterFailure();
        } catch (DataAccessException e) {
            outcome = JobStatus.ERROR;
            message = "Storage unavailable: " + e.getMostSpecificCause().getMessage();
            log.error("{} sync aborted: {}", kind.pathName(), message, e);
        } catch (RuntimeException e) {
            outcome = JobStatus.ERROR;
            message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("{} sync failed: {}", kind.pathName(), message, e);
        }

        finish(outcome, message);
    }

    /**
     * @return false when the provider can't take more detail calls and the run should stop here
     */
    private boolean process(R record) {
        progress(p -> advance(p, record.label()));

        DedupDecision decision = pipeline.deduplicationGuard().decide(record, session);
        if (decision.isDuplicate()) {
            progress(p -> p.toBuilder().skipped(p.getSkipped() + 1).build());
            return true;
        }

        E entity;
        try {
            entity = pipeline.transform(record);
        } catch (RateLimitedException | CircuitOpenException e) {
            log.warn("{} unavailable while processing {}, stopping early: {}",
                    pipeline.kind().dependency(), record.label(), e.getMessage());
            recordError(record, e);
            return false;
        } catch (TerminalProviderException e) {
            if (e.isCredentialFailure()) {
                throw e;
            }
            recordError(record, e);
            return true;
        } catch (RuntimeException e) {
            recordError(record, e);
            return true;
        }

        session.accept(record);
        staged.add(new StagedRecord<>(record, entity));
        if (staged.size() >= pipeline.checkpointSize()) {
            flush();
        }
        return true;
    }

    private void recordError(R record, RuntimeException e) {
        log.warn("Failed to process {} [{}]: {}", record.label(), record.naturalKey(), e.getMessage());
        failures.add(RecordFailure.of(record, e));
        progress(p -> p.toBuilder().errored(p.getErrored() + 1).build());
    }

    private void flush() {
        if (staged.isEmpty()) return;

        List<StagedRecord<E>> batch = List.copyOf(staged);
        staged.clear();
        CheckpointResult result = store.writeCheckpoint(batch, pipeline::write);

        failures.addAll(result.failures());
        progress(p -> p.toBuilder()
                .succeeded(p.getSucceeded() + result.written())
                .errored(p.getErrored() + result.failures().size())
                .build());
    }

    /** Keep the records staged before a provider failure; they are valid. */
    private void flushAfterFailure() {
        try {
            flush();
        } catch (DataAccessException e) {
            log.error("Could not commit {} pending records after failure: {}", staged.size(), e.getMessage(), e);
        }
    }

    private void finish(JobStatus outcome, String message) {
        SyncKind kind = pipeline.kind();
        Instant finishedAt = clock.instant();
        JobProgress last = progress(p -> p.toBuilder()
                .status(outcome)
                .finishedAt(finishedAt)
                .currentItemLabel(null)
                .message(message != null ? message : p.getMessage())
                .build());

        SyncRun run = SyncRun.builder()
                .runId(runId)
                .kind(kind)
                .requestedLimit(limit)
                .startedAt(toUtc(last.getStartedAt() != null ? last.getStartedAt() : finishedAt))
                .completedAt(toUtc(finishedAt))
                .status(outcome)
                .recordsSeen(last.getCurrent())
                .succeeded(last.getSucceeded())
                .skipped(last.getSkipped())
                .errored(last.getErrored())
                .errorMessage(outcome == JobStatus.ERROR ? message : null)
                .build();
        reports.report(run, failures);

        log.info("{} sync {}: {} seen, {} imported, {} skipped, {} errors",
                kind.pathName(), outcome.json(), last.getCurrent(), last.getSucceeded(),
                last.getSkipped(), last.getErrored());
    }

    private JobProgress progress(UnaryOperator<JobProgress> change) {
        return progressStore.update(pipeline.kind(), change);
    }

    private static JobProgress advance(JobProgress p, String label) {
        long current = p.getCurrent() + 1;
        return p.toBuilder()
                .current(current)
                .total(Math.max(p.getTotal(), current))
                .currentItemLabel(label)
                .build();
    }

    private static String describe(ProviderException e) {
        if (e instanceof TerminalProviderException terminal && terminal.isCredentialFailure()) {
            return e.getProvider() + " rejected the credentials: " + e.getMessage();
        }
        if (e instanceof TerminalProviderException) {
            return e.getMessage();
        }
        return e.getProvider() + " unreachable: " + e.getMessage();
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    /** Page-level events from the fetcher, on this job's thread. */
    private final class ProgressListener implements PaginatedFetcher.Listener<R> {

        @Override
        public void onPage(Page<R> page) {
            Long reported = page.totalCount();
            if (reported == null) return;
            long total = limit != null ? Math.min(reported, limit) : reported;
            progress(p -> p.toBuilder().total(Math.max(p.getTotal(), total)).build());
        }

        @Override
        public void onKnownSkipped(R record) {
            progress(p -> {
                JobProgress advanced = advance(p, record.label());
                return advanced.toBuilder().skipped(advanced.getSkipped() + 1).build();
            });
        }

        @Override
        public boolean isCancelled() {
            return cancelRequested.get();
        }

        @Override
        public void onStoppedEarly(String reason) {
            progress(p -> p.toBuilder().message("Stopped early: " + reason).build());
        }
    }
}
