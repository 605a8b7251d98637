package com.musictracker.sync.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one job. Instances are immutable; the running job publishes
 * a new copy for every change so readers never see a half-applied update.
 */
@Value
@Builder(toBuilder = true)
public class JobProgress {

    SyncKind kind;
    JobStatus status;
    String runId;
    long current;
    long total;
    long succeeded;
    long skipped;
    long errored;
    String currentItemLabel;
    Instant startedAt;
    Instant finishedAt;
    String message;

    public static JobProgress idle(SyncKind kind) {
        return JobProgress.builder()
                .kind(kind)
                .status(JobStatus.IDLE)
                .build();
    }

    public static JobProgress starting(SyncKind kind, String runId, Instant startedAt) {
        return JobProgress.builder()
                .kind(kind)
                .status(JobStatus.STARTING)
                .runId(runId)
                .currentItemLabel("Starting...")
                .startedAt(startedAt)
                .build();
    }
}
