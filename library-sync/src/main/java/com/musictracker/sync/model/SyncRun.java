package com.musictracker.sync.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Audit row written for every finished run.
 * Stored in the sync_runs table.
 */
@Data
@Builder
public class SyncRun {

    private String runId;           // UUID
    private SyncKind kind;
    private Integer requestedLimit; // null = whole collection
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private JobStatus status;       // COMPLETED | ERROR
    private long recordsSeen;
    private long succeeded;
    private long skipped;
    private long errored;
    private String errorMessage;    // null on success
}
