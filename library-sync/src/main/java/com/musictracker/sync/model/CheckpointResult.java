package com.musictracker.sync.model;

import java.util.List;

/**
 * Outcome of committing one checkpoint: how many records made it, and which did not.
 */
public record CheckpointResult(int written, List<RecordFailure> failures) {

    public CheckpointResult {
        failures = List.copyOf(failures);
    }

    public static CheckpointResult empty() {
        return new CheckpointResult(0, List.of());
    }
}
