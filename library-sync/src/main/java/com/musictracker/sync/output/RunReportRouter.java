package com.musictracker.sync.output;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.model.RecordFailure;
import com.musictracker.sync.model.SyncRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes the end-of-run report to the configured sink(s).
 * Supports DATABASE, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunReportRouter {

    private final LibraryStore libraryStore;
    private final ErrorReportCsvWriter csvWriter;
    private final LibrarySyncProperties properties;

    /**
     * Never throws: a run's outcome must not depend on its audit trail.
     */
    public void report(SyncRun run, List<RecordFailure> failures) {
        LibrarySyncProperties.Output.RunReportMode mode = properties.getOutput().getMode();

        if (mode != LibrarySyncProperties.Output.RunReportMode.CSV) {
            try {
                libraryStore.writeSyncRun(run);
            } catch (RuntimeException e) {
                log.warn("Failed to write sync run {}: {}", run.getRunId(), e.getMessage());
            }
        }

        if (mode != LibrarySyncProperties.Output.RunReportMode.DATABASE) {
            try {
                csvWriter.write(run, failures);
            } catch (RuntimeException e) {
                log.warn("Failed to write error report for run {}: {}", run.getRunId(), e.getMessage());
            }
        }
    }
}
