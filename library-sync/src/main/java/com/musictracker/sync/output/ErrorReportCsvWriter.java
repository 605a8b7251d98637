package com.musictracker.sync.output;

import com.opencsv.CSVWriter;
import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.model.RecordFailure;
import com.musictracker.sync.model.SyncRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Writes the records a run failed on to CSV, one file per run.
 *
 * Output path pattern: {reportDir}/sync_{kind}_{runId}.csv
 * e.g. /data/sync-reports/sync_catalog_3f0c....csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ErrorReportCsvWriter {

    private final LibrarySyncProperties properties;

    private static final String[] HEADERS = {
            "run_id", "kind", "natural_key", "label", "error"
    };

    /**
     * @return the written file, or null when the run had no failures
     */
    public Path write(SyncRun run, List<RecordFailure> failures) {
        if (failures.isEmpty()) return null;

        Path outputDir = Paths.get(properties.getOutput().getReportDir());
        ensureDirectory(outputDir);

        String filename = String.format("sync_%s_%s.csv", run.getKind().pathName(), run.getRunId());
        Path outputPath = outputDir.resolve(filename);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (RecordFailure failure : failures) {
                writer.writeNext(new String[]{
                        run.getRunId(),
                        run.getKind().pathName(),
                        str(failure.naturalKey()),
                        str(failure.label()),
                        str(failure.error())
                });
            }

            log.info("Written {} failed records to CSV: {}", failures.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new IllegalStateException("CSV write failed", e);
        }
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create report directory: " + dir, e);
        }
    }
}
