package com.musictracker.sync.config;

import com.musictracker.sync.model.JobProgress;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.model.SyncRun;
import com.musictracker.sync.resilience.CircuitBreaker;
import com.musictracker.sync.resilience.CircuitBreakerRegistry;
import com.musictracker.sync.service.DuplicateCleanupService;
import com.musictracker.sync.service.SyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class SyncController {

    private final SyncService syncService;
    private final DuplicateCleanupService cleanupService;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    // ── Sync triggers ─────────────────────────────────────────────────────────

    /**
     * Start a sync in the background.
     *
     * POST /sync/catalog?limit=50
     *
     * Returns 202 immediately, or 409 if a sync of the same kind is already running.
     */
    @PostMapping("/sync/{kind}")
    public ResponseEntity<Map<String, String>> trigger(@PathVariable String kind,
                                                       @RequestParam(required = false) Integer limit) {
        SyncKind syncKind = SyncKind.fromPath(kind);
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        syncService.trigger(syncKind, limit);
        return ResponseEntity.accepted().body(Map.of("status", "started", "kind", syncKind.pathName()));
    }

    @PostMapping("/sync/{kind}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String kind) {
        if (syncService.cancel(SyncKind.fromPath(kind))) {
            return ResponseEntity.accepted().body(Map.of("status", "cancelling"));
        }
        return ResponseEntity.ok(Map.of("status", "idle"));
    }

    // ── Status ────────────────────────────────────────────────────────────────

    /**
     * Poll a job. Never blocks on the running job.
     *
     * GET /sync/history/progress
     */
    @GetMapping("/sync/{kind}/progress")
    public ResponseEntity<JobProgress> progress(@PathVariable String kind) {
        return ResponseEntity.ok(syncService.progress(SyncKind.fromPath(kind)));
    }

    @GetMapping("/sync/runs")
    public ResponseEntity<List<SyncRun>> runs(@RequestParam(required = false) String kind,
                                              @RequestParam(defaultValue = "20") int limit) {
        SyncKind syncKind = kind != null ? SyncKind.fromPath(kind) : null;
        return ResponseEntity.ok(syncService.recentRuns(syncKind, Math.max(1, Math.min(limit, 200))));
    }

    @GetMapping("/sync/health")
    public ResponseEntity<List<CircuitBreaker.Snapshot>> health() {
        return ResponseEntity.ok(circuitBreakerRegistry.snapshots());
    }

    // ── Maintenance ───────────────────────────────────────────────────────────

    /**
     * Remove listening entries that repeat an earlier play inside the dedup window.
     *
     * POST /sync/history/clean-duplicates
     */
    @PostMapping("/sync/history/clean-duplicates")
    public ResponseEntity<DuplicateCleanupService.CleanupResult> cleanDuplicates() {
        DuplicateCleanupService.CleanupResult result = cleanupService.cleanDuplicates();
        log.info("Duplicate cleanup removed {} entries", result.duplicatesDeleted());
        return ResponseEntity.ok(result);
    }
}
