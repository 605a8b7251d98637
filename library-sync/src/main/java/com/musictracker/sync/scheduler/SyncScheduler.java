package com.musictracker.sync.scheduler;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.exception.SyncConflictException;
import com.musictracker.sync.model.SyncKind;
import com.musictracker.sync.output.LibraryStore;
import com.musictracker.sync.service.SyncService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup syncs.
 *
 * Default schedule: catalog daily at 04:00 UTC, history daily at 05:00 UTC.
 * A scheduled trigger that finds its kind still running is dropped, never queued.
 *
 * Override with CATALOG_CRON / HISTORY_CRON env vars or library-sync.scheduling.* properties.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncScheduler {

    private final SyncService syncService;
    private final LibraryStore libraryStore;
    private final LibrarySyncProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally start both syncs if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        libraryStore.ensureSchema();

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, starting catalog and history syncs");
            trigger(SyncKind.CATALOG);
            trigger(SyncKind.HISTORY);
        } else {
            log.info("Sync ready. Catalog schedule: {}, history schedule: {}",
                    properties.getScheduling().getCatalogCron(), properties.getScheduling().getHistoryCron());
        }
    }

    @Scheduled(cron = "${library-sync.scheduling.catalog-cron:0 0 4 * * ?}", zone = "UTC")
    public void scheduledCatalogSync() {
        if (properties.getScheduling().isEnabled()) {
            log.info("Scheduled catalog sync triggered");
            trigger(SyncKind.CATALOG);
        }
    }

    @Scheduled(cron = "${library-sync.scheduling.history-cron:0 0 5 * * ?}", zone = "UTC")
    public void scheduledHistorySync() {
        if (properties.getScheduling().isEnabled()) {
            log.info("Scheduled history sync triggered");
            trigger(SyncKind.HISTORY);
        }
    }

    private void trigger(SyncKind kind) {
        try {
            syncService.trigger(kind, null);
        } catch (SyncConflictException e) {
            log.info("Skipping scheduled {} sync: {}", kind.pathName(), e.getMessage());
        } catch (TaskRejectedException e) {
            log.error("Scheduled {} sync could not start: {}", kind.pathName(), e.getMessage(), e);
        }
    }
}
