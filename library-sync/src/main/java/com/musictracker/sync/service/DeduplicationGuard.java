package com.musictracker.sync.service;

import com.musictracker.sync.model.DedupDecision;
import com.musictracker.sync.model.ExternalRecord;
import com.musictracker.sync.model.WindowedRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Decides whether an incoming record is new.
 *
 * Checks run in this order:
 * <ol>
 *   <li>natural key already persisted: {@link DedupDecision#DUPLICATE_EXACT}</li>
 *   <li>windowed kinds only: a persisted play of the same track less than the window
 *       away, before or after: {@link DedupDecision#DUPLICATE_WINDOW}</li>
 *   <li>natural key accepted earlier in this run: {@link DedupDecision#DUPLICATE_SESSION}</li>
 *   <li>windowed kinds only: a play of the same track accepted earlier in this run
 *       within the window: {@link DedupDecision#DUPLICATE_WINDOW}</li>
 * </ol>
 * The guard does not record anything; the caller adds accepted records to the session.
 */
@Slf4j
public class DeduplicationGuard {

    private final DuplicateLookup lookup;
    private final Duration window;

    /** Guard without the time-window rule. */
    public DeduplicationGuard(DuplicateLookup lookup) {
        this(lookup, null);
    }

    /**
     * @param window span inside which two plays of a track are one play, or null to disable
     */
    public DeduplicationGuard(DuplicateLookup lookup, Duration window) {
        this.lookup = lookup;
        this.window = window;
    }

    public DedupDecision decide(ExternalRecord record, SessionSeen session) {
        DedupDecision decision = evaluate(record, session);
        if (decision.isDuplicate()) {
            log.debug("{} [{}] -> {}", record.label(), record.naturalKey(), decision);
        }
        return decision;
    }

    private DedupDecision evaluate(ExternalRecord record, SessionSeen session) {
        if (lookup.existsByNaturalKey(record.naturalKey())) {
            return DedupDecision.DUPLICATE_EXACT;
        }
        WindowedRecord windowed = windowed(record);
        if (windowed != null
                && lookup.existsWithinWindow(windowed.trackKey(), windowed.timestamp(), window)) {
            return DedupDecision.DUPLICATE_WINDOW;
        }
        if (session.contains(record.naturalKey())) {
            return DedupDecision.DUPLICATE_SESSION;
        }
        if (windowed != null && session.withinWindow(windowed.trackKey(), windowed.timestamp(), window)) {
            return DedupDecision.DUPLICATE_WINDOW;
        }
        return DedupDecision.NEW;
    }

    private WindowedRecord windowed(ExternalRecord record) {
        if (window == null || !(record instanceof WindowedRecord windowed)) {
            return null;
        }
        return windowed;
    }
}
