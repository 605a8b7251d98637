package com.musictracker.sync.model;

public enum DedupDecision {
    NEW,
    /** Same natural key already persisted. */
    DUPLICATE_EXACT,
    /** Same track persisted or accepted this run within the dedup window. */
    DUPLICATE_WINDOW,
    /** Same natural key already accepted earlier in this run. */
    DUPLICATE_SESSION;

    public boolean isDuplicate() {
        return this != NEW;
    }
}
