package io.quotecache.core;

public enum RefreshOutcome {
    /** Partition fetched and merged into the store. */
    FETCHED,
    /** Current-year partition fetched and written over the previous copy. */
    REPLACED,
    /** Past-year partition already complete. */
    SKIPPED,
    /** Another execution held the lease. */
    BUSY
}
