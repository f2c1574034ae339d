package com.candlevault.core.error;

/**
 * Failure categories surfaced by the sync engine.
 * Window errors are detected before any network activity.
 */
public enum ErrorKind {
    INVALID_DURATION,
    MISSING_WINDOW_INPUT,
    INVALID_WINDOW,
    UPSTREAM_FETCH_FAILED,
    CORRUPT_LOCAL_STORE,
    STORE_WRITE_FAILED,
    INVALID_CONFIGURATION,
    INVALID_OPERATION;

    /**
     * Whether running the same operation again could succeed without changing its inputs.
     * Nothing is retried automatically.
     */
    public boolean isRetryable() {
        return this == UPSTREAM_FETCH_FAILED;
    }
}
