package com.candlevault.core.error;

/**
 * Checked failure of a window resolution, fetch, store or operation step.
 */
public class CandleVaultException extends Exception {

    private final ErrorKind kind;

    public CandleVaultException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CandleVaultException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static CandleVaultException invalidDuration(String expression) {
        return new CandleVaultException(ErrorKind.INVALID_DURATION,
            "Unsupported duration '" + expression + "'. Use formats like 30m, 12h, 3d.");
    }

    public static CandleVaultException missingWindowInput(String message) {
        return new CandleVaultException(ErrorKind.MISSING_WINDOW_INPUT, message);
    }

    public static CandleVaultException invalidWindow(String message) {
        return new CandleVaultException(ErrorKind.INVALID_WINDOW, message);
    }

    public static CandleVaultException invalidWindow(String message, Throwable cause) {
        return new CandleVaultException(ErrorKind.INVALID_WINDOW, message, cause);
    }

    public static CandleVaultException upstreamFetchFailed(String message, Throwable cause) {
        return new CandleVaultException(ErrorKind.UPSTREAM_FETCH_FAILED, message, cause);
    }

    public static CandleVaultException corruptLocalStore(String message, Throwable cause) {
        return new CandleVaultException(ErrorKind.CORRUPT_LOCAL_STORE, message, cause);
    }

    public static CandleVaultException storeWriteFailed(String message, Throwable cause) {
        return new CandleVaultException(ErrorKind.STORE_WRITE_FAILED, message, cause);
    }

    public static CandleVaultException invalidConfiguration(String message) {
        return new CandleVaultException(ErrorKind.INVALID_CONFIGURATION, message);
    }

    public static CandleVaultException invalidConfiguration(String message, Throwable cause) {
        return new CandleVaultException(ErrorKind.INVALID_CONFIGURATION, message, cause);
    }

    public static CandleVaultException invalidOperation(String message) {
        return new CandleVaultException(ErrorKind.INVALID_OPERATION, message);
    }
}
