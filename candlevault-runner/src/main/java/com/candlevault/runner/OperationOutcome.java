package com.candlevault.runner;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.error.ErrorKind;

/**
 * Result of one operation as reported to the caller.
 */
public sealed interface OperationOutcome {

    String summary();

    default int exitCode() {
        return this instanceof Success ? 0 : 1;
    }

    record Success(String summary) implements OperationOutcome {}

    /**
     * The operation ran but there was nothing to report, e.g. no volume in the window.
     */
    record NoData(String summary) implements OperationOutcome {}

    record Failure(ErrorKind kind, boolean retryable, String message) implements OperationOutcome {
        public static Failure of(CandleVaultException e) {
            return new Failure(e.getKind(), e.isRetryable(), e.getMessage());
        }

        @Override
        public String summary() {
            return kind + (retryable ? " (retryable)" : "") + ": " + message;
        }
    }
}
