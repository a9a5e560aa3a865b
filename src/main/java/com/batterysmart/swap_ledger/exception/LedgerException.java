package com.batterysmart.swap_ledger.exception;

/**
 * Base class for errors the ledger reports to its callers.
 *
 * Each subclass maps to one HTTP status in {@link GlobalExceptionHandler}.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable error code returned in the "error" field.
     */
    public abstract String getErrorCode();
}
