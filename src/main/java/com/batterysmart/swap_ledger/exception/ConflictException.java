package com.batterysmart.swap_ledger.exception;

/**
 * The request collides with the current state of the ledger.
 *
 * Retryable conflicts (lock timeouts) may succeed when the caller tries
 * again; non-retryable ones will not.
 */
public class ConflictException extends LedgerException {

    private final boolean retryable;

    public ConflictException(String message) {
        this(message, false);
    }

    public ConflictException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String getErrorCode() {
        return retryable ? "CONFLICT_RETRYABLE" : "CONFLICT";
    }
}
