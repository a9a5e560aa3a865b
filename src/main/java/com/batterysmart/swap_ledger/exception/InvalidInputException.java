package com.batterysmart.swap_ledger.exception;

/**
 * Caller supplied a value outside its allowed range: a charge level outside
 * 0..100, an inverted date range, a malformed phone number and the like.
 * Values are never clamped silently.
 */
public class InvalidInputException extends LedgerException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getErrorCode() {
        return "INVALID_INPUT";
    }
}
