package com.batterysmart.swap_ledger.exception;

/**
 * A lifecycle transition was requested from a state that does not allow it,
 * e.g. approving a leave request that was already rejected.
 */
public class IllegalTransitionException extends ConflictException {

    public IllegalTransitionException(String entity, Object from, Object to) {
        super(String.format("Cannot move %s from %s to %s", entity, from, to));
    }

    @Override
    public String getErrorCode() {
        return "ILLEGAL_TRANSITION";
    }
}
