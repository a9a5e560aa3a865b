package com.batterysmart.swap_ledger.exception;

/**
 * A referenced driver, plan, subscription, station, invoice, penalty or
 * leave request does not exist.
 */
public class NotFoundException extends LedgerException {

    private final String resource;
    private final String identifier;

    public NotFoundException(String resource, Object identifier) {
        super(String.format("%s not found: %s", resource, identifier));
        this.resource = resource;
        this.identifier = String.valueOf(identifier);
    }

    public String getResource() {
        return resource;
    }

    public String getIdentifier() {
        return identifier;
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
