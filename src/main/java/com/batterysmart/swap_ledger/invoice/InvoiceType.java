package com.batterysmart.swap_ledger.invoice;

public enum InvoiceType {
    SWAP,
    SUBSCRIPTION,
    EXTRA_SWAP,
    PENALTY
}
