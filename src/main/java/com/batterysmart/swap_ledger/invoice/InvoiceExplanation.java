package com.batterysmart.swap_ledger.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * An invoice with a plain-language reason for the charge and its line items.
 */
@Value
public class InvoiceExplanation {
    Invoice invoice;
    String explanation;
    List<LineItem> breakdown;

    @Value
    public static class LineItem {
        String item;
        BigDecimal amount;
    }
}
