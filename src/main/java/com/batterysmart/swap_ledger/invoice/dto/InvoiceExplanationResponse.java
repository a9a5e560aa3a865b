package com.batterysmart.swap_ledger.invoice.dto;

import com.batterysmart.swap_ledger.invoice.InvoiceExplanation;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class InvoiceExplanationResponse {

    @JsonProperty("invoice")
    InvoiceResponse invoice;

    @JsonProperty("explanation")
    String explanation;

    @JsonProperty("breakdown")
    List<LineItem> breakdown;

    @Value
    public static class LineItem {
        @JsonProperty("item")
        String item;

        @JsonProperty("amount")
        BigDecimal amount;
    }

    public static InvoiceExplanationResponse from(InvoiceExplanation explanation) {
        return new InvoiceExplanationResponse(
            InvoiceResponse.from(explanation.getInvoice()),
            explanation.getExplanation(),
            explanation.getBreakdown().stream()
                .map(line -> new LineItem(line.getItem(), line.getAmount()))
                .toList()
        );
    }
}
