package com.batterysmart.swap_ledger.penalty;

import com.batterysmart.swap_ledger.invoice.Invoice;
import lombok.Value;

@Value
public class PenaltySettlement {
    PenaltyRecord penalty;
    Invoice invoice;
}
