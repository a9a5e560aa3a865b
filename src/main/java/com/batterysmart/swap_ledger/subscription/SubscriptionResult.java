package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.invoice.Invoice;
import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import lombok.Value;

@Value
public class SubscriptionResult {
    DriverSubscription subscription;
    SubscriptionPlan plan;
    Invoice invoice;
}
