package com.batterysmart.swap_ledger.swap.dto;

import com.batterysmart.swap_ledger.swap.SwapHistory;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class SwapHistoryResponse {

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("period")
    String period;

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("total_swaps")
    int totalSwaps;

    @JsonProperty("free_swaps")
    int freeSwaps;

    @JsonProperty("total_charged")
    BigDecimal totalCharged;

    @JsonProperty("swaps")
    List<Entry> swaps;

    @Value
    public static class Entry {
        @JsonProperty("swap_id")
        UUID swapId;

        @JsonProperty("swap_time")
        Instant swapTime;

        @JsonProperty("station_code")
        String stationCode;

        @JsonProperty("station_name")
        String stationName;

        @JsonProperty("old_battery_id")
        String oldBatteryId;

        @JsonProperty("new_battery_id")
        String newBatteryId;

        @JsonProperty("old_charge_level")
        int oldChargeLevel;

        @JsonProperty("new_charge_level")
        int newChargeLevel;

        @JsonProperty("subscription_swap")
        boolean subscriptionSwap;

        @JsonProperty("charge_amount")
        BigDecimal chargeAmount;

        @JsonProperty("status")
        String status;

        @JsonProperty("invoice_number")
        String invoiceNumber;
    }

    public static SwapHistoryResponse from(SwapHistory history) {
        return new SwapHistoryResponse(
            history.getDriverId(),
            history.getPeriod().name(),
            history.getFrom(),
            history.getTo(),
            history.getTotalSwaps(),
            history.getFreeSwaps(),
            history.getTotalCharged(),
            history.getSwaps().stream()
                .map(swap -> new Entry(
                    swap.getSwapId(),
                    swap.getSwapTime(),
                    swap.getStationCode(),
                    swap.getStationName(),
                    swap.getOldBatteryId(),
                    swap.getNewBatteryId(),
                    swap.getOldChargeLevel(),
                    swap.getNewChargeLevel(),
                    swap.isSubscriptionSwap(),
                    swap.getChargeAmount(),
                    swap.getStatus().name(),
                    swap.getInvoiceNumber()))
                .toList()
        );
    }
}
