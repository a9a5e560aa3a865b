package com.batterysmart.swap_ledger.swap;

import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One physical battery exchange. Charge levels are kept exactly as
 * reported, for audit.
 */
@Value
public class SwapEvent {
    UUID id;
    UUID driverId;
    UUID stationId;
    UUID subscriptionId;
    String oldBatteryId;
    String newBatteryId;
    int oldChargeLevel;
    int newChargeLevel;
    Instant swapTime;
    boolean subscriptionSwap;
    BigDecimal chargeAmount;
    SwapStatus status;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    static SwapEvent completed(UUID driverId, UUID stationId, UUID subscriptionId, RecordSwapCommand command,
                               boolean covered, BigDecimal chargeAmount, Instant now) {
        return new SwapEvent(
            UUID.randomUUID(),
            driverId,
            stationId,
            subscriptionId,
            command.getOldBatteryId().trim(),
            command.getNewBatteryId().trim(),
            command.getOldChargePct(),
            command.getNewChargePct(),
            now,
            covered,
            chargeAmount,
            SwapStatus.COMPLETED,
            null,
            now,
            now
        );
    }

    public SwapEvent markFailed(String reason, Instant now) {
        return transitionTo(SwapStatus.FAILED, reason, now);
    }

    public SwapEvent refund(Instant now) {
        return transitionTo(SwapStatus.REFUNDED, failureReason, now);
    }

    private SwapEvent transitionTo(SwapStatus target, String reason, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalTransitionException("swap " + id, status, target);
        }
        return new SwapEvent(id, driverId, stationId, subscriptionId, oldBatteryId, newBatteryId,
            oldChargeLevel, newChargeLevel, swapTime, subscriptionSwap, chargeAmount,
            target, reason, createdAt, now);
    }
}
