package com.batterysmart.swap_ledger.station;

import lombok.Value;

import java.time.Instant;

/**
 * Live battery counters of a station.
 */
@Value
public class StationInventory {

    public enum Availability {
        HIGH,
        MEDIUM,
        LOW
    }

    int availableBatteries;
    int chargingBatteries;
    int totalSlots;
    Instant lastUpdated;

    static StationInventory empty() {
        return new StationInventory(0, 0, 0, null);
    }

    /**
     * More than 10 ready batteries is HIGH, 5 to 10 MEDIUM, fewer LOW.
     */
    public Availability getAvailability() {
        if (availableBatteries > 10) {
            return Availability.HIGH;
        }
        return availableBatteries >= 5 ? Availability.MEDIUM : Availability.LOW;
    }

    /**
     * Share of slots not holding a ready battery, 0 when the station has no slots.
     */
    public double getOccupancyPercentage() {
        if (totalSlots <= 0) {
            return 0;
        }
        return (totalSlots - availableBatteries) * 100.0 / totalSlots;
    }
}
