package com.batterysmart.swap_ledger.driver;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered driver. Drivers are deactivated, never deleted.
 */
@Value
public class Driver {
    UUID id;
    String phoneNumber;
    String name;
    String email;
    Language preferredLanguage;
    String city;
    String vehicleNumber;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public Driver withLanguage(Language language, Instant now) {
        return new Driver(id, phoneNumber, name, email, language, city, vehicleNumber, active, createdAt, now);
    }

    public Driver deactivate(Instant now) {
        return new Driver(id, phoneNumber, name, email, preferredLanguage, city, vehicleNumber, false, createdAt, now);
    }
}
