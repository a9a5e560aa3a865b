package com.batterysmart.swap_ledger.driver.dto;

import com.batterysmart.swap_ledger.driver.Driver;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DriverResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("preferred_language")
    String preferredLanguage;

    @JsonProperty("city")
    String city;

    @JsonProperty("vehicle_number")
    String vehicleNumber;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static DriverResponse from(Driver driver) {
        return DriverResponse.builder()
            .id(driver.getId())
            .phoneNumber(driver.getPhoneNumber())
            .name(driver.getName())
            .email(driver.getEmail())
            .preferredLanguage(driver.getPreferredLanguage().getCode())
            .city(driver.getCity())
            .vehicleNumber(driver.getVehicleNumber())
            .active(driver.isActive())
            .createdAt(driver.getCreatedAt())
            .build();
    }
}
