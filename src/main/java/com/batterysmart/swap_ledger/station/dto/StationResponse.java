package com.batterysmart.swap_ledger.station.dto;

import com.batterysmart.swap_ledger.station.GeoIndex;
import com.batterysmart.swap_ledger.station.Station;
import com.batterysmart.swap_ledger.station.StationInventory;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StationResponse {

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("address")
    String address;

    @JsonProperty("landmark")
    String landmark;

    @JsonProperty("city")
    String city;

    @JsonProperty("pincode")
    String pincode;

    @JsonProperty("latitude")
    double latitude;

    @JsonProperty("longitude")
    double longitude;

    @JsonProperty("operating_hours")
    String operatingHours;

    @JsonProperty("contact_phone")
    String contactPhone;

    @JsonProperty("is_dsk")
    boolean dsk;

    @JsonProperty("directions_url")
    String directionsUrl;

    @JsonProperty("available_batteries")
    int availableBatteries;

    @JsonProperty("charging_batteries")
    int chargingBatteries;

    @JsonProperty("total_slots")
    int totalSlots;

    @JsonProperty("availability")
    String availability;

    @JsonProperty("inventory_updated_at")
    Instant inventoryUpdatedAt;

    @JsonProperty("distance_km")
    BigDecimal distanceKm;

    public static StationResponse from(Station station) {
        return base(station).build();
    }

    public static StationResponse from(GeoIndex.Ranked<Station> ranked) {
        return base(ranked.getItem())
            .distanceKm(ranked.getDisplayDistanceKm())
            .build();
    }

    private static StationResponseBuilder base(Station station) {
        StationInventory inventory = station.getInventory();
        return StationResponse.builder()
            .code(station.getCode())
            .name(station.getName())
            .address(station.getAddress())
            .landmark(station.getLandmark())
            .city(station.getCity())
            .pincode(station.getPincode())
            .latitude(station.getLatitude())
            .longitude(station.getLongitude())
            .operatingHours(station.getOperatingHours())
            .contactPhone(station.getContactPhone())
            .dsk(station.isDsk())
            .directionsUrl(station.getDirectionsUrl())
            .availableBatteries(inventory.getAvailableBatteries())
            .chargingBatteries(inventory.getChargingBatteries())
            .totalSlots(inventory.getTotalSlots())
            .availability(inventory.getAvailability().name())
            .inventoryUpdatedAt(inventory.getLastUpdated());
    }
}
