package com.batterysmart.swap_ledger.station.dto;

import com.batterysmart.swap_ledger.station.DskCenter;
import com.batterysmart.swap_ledger.station.GeoIndex;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DskCenterResponse {

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

    @JsonProperty("phone")
    String phone;

    @JsonProperty("operating_hours")
    String operatingHours;

    @JsonProperty("services")
    List<String> services;

    @JsonProperty("distance_km")
    BigDecimal distanceKm;

    public static DskCenterResponse from(DskCenter center) {
        return base(center).build();
    }

    public static DskCenterResponse from(GeoIndex.Ranked<DskCenter> ranked) {
        return base(ranked.getItem())
            .distanceKm(ranked.getDisplayDistanceKm())
            .build();
    }

    private static DskCenterResponseBuilder base(DskCenter center) {
        return DskCenterResponse.builder()
            .code(center.getCode())
            .name(center.getName())
            .address(center.getAddress())
            .landmark(center.getLandmark())
            .city(center.getCity())
            .pincode(center.getPincode())
            .latitude(center.getLatitude())
            .longitude(center.getLongitude())
            .phone(center.getPhone())
            .operatingHours(center.getOperatingHours())
            .services(center.getServices());
    }
}
