package com.batterysmart.swap_ledger.station.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class UpsertDskRequest {

    @NotBlank(message = "Center name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("address")
    String address;

    @JsonProperty("landmark")
    String landmark;

    @NotNull
    @DecimalMin("-90")
    @DecimalMax("90")
    @JsonProperty("latitude")
    Double latitude;

    @NotNull
    @DecimalMin("-180")
    @DecimalMax("180")
    @JsonProperty("longitude")
    Double longitude;

    @NotBlank(message = "City is required")
    @JsonProperty("city")
    String city;

    @JsonProperty("pincode")
    String pincode;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("operating_hours")
    String operatingHours;

    @JsonProperty("services")
    List<String> services;

    @JsonProperty("active")
    Boolean active;
}
