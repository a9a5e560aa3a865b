package com.batterysmart.swap_ledger.station.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class UpsertStationRequest {

    @NotBlank(message = "Station name is required")
    @Size(max = 200)
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

    @JsonProperty("operating_hours")
    String operatingHours;

    @JsonProperty("contact_phone")
    String contactPhone;

    @JsonProperty("is_dsk")
    Boolean dsk;

    @JsonProperty("google_map_url")
    String googleMapUrl;

    @JsonProperty("active")
    Boolean active;
}
