package com.batterysmart.swap_ledger.station;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DskDefinition {
    String code;
    String name;
    String address;
    String landmark;
    double latitude;
    double longitude;
    String city;
    String pincode;
    String phone;
    @Builder.Default
    String operatingHours = "09:00-18:00";
    @Singular
    List<String> services;
    @Builder.Default
    boolean active = true;
}
