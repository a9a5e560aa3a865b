package com.batterysmart.swap_ledger.station;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Dealer Service Kiosk: where drivers activate accounts, collect batteries
 * and raise service issues.
 */
@Value
public class DskCenter implements Locatable {
    UUID id;
    String code;
    String name;
    String address;
    String landmark;
    double latitude;
    double longitude;
    String city;
    String pincode;
    String phone;
    String operatingHours;
    List<String> services;
    boolean active;

    public boolean offers(String service) {
        return services.contains(service);
    }
}
