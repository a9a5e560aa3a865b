package com.batterysmart.swap_ledger.station;

import lombok.Value;

import java.util.Locale;
import java.util.UUID;

@Value
public class Station implements Locatable {

    private static final String DIRECTIONS_URL = "https://www.google.com/maps/dir/?api=1&destination=%s,%s";

    UUID id;
    String code;
    String name;
    String address;
    String landmark;
    double latitude;
    double longitude;
    String city;
    String pincode;
    String operatingHours;
    String contactPhone;
    boolean dsk;
    String googleMapUrl;
    boolean active;
    StationInventory inventory;

    /**
     * The stored map link, or a directions link built from the coordinates.
     */
    public String getDirectionsUrl() {
        if (googleMapUrl != null && !googleMapUrl.isBlank()) {
            return googleMapUrl;
        }
        return String.format(Locale.ROOT, DIRECTIONS_URL, latitude, longitude);
    }
}
