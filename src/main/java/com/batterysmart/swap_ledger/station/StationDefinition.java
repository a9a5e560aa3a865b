package com.batterysmart.swap_ledger.station;

import lombok.Builder;
import lombok.Value;

/**
 * Reference data for a station, upserted by code.
 */
@Value
@Builder
public class StationDefinition {
    String code;
    String name;
    String address;
    String landmark;
    double latitude;
    double longitude;
    String city;
    String pincode;
    @Builder.Default
    String operatingHours = "06:00-22:00";
    String contactPhone;
    boolean dsk;
    String googleMapUrl;
    @Builder.Default
    boolean active = true;
}
