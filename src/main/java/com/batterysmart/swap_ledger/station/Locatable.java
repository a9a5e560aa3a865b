package com.batterysmart.swap_ledger.station;

/**
 * Anything {@link GeoIndex} can rank by distance.
 */
public interface Locatable {

    String getCode();

    double getLatitude();

    double getLongitude();
}
