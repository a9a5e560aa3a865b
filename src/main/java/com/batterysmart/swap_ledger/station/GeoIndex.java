package com.batterysmart.swap_ledger.station;

import com.batterysmart.swap_ledger.exception.InvalidInputException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Great-circle ranking of stations and service kiosks.
 *
 * Stateless: the same origin and candidates always give the same order.
 * Equal distances are ordered by code.
 */
public final class GeoIndex {

    static final double EARTH_RADIUS_KM = 6371.0;

    private GeoIndex() {
    }

    @Value
    public static class Ranked<T extends Locatable> {
        T item;
        double distanceKm;

        /** Distance rounded to two decimals for display. */
        public BigDecimal getDisplayDistanceKm() {
            return roundKm(distanceKm);
        }
    }

    /**
     * Haversine distance in kilometres.
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static <T extends Locatable> List<Ranked<T>> nearest(double latitude, double longitude,
                                                               Collection<T> candidates, int limit) {
        validateCoordinates(latitude, longitude);
        if (limit <= 0) {
            throw new InvalidInputException("limit", "Limit must be at least 1");
        }

        return candidates.stream()
                .map(candidate -> new Ranked<>(candidate, distanceKm(
                        latitude, longitude, candidate.getLatitude(), candidate.getLongitude())))
                .sorted(Comparator.<Ranked<T>>comparingDouble(Ranked::getDistanceKm)
                        .thenComparing(ranked -> ranked.getItem().getCode()))
                .limit(limit)
                .toList();
    }

    public static BigDecimal roundKm(double distanceKm) {
        return BigDecimal.valueOf(distanceKm).setScale(2, RoundingMode.HALF_UP);
    }

    public static void validateCoordinates(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidInputException("latitude", "Latitude must be between -90 and 90");
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidInputException("longitude", "Longitude must be between -180 and 180");
        }
    }
}
