package com.tribe.matching.utils;

import com.tribe.matching.models.Coordinates;
import lombok.experimental.UtilityClass;

@UtilityClass
public final class GeoUtils {
    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double KM_TO_MILES = 0.621371;

    /**
     * Great-circle distance in kilometres using the haversine formula. Inputs are degrees.
     */
    public static double distanceKm(Coordinates a, Coordinates b) {
        if (a.getLatitude() == b.getLatitude() && a.getLongitude() == b.getLongitude()) {
            return 0.0;
        }
        double dLat = Math.toRadians(b.getLatitude() - a.getLatitude());
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceMiles(Coordinates a, Coordinates b) {
        return distanceKm(a, b) * KM_TO_MILES;
    }

    /**
     * Missing coordinates never count as near.
     */
    public static boolean withinMiles(Coordinates a, Coordinates b, double maxMiles) {
        if (a == null || b == null) {
            return false;
        }
        return distanceMiles(a, b) <= maxMiles;
    }
}
