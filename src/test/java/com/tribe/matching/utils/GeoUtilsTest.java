package com.tribe.matching.utils;

import com.tribe.matching.models.Coordinates;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeoUtils Tests")
class GeoUtilsTest {
    private static final Coordinates NEW_YORK = Coordinates.of(40.7128, -74.0060);
    private static final Coordinates LOS_ANGELES = Coordinates.of(34.0522, -118.2437);
    private static final Coordinates CHICAGO = Coordinates.of(41.8781, -87.6298);

    @Test
    @DisplayName("Should return zero for identical points")
    void testIdenticalPoints() {
        assertEquals(0.0, GeoUtils.distanceKm(NEW_YORK, Coordinates.of(40.7128, -74.0060)), 1e-9);
        assertEquals(0.0, GeoUtils.distanceMiles(CHICAGO, CHICAGO), 1e-9);
    }

    @Test
    @DisplayName("Should be symmetric and match the known New York to Los Angeles distance")
    void testSymmetryAndKnownDistance() {
        // When
        double there = GeoUtils.distanceKm(NEW_YORK, LOS_ANGELES);
        double back = GeoUtils.distanceKm(LOS_ANGELES, NEW_YORK);

        // Then
        assertEquals(there, back, 1e-9);
        assertEquals(3936, there, 20, "Great-circle distance should be close to 3936 km");
        assertEquals(there * 0.621371, GeoUtils.distanceMiles(NEW_YORK, LOS_ANGELES), 1e-6);
    }

    @Test
    @DisplayName("Should respect the triangle inequality")
    void testTriangleInequality() {
        double direct = GeoUtils.distanceKm(NEW_YORK, LOS_ANGELES);
        double viaChicago = GeoUtils.distanceKm(NEW_YORK, CHICAGO) + GeoUtils.distanceKm(CHICAGO, LOS_ANGELES);

        assertTrue(direct <= viaChicago + 1e-9);
    }

    @Test
    @DisplayName("Should treat missing coordinates as out of range")
    void testWithinMiles() {
        assertTrue(GeoUtils.withinMiles(NEW_YORK, NEW_YORK, 0));
        assertFalse(GeoUtils.withinMiles(NEW_YORK, CHICAGO, 25));
        assertFalse(GeoUtils.withinMiles(null, CHICAGO, 25));
        assertFalse(GeoUtils.withinMiles(NEW_YORK, null, 25));
    }
}
