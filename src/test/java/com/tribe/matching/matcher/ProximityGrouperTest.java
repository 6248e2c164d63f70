package com.tribe.matching.matcher;

import com.tribe.matching.models.Profile;
import com.tribe.matching.utils.GeoUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tribe.matching.TestFixtures.hiker;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProximityGrouper Tests")
class ProximityGrouperTest {
    // One degree of longitude on the equator is about 69.09 miles.
    private static final double FIFTEEN_MILES = 15 / 69.093;

    private final ProximityGrouper grouper = new ProximityGrouper();
    private final Profile west = hiker("west", 0, 0);
    private final Profile middle = hiker("middle", 0, FIFTEEN_MILES);
    private final Profile east = hiker("east", 0, 2 * FIFTEEN_MILES);

    @Test
    @DisplayName("Every group member is within the distance of every other member")
    void testPairwiseDistance() {
        List<List<Profile>> groups = grouper.group(List.of(west, middle, east), 20);

        for (List<Profile> group : groups) {
            for (Profile a : group) {
                for (Profile b : group) {
                    assertTrue(GeoUtils.distanceMiles(a.getCoordinates(), b.getCoordinates()) <= 20);
                }
            }
        }
        assertEquals(3, groups.stream().mapToInt(List::size).sum());
    }

    @Test
    @DisplayName("First-fit grouping depends on input order")
    void testOrderSensitivity() {
        // When
        List<List<Profile>> westFirst = grouper.group(List.of(west, middle, east), 20);
        List<List<Profile>> eastFirst = grouper.group(List.of(east, middle, west), 20);

        // Then
        assertEquals(List.of(List.of(west, middle), List.of(east)), westFirst);
        assertEquals(List.of(List.of(east, middle), List.of(west)), eastFirst);
    }

    @Test
    @DisplayName("Users without coordinates end up alone")
    void testMissingCoordinates() {
        Profile nowhere = hiker("nowhere", 0, 0);
        nowhere.setCoordinates(null);

        List<List<Profile>> groups = grouper.group(List.of(west, nowhere), 20);

        assertEquals(2, groups.size());
    }
}
