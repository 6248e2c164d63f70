package com.tribe.matching.matcher;

import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.models.Profile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tribe.matching.TestFixtures.hiker;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PersonalityGroupRefiner Tests")
class PersonalityGroupRefinerTest {
    private final PersonalityGroupRefiner refiner = new PersonalityGroupRefiner();
    private final FormationOptions options = FormationOptions.defaults();

    // Users sharing an id prefix score 90 with each other and 10 with anyone else.
    private final PairwiseCompatibilityMatrix matrix = new PairwiseCompatibilityMatrix((a, b) ->
            a.getId().charAt(0) == b.getId().charAt(0) ? 90.0 : 10.0);

    @Test
    @DisplayName("Oversized groups split into mutually compatible subgroups")
    void testSplitOversizedGroup() {
        // Given
        List<Profile> interleaved = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            interleaved.add(hiker("a" + i, 40.0, -74.0));
            interleaved.add(hiker("b" + i, 40.0, -74.0));
        }

        // When
        List<List<Profile>> groups = refiner.refine(List.of(interleaved), matrix, options);

        // Then
        assertEquals(2, groups.size());
        for (List<Profile> group : groups) {
            assertEquals(5, group.size());
            char prefix = group.get(0).getId().charAt(0);
            assertTrue(group.stream().allMatch(p -> p.getId().charAt(0) == prefix), "Subgroup mixes prefixes: " + group);
        }
    }

    @Test
    @DisplayName("A region leaves at most one undersized group")
    void testSingleRemainderPerRegion() {
        // Given: six compatible users and three loners who match nobody
        List<Profile> region = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            region.add(hiker("a" + i, 40.0, -74.0));
        }
        region.add(hiker("b1", 40.0, -74.0));
        region.add(hiker("b2", 40.0, -74.0));
        region.add(hiker("c1", 40.0, -74.0));

        // When
        List<List<Profile>> groups = refiner.refine(List.of(region), matrix, options);

        // Then
        assertEquals(2, groups.size());
        assertEquals(8, groups.get(0).size(), "Leftovers fill the group that has room");
        assertEquals(List.of("c1"), groups.get(1).stream().map(Profile::getId).toList());
    }

    @Test
    @DisplayName("Leftovers that reach the minimum size are packed into one group")
    void testLeftoversPackedBySize() {
        // Given
        List<Profile> region = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            region.add(hiker("a" + i, 40.0, -74.0));
        }
        region.add(hiker("b1", 40.0, -74.0));
        region.add(hiker("b2", 40.0, -74.0));
        region.add(hiker("c1", 40.0, -74.0));
        region.add(hiker("c2", 40.0, -74.0));

        // When
        List<List<Profile>> groups = refiner.refine(List.of(region), matrix, options);

        // Then
        assertEquals(List.of(7, 4), groups.stream().map(List::size).toList());
        assertEquals(List.of("b1", "b2", "c1", "c2"), groups.get(1).stream().map(Profile::getId).toList());
    }

    @Test
    @DisplayName("Packing cuts the pool into in-range groups and keeps only what cannot fit")
    void testPackLeftovers() {
        List<List<Profile>> singles = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            singles.add(new ArrayList<>(List.of(hiker("s" + i, 40.0, -74.0))));
        }

        List<List<Profile>> evenSplit = refiner.packLeftovers(singles, 4, 8);
        List<List<Profile>> withRemainder = refiner.packLeftovers(singles, 6, 8);

        assertEquals(List.of(5, 4), evenSplit.stream().map(List::size).toList());
        assertEquals(List.of(8, 1), withRemainder.stream().map(List::size).toList());
    }

    @Test
    @DisplayName("Incompatible undersized groups are kept rather than dropped")
    void testUndersizedGroupsKept() {
        List<List<Profile>> groups = refiner.refine(List.of(
                List.of(hiker("a1", 40.0, -74.0), hiker("a2", 40.0, -74.0)),
                List.of(hiker("b1", 40.0, -74.0)),
                List.of(hiker("c1", 40.0, -74.0))), matrix, options);

        assertEquals(3, groups.size());
        assertEquals(4, groups.stream().mapToInt(List::size).sum());
    }

    @Test
    @DisplayName("Separate regions are never merged")
    void testNoMergeAcrossDistance() {
        List<List<Profile>> groups = refiner.refine(List.of(
                List.of(hiker("x1", 40.0, -74.0), hiker("x2", 40.0, -74.0)),
                List.of(hiker("x3", 34.0, -118.0), hiker("x4", 34.0, -118.0))), matrix, options);

        assertEquals(2, groups.size());
    }
}
