package com.tribe.matching.matcher;

import com.tribe.matching.matcher.strategies.InterestCohesionSwapStrategy;
import com.tribe.matching.models.Profile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tribe.matching.TestFixtures.hiker;
import static com.tribe.matching.TestFixtures.painter;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GroupSwapOptimizer Tests")
class GroupSwapOptimizerTest {
    private final GroupSwapOptimizer optimizer = new GroupSwapOptimizer();
    private final InterestCohesionSwapStrategy strategy = new InterestCohesionSwapStrategy();

    @Test
    @DisplayName("A single swap separates hikers from painters")
    void testSwapImprovesCohesion() {
        // Given
        List<Profile> first = List.of(hiker("h1", 40, -74), hiker("h2", 40, -74), hiker("h3", 40, -74),
                hiker("h4", 40, -74), painter("p5", 40, -74));
        List<Profile> second = List.of(painter("p1", 40, -74), painter("p2", 40, -74), painter("p3", 40, -74),
                painter("p4", 40, -74), hiker("h5", 40, -74));

        // When
        GroupSwapOptimizer.SwapOutcome outcome = optimizer.optimize(List.of(first, second), strategy, 4, 25);

        // Then
        assertEquals(1, outcome.swaps());
        assertTrue(outcome.groups().get(0).stream().allMatch(p -> p.getId().startsWith("h")));
        assertTrue(outcome.groups().get(1).stream().allMatch(p -> p.getId().startsWith("p")));
        assertEquals(1.0, strategy.groupScore(outcome.groups().get(0)), 1e-9);
    }

    @Test
    @DisplayName("Swaps that would break the distance limit are skipped")
    void testDistanceGuard() {
        List<Profile> first = List.of(hiker("h1", 40, -74), hiker("h2", 40, -74), hiker("h3", 40, -74),
                hiker("h4", 40, -74), painter("p5", 40, -74));
        List<Profile> second = List.of(painter("p1", 34, -118), painter("p2", 34, -118), painter("p3", 34, -118),
                painter("p4", 34, -118), hiker("h5", 34, -118));

        GroupSwapOptimizer.SwapOutcome outcome = optimizer.optimize(List.of(first, second), strategy, 4, 25);

        assertEquals(0, outcome.swaps());
        assertEquals(first, outcome.groups().get(0));
    }

    @Test
    @DisplayName("Groups at the minimum size do not take part")
    void testMinimumSizeGroupsUntouched() {
        List<Profile> first = List.of(hiker("h1", 40, -74), hiker("h2", 40, -74), hiker("h3", 40, -74),
                painter("p4", 40, -74));
        List<Profile> second = List.of(painter("p1", 40, -74), painter("p2", 40, -74), painter("p3", 40, -74),
                hiker("h4", 40, -74));

        GroupSwapOptimizer.SwapOutcome outcome = optimizer.optimize(List.of(first, second), strategy, 4, 25);

        assertEquals(0, outcome.swaps());
        assertEquals(1, outcome.rounds());
    }
}
