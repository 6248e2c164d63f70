package com.tribe.matching.service;

import com.tribe.matching.TestFixtures;
import com.tribe.matching.client.AdvisoryClient;
import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.FormationResult;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.dto.TribeAssignment;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.tribe.matching.TestFixtures.hiker;
import static com.tribe.matching.TestFixtures.painter;
import static com.tribe.matching.TestFixtures.tribe;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("TribeFormationServiceImpl Tests")
class TribeFormationServiceImplTest {
    private static final double LAT = 40.7128;
    private static final double LON = -74.0060;

    private TestFixtures.Engine engine;
    private TribeFormationServiceImpl service;

    @BeforeEach
    void setUp() {
        engine = new TestFixtures.Engine(mock(AdvisoryClient.class), 500);
        service = engine.tribeFormationService;
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    @DisplayName("A full tribe accepts nobody even for a perfect match")
    void testFullTribeRejectsAssignments() {
        // Given
        Tribe full = tribe("full", LAT, LON, 4, List.of("m1", "m2", "m3", "m4"));
        Map<String, List<Profile>> members = Map.of("full", List.of(hiker("m1", LAT, LON), hiker("m2", LAT, LON),
                hiker("m3", LAT, LON), hiker("m4", LAT, LON)));
        List<Profile> users = List.of(hiker("u1", LAT, LON), hiker("u2", LAT, LON));

        // When
        FormationResult result = service.formTribes(users, List.of(full), members, FormationOptions.defaults());

        // Then
        assertTrue(result.getExistingAssignments().isEmpty());
        assertEquals(2, result.getMetrics().placedInNewTribes());
    }

    @Test
    @DisplayName("Open seats cap the number of assignments to a tribe")
    void testCapacityRespected() {
        // Given
        Tribe almostFull = tribe("t1", LAT, LON, 4, List.of("m1", "m2", "m3"));
        Map<String, List<Profile>> members = Map.of("t1", List.of(hiker("m1", LAT, LON), hiker("m2", LAT, LON),
                hiker("m3", LAT, LON)));
        List<Profile> users = List.of(hiker("u1", LAT, LON), hiker("u2", LAT, LON), hiker("u3", LAT, LON));

        // When
        FormationResult result = service.formTribes(users, List.of(almostFull), members, FormationOptions.defaults());

        // Then
        assertEquals(1, result.getExistingAssignments().size());
        TribeAssignment assignment = result.getExistingAssignments().values().iterator().next();
        assertEquals("t1", assignment.tribeId());
        assertTrue(assignment.score() >= 70);
        assertEquals(2, result.getMetrics().placedInNewTribes());
    }

    @Test
    @DisplayName("Scores below the threshold leave users for new tribes")
    void testThresholdGatesAssignments() {
        Tribe hikers = tribe("t1", LAT, LON, 8, List.of("m1", "m2"));
        Map<String, List<Profile>> members = Map.of("t1", List.of(hiker("m1", LAT, LON), hiker("m2", LAT, LON)));
        Profile farPainter = painter("p1", 34.0522, -118.2437);

        FormationResult result = service.formTribes(List.of(farPainter), List.of(hikers), members, FormationOptions.defaults());

        assertTrue(result.getExistingAssignments().isEmpty());
        assertEquals(1, result.getNewTribes().size());
        assertTrue(result.getNewTribes().get(0).undersized());
    }

    @Test
    @DisplayName("Existing tribes are skipped when not preferred")
    void testExistingTribesNotPreferred() {
        Tribe open = tribe("t1", LAT, LON, 8, List.of("m1"));
        FormationOptions options = FormationOptions.builder().preferExistingTribes(false).build();

        FormationResult result = service.formTribes(List.of(hiker("u1", LAT, LON)), List.of(open),
                Map.of("t1", List.of(hiker("m1", LAT, LON))), options);

        assertTrue(result.getExistingAssignments().isEmpty());
    }

    @Test
    @DisplayName("Every user lands exactly once and duplicates are ignored")
    void testEveryUserPlacedOnce() {
        // Given
        Tribe hikers = tribe("hikers", LAT, LON, 5, List.of("m1", "m2", "m3"));
        Map<String, List<Profile>> members = Map.of("hikers", List.of(hiker("m1", LAT, LON), hiker("m2", LAT, LON),
                hiker("m3", LAT, LON)));
        List<Profile> users = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            users.add(i % 2 == 0 ? hiker("u" + i, LAT, LON + i * 0.001) : painter("u" + i, LAT, LON + i * 0.001));
        }
        users.add(hiker("u0", LAT, LON));

        // When
        FormationResult result = service.formTribes(users, List.of(hikers), members, FormationOptions.defaults());

        // Then
        Set<String> placed = new HashSet<>(result.getExistingAssignments().keySet());
        for (NewTribe tribe : result.getNewTribes()) {
            for (String id : tribe.memberIds()) {
                assertTrue(placed.add(id), "User placed twice: " + id);
            }
        }
        assertEquals(9, placed.size());
        assertEquals(9, result.getMetrics().totalUsers());
        assertTrue(result.getExistingAssignments().size() <= 2, "Tribe had only two open seats");
        assertFalse(result.getAdvice().available());
    }

    @Test
    @DisplayName("Users always keep their best tribe when swapping cannot help")
    void testSwapNeverLowersScores() {
        // Given
        Tribe hikers = tribe("hikers", LAT, LON, 8, List.of("h1", "h2"));
        Tribe painters = tribe("painters", LAT, LON, 8, List.of("p1", "p2"));
        Map<String, List<Profile>> members = Map.of(
                "hikers", List.of(hiker("h1", LAT, LON), hiker("h2", LAT, LON)),
                "painters", List.of(painter("p1", LAT, LON), painter("p2", LAT, LON)));
        List<Profile> users = List.of(painter("newPainter", LAT, LON), hiker("newHiker", LAT, LON));

        // When
        FormationResult result = service.formTribes(users, List.of(hikers, painters), members, FormationOptions.defaults());

        // Then
        assertEquals("hikers", result.getExistingAssignments().get("newHiker").tribeId());
        assertEquals("painters", result.getExistingAssignments().get("newPainter").tribeId());
        assertEquals(0, result.getMetrics().swapsApplied());
    }

    @Test
    @DisplayName("New tribes leave at most one undersized remainder per region")
    void testSingleRemainderPerRegion() {
        // Given: twelve neighbours and one user on the other coast, no open tribes
        List<Profile> users = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            users.add(hiker("h" + i, LAT, LON));
        }
        for (int i = 0; i < 3; i++) {
            users.add(painter("p" + i, LAT, LON));
        }
        users.add(painter("far", 34.0522, -118.2437));

        // When
        FormationResult result = service.formTribes(users, List.of(), Map.of(), FormationOptions.defaults());

        // Then
        List<NewTribe> undersized = result.getNewTribes().stream().filter(NewTribe::undersized).toList();
        assertEquals(1, undersized.size());
        assertEquals(List.of("far"), undersized.get(0).memberIds());
        assertEquals(1, result.getMetrics().undersizedTribes());
        assertEquals(13, result.getMetrics().placedInNewTribes());
    }
}
