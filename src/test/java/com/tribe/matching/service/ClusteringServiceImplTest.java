package com.tribe.matching.service;

import com.tribe.matching.TestFixtures;
import com.tribe.matching.client.AdvisoryClient;
import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.models.Profile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.tribe.matching.TestFixtures.hiker;
import static com.tribe.matching.TestFixtures.painter;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("ClusteringServiceImpl Tests")
class ClusteringServiceImplTest {
    private TestFixtures.Engine engine;
    private ClusteringServiceImpl service;

    @BeforeEach
    void setUp() {
        engine = new TestFixtures.Engine(mock(AdvisoryClient.class), 500);
        service = engine.clusteringService;
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    @DisplayName("Users from distant cities never share a group and nobody is lost")
    void testDistantClustersStaySeparate() {
        // Given: ten users around New York and ten around Los Angeles, more than 2000 miles apart
        List<Profile> users = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            double offset = i * 0.002;
            users.add(i % 3 == 0 ? painter("ny" + i, 40.7128 + offset, -74.0060) : hiker("ny" + i, 40.7128 + offset, -74.0060));
            users.add(i % 3 == 0 ? painter("la" + i, 34.0522 + offset, -118.2437) : hiker("la" + i, 34.0522 + offset, -118.2437));
        }
        FormationOptions options = FormationOptions.builder().maxDistance(50).build();

        // When
        List<NewTribe> tribes = service.formGroups(users, options);

        // Then
        Set<String> placed = new HashSet<>();
        for (NewTribe tribe : tribes) {
            List<String> ids = tribe.memberIds();
            String city = ids.get(0).substring(0, 2);
            assertTrue(ids.stream().allMatch(id -> id.startsWith(city)), "Group mixes cities: " + ids);
            assertTrue(tribe.size() <= 8, "Group too large: " + ids);
            assertEquals(tribe.size() < 4, tribe.undersized(), "Undersized flag mismatch for " + ids);
            for (String id : ids) {
                assertTrue(placed.add(id), "User placed twice: " + id);
            }
        }
        assertEquals(users.stream().map(Profile::getId).collect(Collectors.toSet()), placed);
    }

    @Test
    @DisplayName("Same input in the same order produces the same groups")
    void testDeterministic() {
        List<Profile> users = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            users.add(i % 2 == 0 ? hiker("u" + i, 40.7128, -74.0060 + i * 0.001) : painter("u" + i, 40.7128, -74.0060 + i * 0.001));
        }

        List<NewTribe> first = service.formGroups(users, FormationOptions.defaults());
        List<NewTribe> second = service.formGroups(users, FormationOptions.defaults());

        assertEquals(first.stream().map(NewTribe::memberIds).toList(), second.stream().map(NewTribe::memberIds).toList());
    }

    @Test
    @DisplayName("A lone user is returned as an undersized group with score zero")
    void testSingleUser() {
        List<NewTribe> tribes = service.formGroups(List.of(hiker("solo", 40.7128, -74.0060)), FormationOptions.defaults());

        assertEquals(1, tribes.size());
        assertTrue(tribes.get(0).undersized());
        assertEquals(0.0, tribes.get(0).members().get(0).score());
        assertTrue(service.formGroups(List.of(), FormationOptions.defaults()).isEmpty());
    }

    @Test
    @DisplayName("Like-minded neighbours form a full-size group with a high average score")
    void testCompatibleNeighbours() {
        List<Profile> users = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            users.add(hiker("h" + i, 40.7128, -74.0060));
        }

        List<NewTribe> tribes = service.formGroups(users, FormationOptions.defaults());

        assertEquals(1, tribes.size());
        assertEquals(6, tribes.get(0).size());
        assertFalse(tribes.get(0).undersized());
        assertTrue(tribes.get(0).averageCompatibility() >= 70);
    }

    @Test
    @DisplayName("Leftovers of one region are combined by size instead of staying as several small groups")
    void testLeftoversCombinedWithinRegion() {
        // Given: nine hikers and three painters at the same spot
        List<Profile> users = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            users.add(hiker("h" + i, 40.7128, -74.0060));
        }
        for (int i = 0; i < 3; i++) {
            users.add(painter("p" + i, 40.7128, -74.0060));
        }

        // When
        List<NewTribe> tribes = service.formGroups(users, FormationOptions.defaults());

        // Then
        assertTrue(tribes.stream().noneMatch(NewTribe::undersized), "Undersized groups left: "
                + tribes.stream().map(NewTribe::memberIds).toList());
        assertTrue(tribes.stream().allMatch(t -> t.size() >= 4 && t.size() <= 8));
        assertEquals(12, tribes.stream().mapToInt(NewTribe::size).sum());
    }
}
