package com.tribe.matching.repo;

import com.tribe.matching.dto.enums.MembershipStatus;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;
import com.tribe.matching.models.TribeMembership;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tribe.matching.TestFixtures.hiker;
import static com.tribe.matching.TestFixtures.tribe;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryProfileStore Tests")
class InMemoryProfileStoreTest {

    @Test
    @DisplayName("Only tribes with open seats in the region are offered, in insertion order")
    void testTribesWithCapacity() {
        // Given
        InMemoryProfileStore store = new InMemoryProfileStore();
        store.saveTribe(tribe("b", 0, 0, 4, List.of("u1")));
        store.saveTribe(tribe("full", 0, 0, 1, List.of("u1")));
        Tribe elsewhere = tribe("c", 0, 0, 4, List.of());
        elsewhere.setRegion("north");
        store.saveTribe(elsewhere);
        store.saveTribe(tribe("a", 0, 0, 4, List.of()));

        // When / Then
        assertEquals(List.of("b", "a"), store.loadTribesWithCapacity("test").stream().map(Tribe::getId).toList());
        assertEquals(List.of("b", "c", "a"), store.loadTribesWithCapacity(null).stream().map(Tribe::getId).toList());
    }

    @Test
    @DisplayName("Member profiles cover seated members with a stored profile")
    void testMemberProfiles() {
        InMemoryProfileStore store = new InMemoryProfileStore();
        store.saveProfiles(List.of(hiker("u1", 0, 0), hiker("u2", 0, 0)));
        Tribe tribe = tribe("t", 0, 0, 4, List.of("u1", "ghost"));
        tribe.getMembers().add(TribeMembership.builder().userId("u2").status(MembershipStatus.LEFT).build());
        store.saveTribe(tribe);

        List<Profile> members = store.loadMemberProfiles("t");

        assertEquals(List.of("u1"), members.stream().map(Profile::getId).toList());
        assertTrue(store.loadMemberProfiles("unknown").isEmpty());
        assertTrue(store.loadProfile(null).isEmpty());
    }
}
