package com.tribe.matching.utils;

import com.tribe.matching.dto.InterestKey;
import com.tribe.matching.dto.enums.InterestCategory;
import com.tribe.matching.models.Interest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SimilarityUtils Tests")
class SimilarityUtilsTest {

    @Test
    @DisplayName("Jaccard handles empty sets and partial overlap")
    void testJaccard() {
        assertEquals(1.0, SimilarityUtils.jaccard(Set.of(), Set.of()));
        assertEquals(0.0, SimilarityUtils.jaccard(Set.of("a"), Set.of()));
        assertEquals(1.0, SimilarityUtils.jaccard(Set.of("a", "b"), Set.of("b", "a")));
        assertEquals(0.5, SimilarityUtils.jaccard(Set.of("a", "b", "c"), Set.of("a", "b", "d")), 1e-9);
    }

    @Test
    @DisplayName("Interest keys match on category and exact name")
    void testInterestKeys() {
        // Given
        List<Interest> interests = List.of(
                new Interest(InterestCategory.OUTDOOR_ADVENTURES, "hiking", 3),
                new Interest(InterestCategory.OUTDOOR_ADVENTURES, "hiking", 1),
                new Interest(InterestCategory.OUTDOOR_ADVENTURES, "Hiking", 2),
                new Interest(InterestCategory.TECHNOLOGY, "hiking", 2));

        // When
        Set<InterestKey> keys = SimilarityUtils.interestKeys(interests);

        // Then
        assertEquals(3, keys.size(), "Another category or another spelling is a different interest");
        assertTrue(keys.contains(new InterestKey(InterestCategory.OUTDOOR_ADVENTURES, "hiking")));
        assertTrue(keys.contains(new InterestKey(InterestCategory.OUTDOOR_ADVENTURES, "Hiking")));
        assertNotEquals(new InterestKey(InterestCategory.OUTDOOR_ADVENTURES, "hiking"),
                new InterestKey(InterestCategory.OUTDOOR_ADVENTURES, " hiking "));
    }
}
