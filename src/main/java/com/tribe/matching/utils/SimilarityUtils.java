package com.tribe.matching.utils;

import com.tribe.matching.dto.InterestKey;
import com.tribe.matching.models.Interest;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

@UtilityClass
public final class SimilarityUtils {

    /**
     * Jaccard coefficient. Two empty sets are fully similar; an empty set against a
     * non-empty one scores 0.
     */
    public static <T> double jaccard(Set<T> a, Set<T> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<T> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<T> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    public static Set<InterestKey> interestKeys(Collection<Interest> interests) {
        Set<InterestKey> keys = new LinkedHashSet<>();
        if (interests != null) {
            interests.forEach(i -> keys.add(i.key()));
        }
        return keys;
    }
}
