package com.tribe.matching.matcher.strategies;

import com.tribe.matching.dto.InterestKey;
import com.tribe.matching.models.Profile;
import com.tribe.matching.utils.SimilarityUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Maximizes the mean pairwise Jaccard similarity of members' interests.
 */
@Component("interestCohesionSwapStrategy")
public class InterestCohesionSwapStrategy implements GroupSwapStrategy {
    private static final double EPSILON = 1e-9;

    @Override
    public double groupScore(List<Profile> group) {
        if (group.size() <= 1) {
            return 1.0;
        }
        List<Set<InterestKey>> keys = group.stream()
                .map(member -> SimilarityUtils.interestKeys(member.getInterests()))
                .toList();
        double total = 0;
        int comparisons = 0;
        for (int i = 0; i < keys.size(); i++) {
            for (int j = i + 1; j < keys.size(); j++) {
                total += SimilarityUtils.jaccard(keys.get(i), keys.get(j));
                comparisons++;
            }
        }
        return total / comparisons;
    }

    @Override
    public boolean improves(double before, double after) {
        return after > before + EPSILON;
    }

    @Override
    public boolean supports(String mode) {
        return "InterestCohesion".equalsIgnoreCase(mode);
    }
}
