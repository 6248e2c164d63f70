package com.tribe.matching.dto;

import com.tribe.matching.dto.enums.PersonalityTrait;

import java.util.List;
import java.util.Map;

/**
 * Per-factor results of the compatibility calculator. All scores are on a 0-100 scale
 * unless stated otherwise.
 */
public interface CompatibilityRecords {

    record PersonalityCompatibility(
            Map<PersonalityTrait, Double> traitScores,
            double overall,
            List<PersonalityTrait> complementary,
            List<PersonalityTrait> conflicting
    ) {
    }

    record InterestCompatibility(
            List<InterestKey> shared,
            double overall,
            boolean primaryMatch
    ) {
    }

    record CommunicationCompatibility(
            boolean match,
            double overall,
            boolean complementary
    ) {
    }

    record LocationCompatibility(
            double distanceMiles,
            boolean withinRange,
            double overall
    ) {
    }

    /**
     * Balance values are population standard deviations across the five trait means,
     * lower meaning more even. {@code impact} is positive when the candidate evens the group out.
     */
    record GroupBalanceAnalysis(
            Map<PersonalityTrait, Double> currentMeans,
            Map<PersonalityTrait, Double> projectedMeans,
            double currentBalance,
            double projectedBalance,
            double impact,
            boolean improves
    ) {
        public double factorScore() {
            return Math.max(0, Math.min(100, (impact + 100) / 2));
        }
    }
}
