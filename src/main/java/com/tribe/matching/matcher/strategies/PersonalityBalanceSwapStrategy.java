package com.tribe.matching.matcher.strategies;

import com.tribe.matching.models.Profile;
import com.tribe.matching.processors.CompatibilityFactorCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Minimizes the variance of a group's per-trait mean scores.
 */
@Component("personalityBalanceSwapStrategy")
@RequiredArgsConstructor
public class PersonalityBalanceSwapStrategy implements GroupSwapStrategy {
    private static final double EPSILON = 1e-9;

    private final CompatibilityFactorCalculator calculator;

    @Override
    public double groupScore(List<Profile> group) {
        return calculator.traitDistributionVariance(group);
    }

    @Override
    public boolean improves(double before, double after) {
        return after < before - EPSILON;
    }

    @Override
    public boolean supports(String mode) {
        return "PersonalityBalance".equalsIgnoreCase(mode);
    }
}
