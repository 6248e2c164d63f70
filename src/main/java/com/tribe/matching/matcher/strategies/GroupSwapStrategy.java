package com.tribe.matching.matcher.strategies;

import com.tribe.matching.models.Profile;

import java.util.List;

/**
 * Objective for member swaps between two groups.
 */
public interface GroupSwapStrategy {
    double groupScore(List<Profile> group);

    /**
     * True when moving from {@code before} to {@code after} is a strict improvement.
     */
    boolean improves(double before, double after);

    boolean supports(String mode);
}
