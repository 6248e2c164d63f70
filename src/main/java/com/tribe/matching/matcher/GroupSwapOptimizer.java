package com.tribe.matching.matcher;

import com.tribe.matching.matcher.strategies.GroupSwapStrategy;
import com.tribe.matching.models.Profile;
import com.tribe.matching.utils.basic.Constant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded hill climbing over one-for-one member swaps. Each round applies the first swap
 * that strictly improves the summed objective of the two groups involved, then starts
 * over; the search stops after a round with no improving swap or after
 * {@link Constant#MAX_OPTIMIZATION_ROUNDS} rounds. Only groups larger than the minimum
 * size take part, and a swap is skipped when it would put either moved user beyond
 * {@code maxDistance} of their new group.
 */
@Slf4j
@Component
public class GroupSwapOptimizer {

    public SwapOutcome optimize(List<List<Profile>> groups, GroupSwapStrategy strategy,
                                int minGroupSize, double maxDistance) {
        List<List<Profile>> working = new ArrayList<>();
        groups.forEach(g -> working.add(new ArrayList<>(g)));
        List<Double> scores = new ArrayList<>();
        working.forEach(g -> scores.add(strategy.groupScore(g)));

        int swaps = 0;
        int rounds = 0;
        boolean improved = true;
        while (improved && rounds < Constant.MAX_OPTIMIZATION_ROUNDS) {
            improved = false;
            rounds++;
            outer:
            for (int i = 0; i < working.size(); i++) {
                for (int j = i + 1; j < working.size(); j++) {
                    List<Profile> first = working.get(i);
                    List<Profile> second = working.get(j);
                    if (first.size() <= minGroupSize || second.size() <= minGroupSize) {
                        continue;
                    }
                    for (int a = 0; a < first.size(); a++) {
                        for (int b = 0; b < second.size(); b++) {
                            List<Profile> newFirst = new ArrayList<>(first);
                            List<Profile> newSecond = new ArrayList<>(second);
                            newFirst.set(a, second.get(b));
                            newSecond.set(b, first.get(a));
                            if (!ProximityGrouper.withinDistanceOfAll(second.get(b), without(newFirst, a), maxDistance)
                                    || !ProximityGrouper.withinDistanceOfAll(first.get(a), without(newSecond, b), maxDistance)) {
                                continue;
                            }
                            double newScoreFirst = strategy.groupScore(newFirst);
                            double newScoreSecond = strategy.groupScore(newSecond);
                            if (strategy.improves(scores.get(i) + scores.get(j), newScoreFirst + newScoreSecond)) {
                                working.set(i, newFirst);
                                working.set(j, newSecond);
                                scores.set(i, newScoreFirst);
                                scores.set(j, newScoreSecond);
                                swaps++;
                                improved = true;
                                break outer;
                            }
                        }
                    }
                }
            }
        }

        log.debug("Swap optimization strategy={} finished: rounds={}, swaps={}",
                strategy.getClass().getSimpleName(), rounds, swaps);
        return new SwapOutcome(working, swaps, rounds);
    }

    private static List<Profile> without(List<Profile> group, int index) {
        List<Profile> copy = new ArrayList<>(group);
        copy.remove(index);
        return copy;
    }

    public record SwapOutcome(List<List<Profile>> groups, int swaps, int rounds) {
    }
}
