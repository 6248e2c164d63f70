package com.tribe.matching.matcher;

import com.tribe.matching.models.Profile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.ToDoubleBiFunction;

/**
 * Memoized symmetric pair scores (0-100) for one clustering run. Scores are computed on
 * first use; {@link #prefill} computes a whole group up front on an executor.
 */
@Slf4j
public class PairwiseCompatibilityMatrix {
    private final ToDoubleBiFunction<Profile, Profile> scorer;
    private final Map<Pair<String, String>, Double> scores = new ConcurrentHashMap<>();

    public PairwiseCompatibilityMatrix(ToDoubleBiFunction<Profile, Profile> scorer) {
        this.scorer = scorer;
    }

    public double score(Profile a, Profile b) {
        boolean ordered = a.getId().compareTo(b.getId()) <= 0;
        Profile first = ordered ? a : b;
        Profile second = ordered ? b : a;
        return scores.computeIfAbsent(key(first, second), k -> scorer.applyAsDouble(first, second));
    }

    /**
     * True when the pair clears {@code threshold} on a 0-1 scale.
     */
    public boolean compatible(Profile a, Profile b, double threshold) {
        return score(a, b) / 100.0 >= threshold;
    }

    public boolean compatibleWithAll(Profile candidate, List<Profile> group, double threshold) {
        for (Profile member : group) {
            if (!compatible(candidate, member, threshold)) {
                return false;
            }
        }
        return true;
    }

    public boolean allCompatible(List<Profile> a, List<Profile> b, double threshold) {
        for (Profile member : a) {
            if (!compatibleWithAll(member, b, threshold)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Mean score of {@code member} against every other member of {@code group}; 0 when alone.
     */
    public double meanScoreWithin(Profile member, List<Profile> group) {
        double sum = 0;
        int count = 0;
        for (Profile other : group) {
            if (other.getId().equals(member.getId())) {
                continue;
            }
            sum += score(member, other);
            count++;
        }
        return count == 0 ? 0.0 : sum / count;
    }

    public void prefill(List<Profile> group, ExecutorService executor) {
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < group.size(); i++) {
            for (int j = i + 1; j < group.size(); j++) {
                Profile a = group.get(i);
                Profile b = group.get(j);
                if (!scores.containsKey(key(a, b))) {
                    futures.add(CompletableFuture.runAsync(() -> score(a, b), executor));
                }
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        log.debug("Prefilled {} pair scores for group of size={}", futures.size(), group.size());
    }

    public int size() {
        return scores.size();
    }

    private static Pair<String, String> key(Profile a, Profile b) {
        String idA = a.getId();
        String idB = b.getId();
        return idA.compareTo(idB) <= 0 ? Pair.of(idA, idB) : Pair.of(idB, idA);
    }
}
