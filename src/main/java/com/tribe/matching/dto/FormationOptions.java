package com.tribe.matching.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call tuning for tribe formation. Out-of-range values are repaired by
 * {@link #sanitized()} rather than rejected.
 */
@Slf4j
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FormationOptions {
    public static final int MIN_GROUP_SIZE = 4;
    public static final int MAX_GROUP_SIZE = 8;
    public static final double DEFAULT_MAX_DISTANCE_MILES = 25.0;
    public static final double DEFAULT_THRESHOLD = 0.70;
    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;

    @Builder.Default
    private int minGroupSize = MIN_GROUP_SIZE;
    @Builder.Default
    private int maxGroupSize = MAX_GROUP_SIZE;
    @Builder.Default
    private double maxDistance = DEFAULT_MAX_DISTANCE_MILES;
    @Builder.Default
    private double compatibilityThreshold = DEFAULT_THRESHOLD;
    @Builder.Default
    private FactorWeights weights = FactorWeights.defaults();
    @Builder.Default
    private boolean preferExistingTribes = true;
    @Builder.Default
    private boolean includeDetails = false;
    @Builder.Default
    private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;

    public static FormationOptions defaults() {
        return FormationOptions.builder().build();
    }

    /**
     * Returns a repaired copy: group bounds clamped into [4, 8] with min never above max,
     * threshold forced into [0, 1], non-positive distance and batch size reset to their defaults.
     */
    public FormationOptions sanitized() {
        List<String> repairs = new ArrayList<>();
        int min = minGroupSize;
        int max = maxGroupSize;
        if (min < MIN_GROUP_SIZE) {
            repairs.add("minGroupSize " + min + " -> " + MIN_GROUP_SIZE);
            min = MIN_GROUP_SIZE;
        }
        if (max > MAX_GROUP_SIZE) {
            repairs.add("maxGroupSize " + max + " -> " + MAX_GROUP_SIZE);
            max = MAX_GROUP_SIZE;
        }
        if (min > max) {
            repairs.add("minGroupSize " + min + " -> " + max);
            min = max;
        }
        double threshold = compatibilityThreshold;
        if (!Double.isFinite(threshold) || threshold < 0 || threshold > 1) {
            repairs.add("compatibilityThreshold " + threshold + " -> " + DEFAULT_THRESHOLD);
            threshold = DEFAULT_THRESHOLD;
        }
        double distance = maxDistance;
        if (!Double.isFinite(distance) || distance <= 0) {
            repairs.add("maxDistance " + distance + " -> " + DEFAULT_MAX_DISTANCE_MILES);
            distance = DEFAULT_MAX_DISTANCE_MILES;
        }
        int batch = maxBatchSize;
        if (batch <= 0) {
            repairs.add("maxBatchSize " + batch + " -> " + DEFAULT_MAX_BATCH_SIZE);
            batch = DEFAULT_MAX_BATCH_SIZE;
        }
        FactorWeights repairedWeights = weights == null ? FactorWeights.defaults() : FactorWeights.of(weights.asMap());
        if (repairedWeights.sum() <= 0) {
            repairs.add("factorWeights sum to zero -> defaults");
            repairedWeights = FactorWeights.defaults();
        }

        if (!repairs.isEmpty()) {
            log.warn("Repaired formation options: {}", repairs);
        }
        return toBuilder()
                .minGroupSize(min)
                .maxGroupSize(max)
                .compatibilityThreshold(threshold)
                .maxDistance(distance)
                .maxBatchSize(batch)
                .weights(repairedWeights)
                .build();
    }
}
