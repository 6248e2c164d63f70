package com.tribe.matching.dto;

import com.tribe.matching.dto.enums.CompatibilityFactor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Non-negative weight per compatibility factor. Instances are immutable; every factory
 * repairs its input so that missing factors fall back to their default and negative or
 * non-finite weights count as zero.
 */
public final class FactorWeights {
    private static final Map<CompatibilityFactor, Double> DEFAULTS;

    static {
        EnumMap<CompatibilityFactor, Double> defaults = new EnumMap<>(CompatibilityFactor.class);
        defaults.put(CompatibilityFactor.PERSONALITY, 0.30);
        defaults.put(CompatibilityFactor.INTERESTS, 0.25);
        defaults.put(CompatibilityFactor.COMMUNICATION_STYLE, 0.20);
        defaults.put(CompatibilityFactor.LOCATION, 0.15);
        defaults.put(CompatibilityFactor.GROUP_BALANCE, 0.10);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final EnumMap<CompatibilityFactor, Double> weights;

    private FactorWeights(EnumMap<CompatibilityFactor, Double> weights) {
        this.weights = weights;
    }

    public static FactorWeights defaults() {
        return new FactorWeights(new EnumMap<>(DEFAULTS));
    }

    public static FactorWeights of(Map<CompatibilityFactor, Double> raw) {
        EnumMap<CompatibilityFactor, Double> repaired = new EnumMap<>(CompatibilityFactor.class);
        for (CompatibilityFactor factor : CompatibilityFactor.values()) {
            Double value = raw == null ? null : raw.get(factor);
            if (value == null) {
                repaired.put(factor, DEFAULTS.get(factor));
            } else if (!Double.isFinite(value) || value < 0) {
                repaired.put(factor, 0.0);
            } else {
                repaired.put(factor, value);
            }
        }
        return new FactorWeights(repaired);
    }

    public double get(CompatibilityFactor factor) {
        return weights.getOrDefault(factor, 0.0);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Scales the weights so they sum to 1.0. A set summing to zero falls back to the
     * default distribution.
     */
    public FactorWeights normalized() {
        return restrictTo(EnumSet.allOf(CompatibilityFactor.class));
    }

    /**
     * Keeps only the given factors and renormalizes them to sum to 1.0. Factors outside
     * the set get weight zero.
     */
    public FactorWeights restrictTo(Set<CompatibilityFactor> factors) {
        double total = factors.stream().mapToDouble(this::get).sum();
        Map<CompatibilityFactor, Double> source = weights;
        if (total <= 0) {
            source = DEFAULTS;
            total = factors.stream().mapToDouble(DEFAULTS::get).sum();
        }
        EnumMap<CompatibilityFactor, Double> result = new EnumMap<>(CompatibilityFactor.class);
        for (CompatibilityFactor factor : CompatibilityFactor.values()) {
            result.put(factor, factors.contains(factor) ? source.get(factor) / total : 0.0);
        }
        return new FactorWeights(result);
    }

    public Map<CompatibilityFactor, Double> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return weights.equals(((FactorWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "FactorWeights" + weights;
    }
}
