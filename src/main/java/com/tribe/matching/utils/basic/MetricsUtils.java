package com.tribe.matching.utils.basic;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.experimental.UtilityClass;

@UtilityClass
public final class MetricsUtils {

    public static void recordScore(MeterRegistry meterRegistry, String target, double score) {
        DistributionSummary.builder("compatibility_score_distribution")
                .tag(Constant.TARGET, target)
                .minimumExpectedValue(0.0)
                .maximumExpectedValue(100.0)
                .register(meterRegistry)
                .record(score);
    }

    public static void countItems(MeterRegistry meterRegistry, String name, String mode, String outcome, int amount) {
        if (amount <= 0) {
            return;
        }
        meterRegistry.counter(name, Constant.MODE, mode, Constant.OUTCOME, outcome).increment(amount);
    }
}
