package com.tribe.matching.dto;

import java.util.List;

public record FormationAdvice(String insights, List<TribeAdjustment> adjustments, boolean available) {

    public static FormationAdvice unavailable() {
        return new FormationAdvice("Unable to generate insights at this time.", List.of(), false);
    }
}
