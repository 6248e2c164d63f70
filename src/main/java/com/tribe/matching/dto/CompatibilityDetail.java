package com.tribe.matching.dto;

import com.tribe.matching.dto.enums.CompatibilityFactor;

public record CompatibilityDetail(
        CompatibilityFactor factor,
        double score,
        double weight,
        String description
) {
}
