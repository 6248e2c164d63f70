package com.tribe.matching.dto;

import com.tribe.matching.dto.enums.TargetType;

import java.util.List;

public record RankedMatch(
        String targetId,
        TargetType targetType,
        double score,
        List<CompatibilityDetail> details
) {
}
