package com.tribe.matching.dto;

public record FormationMetrics(
        int totalUsers,
        int assignedToExisting,
        int placedInNewTribes,
        int newTribes,
        int undersizedTribes,
        int swapsApplied,
        double averageScore
) {
}
