package com.tribe.matching.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormationResult {
    @Builder.Default
    private Map<String, TribeAssignment> existingAssignments = new LinkedHashMap<>();
    @Builder.Default
    private List<NewTribe> newTribes = new ArrayList<>();
    private FormationAdvice advice;
    private FormationMetrics metrics;
}
