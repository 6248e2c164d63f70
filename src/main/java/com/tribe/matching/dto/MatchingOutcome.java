package com.tribe.matching.dto;

import com.tribe.matching.dto.enums.ItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchingOutcome {
    private String runId;
    private FormationResult result;
    @Builder.Default
    private Map<String, ItemStatus> itemStatuses = new LinkedHashMap<>();
}
