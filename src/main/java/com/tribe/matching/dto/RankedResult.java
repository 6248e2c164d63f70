package com.tribe.matching.dto;

import com.tribe.matching.dto.enums.ItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked list of candidates plus the outcome of every requested candidate id, so that a
 * missing id never fails the whole request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedResult {
    private String userId;
    @Builder.Default
    private List<RankedMatch> matches = new ArrayList<>();
    @Builder.Default
    private Map<String, ItemStatus> itemStatuses = new LinkedHashMap<>();
}
