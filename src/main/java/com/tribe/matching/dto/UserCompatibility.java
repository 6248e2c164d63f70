package com.tribe.matching.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCompatibility {
    private String userId;
    private String targetUserId;
    private double score;
    private double algorithmicScore;
    private Double advisoryScore;
    private String insights;
    @Builder.Default
    private List<CompatibilityDetail> details = new ArrayList<>();
    private LocalDateTime calculatedAt;
}
