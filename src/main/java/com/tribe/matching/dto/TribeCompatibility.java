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
public class TribeCompatibility {
    private String userId;
    private String tribeId;
    private double score;
    @Builder.Default
    private List<CompatibilityDetail> details = new ArrayList<>();
    @Builder.Default
    private List<MemberScore> memberScores = new ArrayList<>();
    private CompatibilityRecords.GroupBalanceAnalysis balance;
    private LocalDateTime calculatedAt;
}
