package com.tribe.matching.models;

import com.tribe.matching.dto.enums.MemberRole;
import com.tribe.matching.dto.enums.MembershipStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TribeMembership {
    private String userId;
    @Builder.Default
    private MemberRole role = MemberRole.MEMBER;
    @Builder.Default
    private MembershipStatus status = MembershipStatus.ACTIVE;
}
