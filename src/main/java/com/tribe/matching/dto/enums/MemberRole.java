package com.tribe.matching.dto.enums;

public enum MemberRole {
    CREATOR,
    MEMBER
}
