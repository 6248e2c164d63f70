package com.tribe.matching.dto.enums;

public enum CompatibilityFactor {
    PERSONALITY,
    INTERESTS,
    COMMUNICATION_STYLE,
    LOCATION,
    GROUP_BALANCE
}
