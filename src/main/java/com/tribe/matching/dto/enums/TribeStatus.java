package com.tribe.matching.dto.enums;

public enum TribeStatus {
    FORMING,
    ACTIVE,
    AT_RISK,
    INACTIVE,
    DISSOLVED
}
