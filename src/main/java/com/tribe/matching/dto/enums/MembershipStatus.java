package com.tribe.matching.dto.enums;

public enum MembershipStatus {
    PENDING,
    ACTIVE,
    INACTIVE,
    // --- no longer holding a seat ---
    REMOVED,
    LEFT;

    public boolean occupiesSeat() {
        return this != REMOVED && this != LEFT;
    }
}
