package com.tribe.matching.dto.enums;

public enum ItemStatus {
    OK,
    NOT_FOUND,
    REJECTED,
    FAILED
}
