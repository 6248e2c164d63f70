package com.tribe.matching.dto.enums;

public enum TargetType {
    USER,
    TRIBE
}
