package com.tribe.matching.dto.enums;

public enum CommunicationStyle {
    DIRECT,
    THOUGHTFUL,
    EXPRESSIVE,
    SUPPORTIVE,
    ANALYTICAL
}
