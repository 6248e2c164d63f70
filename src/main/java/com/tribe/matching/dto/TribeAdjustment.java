package com.tribe.matching.dto;

public record TribeAdjustment(String userId, String fromTribeId, String toTribeId, String reason) {
}
