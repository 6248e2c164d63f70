package com.tribe.matching.dto;

public record TribeAssignment(String userId, String tribeId, double score) {
}
