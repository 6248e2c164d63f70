package com.tribe.matching.dto;

public record MemberScore(String userId, double score) {
}
