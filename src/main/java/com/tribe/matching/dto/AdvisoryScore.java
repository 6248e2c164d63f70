package com.tribe.matching.dto;

public record AdvisoryScore(double score, String insights) {
}
