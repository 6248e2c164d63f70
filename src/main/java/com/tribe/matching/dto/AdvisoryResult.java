package com.tribe.matching.dto;

/**
 * Raw text returned by the advisory service for one prompt.
 */
public record AdvisoryResult(String text, String model) {
}
