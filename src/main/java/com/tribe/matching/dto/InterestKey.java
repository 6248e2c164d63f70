package com.tribe.matching.dto;

import com.tribe.matching.dto.enums.InterestCategory;

/**
 * Identity of an interest for similarity purposes: category plus the exact name.
 */
public record InterestKey(InterestCategory category, String name) {
}
