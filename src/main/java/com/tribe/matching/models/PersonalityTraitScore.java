package com.tribe.matching.models;

import com.tribe.matching.dto.enums.PersonalityTrait;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Assessed intensity of one trait on a 0-100 scale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonalityTraitScore {
    private PersonalityTrait trait;
    private double score;
}
