package com.tribe.matching.dto.enums;

public enum PersonalityTrait {
    OPENNESS,
    CONSCIENTIOUSNESS,
    EXTRAVERSION,
    AGREEABLENESS,
    NEUROTICISM
}
