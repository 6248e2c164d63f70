package com.tribe.matching.dto.enums;

public enum InterestCategory {
    OUTDOOR_ADVENTURES,
    ARTS_CULTURE,
    FOOD_DINING,
    SPORTS_FITNESS,
    GAMES_ENTERTAINMENT,
    LEARNING_EDUCATION,
    TECHNOLOGY,
    WELLNESS_MINDFULNESS
}
