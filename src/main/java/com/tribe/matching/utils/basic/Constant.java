package com.tribe.matching.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String MODE = "mode";
    public static final String TARGET = "target";
    public static final String OUTCOME = "outcome";

    public static final int MAX_OPTIMIZATION_ROUNDS = 5;
    public static final double ADVISORY_ALGORITHMIC_WEIGHT = 0.7;
    public static final double ADVISORY_WEIGHT = 0.3;
    public static final double MEMBER_PERSONALITY_WEIGHT = 0.7;
    public static final double MEMBER_COMMUNICATION_WEIGHT = 0.3;
    public static final double BALANCE_SCALE_FACTOR = 50.0;
    public static final int DEFAULT_RESULT_LIMIT = 10;
    public static final double DEFAULT_SCORE_THRESHOLD = 70.0;
    public static final String NEW_TRIBE_PREFIX = "new_tribe_";
}
