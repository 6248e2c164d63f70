package com.tribe.matching.utils.basic;

import lombok.experimental.UtilityClass;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Identifiers and UTC timestamps stamped on formation runs and the events they publish.
 */
@UtilityClass
public class RunIdentifiers {
    private static final String RUN_PREFIX = "run-";

    public static String newRunId() {
        return RUN_PREFIX + UUID.randomUUID();
    }

    /**
     * Placeholder id for the n-th tribe formed in a run, counted from 1. The persistence
     * layer replaces it with a real id when the tribe is created.
     */
    public static String provisionalTribeId(int ordinal) {
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be positive: " + ordinal);
        }
        return Constant.NEW_TRIBE_PREFIX + ordinal;
    }

    public static LocalDateTime nowUtc() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
