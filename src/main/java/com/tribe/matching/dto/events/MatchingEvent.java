package com.tribe.matching.dto.events;

import java.time.LocalDateTime;

/**
 * Notification emitted for a matching run. Each known kind has its own typed variant;
 * anything else travels as {@link OpaqueMatchingEvent}.
 */
public interface MatchingEvent {
    String runId();

    LocalDateTime occurredAt();

    String kind();
}
