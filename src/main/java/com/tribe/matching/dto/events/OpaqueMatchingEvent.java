package com.tribe.matching.dto.events;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Catch-all for event kinds without a dedicated variant. The payload is flat string data.
 */
public record OpaqueMatchingEvent(
        String runId,
        String kind,
        Map<String, String> payload,
        LocalDateTime occurredAt
) implements MatchingEvent {
}
