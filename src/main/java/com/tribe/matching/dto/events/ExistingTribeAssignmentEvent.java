package com.tribe.matching.dto.events;

import java.time.LocalDateTime;

public record ExistingTribeAssignmentEvent(
        String runId,
        String userId,
        String tribeId,
        double score,
        LocalDateTime occurredAt
) implements MatchingEvent {

    @Override
    public String kind() {
        return "existing_tribe_assignment";
    }
}
