package com.tribe.matching.dto.events;

import com.tribe.matching.dto.MemberScore;

import java.time.LocalDateTime;
import java.util.List;

public record NewTribeFormedEvent(
        String runId,
        String provisionalTribeId,
        List<MemberScore> members,
        double averageCompatibility,
        boolean undersized,
        LocalDateTime occurredAt
) implements MatchingEvent {

    @Override
    public String kind() {
        return "new_tribe_formed";
    }
}
