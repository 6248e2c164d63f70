package com.tribe.matching.dto.events;

import com.tribe.matching.dto.TribeAdjustment;

import java.time.LocalDateTime;
import java.util.List;

public record AdvisorySuggestionEvent(
        String runId,
        String insights,
        List<TribeAdjustment> adjustments,
        LocalDateTime occurredAt
) implements MatchingEvent {

    @Override
    public String kind() {
        return "advisory_suggestion";
    }
}
