package com.tribe.matching.async;

import com.tribe.matching.dto.events.MatchingEvent;

/**
 * Hands matching results to whatever materializes memberships and notifications.
 */
public interface AssignmentPublisher {
    void publish(MatchingEvent event);
}
