package com.tribe.matching.async;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tribe.matching.dto.events.MatchingEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default publisher: writes each event as JSON to the log. Mark a broker-backed
 * implementation {@code @Primary} to deliver events downstream.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingAssignmentPublisher implements AssignmentPublisher {
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Override
    public void publish(MatchingEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            log.info("Matching event kind={}, runId={}: {}", event.kind(), event.runId(), payload);
            meterRegistry.counter("matching_events_published", "kind", event.kind()).increment();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize matching event kind={}, runId={}: {}", event.kind(), event.runId(), e.getMessage());
            meterRegistry.counter("matching_event_publish_failures", "kind", event.kind()).increment();
        }
    }
}
