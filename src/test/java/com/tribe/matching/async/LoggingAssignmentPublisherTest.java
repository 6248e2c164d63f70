package com.tribe.matching.async;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tribe.matching.dto.events.ExistingTribeAssignmentEvent;
import com.tribe.matching.dto.events.MatchingEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("LoggingAssignmentPublisher Tests")
class LoggingAssignmentPublisherTest {
    private final MatchingEvent event = new ExistingTribeAssignmentEvent("run-1", "u1", "t1", 88.5, LocalDateTime.now());

    @Test
    @DisplayName("Should count published events by kind")
    void testPublish() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

        new LoggingAssignmentPublisher(objectMapper, registry).publish(event);

        assertEquals(1.0, registry.counter("matching_events_published", "kind", event.kind()).count());
    }

    @Test
    @DisplayName("Should count serialization failures instead of throwing")
    void testSerializationFailure() throws JsonProcessingException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = mock(ObjectMapper.class);
        when(objectMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") {
        });

        assertDoesNotThrow(() -> new LoggingAssignmentPublisher(objectMapper, registry).publish(event));
        assertEquals(1.0, registry.counter("matching_event_publish_failures", "kind", event.kind()).count());
    }
}
