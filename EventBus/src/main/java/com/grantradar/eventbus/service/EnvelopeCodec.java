package com.grantradar.eventbus.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.grantradar.eventbus.dto.StreamEnvelope;
import com.grantradar.eventbus.exception.EventSerializationException;
import com.grantradar.eventbus.model.DomainEvent;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts domain events to and from stream envelopes.
 *
 * Every failure surfaces as {@link EventSerializationException}.
 */
@Component
@Slf4j
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Clock clock;

    public EnvelopeCodec(ObjectMapper objectMapper, Validator validator, Clock clock) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.clock = clock;
    }

    public StreamEnvelope serialize(DomainEvent event) {
        if (event == null) {
            throw new EventSerializationException("Cannot serialize a null event");
        }
        validate(event);
        try {
            String payload = objectMapper.writeValueAsString(event);
            return new StreamEnvelope(payload, event.getClass().getSimpleName(), Instant.now(clock));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize " + event.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses the payload of a stream record as the given event type.
     * Record fields other than the payload are ignored.
     */
    public <T extends DomainEvent> T deserialize(Map<String, String> fields, Class<T> type) {
        return deserialize(StreamEnvelope.fromFields(fields), type);
    }

    public <T extends DomainEvent> T deserialize(StreamEnvelope envelope, Class<T> type) {
        T event;
        try {
            event = objectMapper.readValue(envelope.getPayload(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException(
                    "Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (event == null) {
            throw new EventSerializationException("Payload for " + type.getSimpleName() + " is null");
        }
        validate(event);
        return event;
    }

    /**
     * The payload as a JSON tree, or as a JSON string when it is not valid JSON.
     */
    public JsonNode payloadTree(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Payload is not JSON, keeping it as text: {}", e.getOriginalMessage());
            return TextNode.valueOf(payload);
        }
    }

    private void validate(DomainEvent event) {
        Set<ConstraintViolation<DomainEvent>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new EventSerializationException(
                    "Invalid " + event.getClass().getSimpleName() + ": " + details);
        }
    }
}
