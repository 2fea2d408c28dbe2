package com.grantradar.eventbus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grantradar.eventbus.config.JacksonConfig;
import com.grantradar.eventbus.model.AlertChannel;
import com.grantradar.eventbus.model.AlertPendingEvent;
import com.grantradar.eventbus.model.GrantDiscoveredEvent;
import com.grantradar.eventbus.model.GrantValidatedEvent;
import com.grantradar.eventbus.model.MatchComputedEvent;
import com.grantradar.eventbus.model.PriorityLevel;
import com.grantradar.eventbus.service.EnvelopeCodec;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Sample events and a codec wired the way the application wires it.
 */
public final class EventFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final UUID GRANT_ID = UUID.fromString("6f1c1d2e-8a44-4c6b-9a57-1b2f0c3d4e5f");

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private EventFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return JacksonConfig.createObjectMapper();
    }

    public static Validator validator() {
        return VALIDATOR;
    }

    public static EnvelopeCodec codec() {
        return codec(FIXED_CLOCK);
    }

    public static EnvelopeCodec codec(Clock clock) {
        return new EnvelopeCodec(objectMapper(), VALIDATOR, clock);
    }

    public static GrantDiscoveredEvent grantDiscovered() {
        return GrantDiscoveredEvent.builder()
                .grantId(GRANT_ID)
                .source("grants.gov")
                .title("Community Health Research Initiative")
                .url("https://www.grants.gov/search-results-detail/350123")
                .timestamp(NOW)
                .fundingAgency("NIH")
                .estimatedAmount(250000.0)
                .build();
    }

    public static GrantValidatedEvent grantValidated() {
        return GrantValidatedEvent.builder()
                .grantId(GRANT_ID)
                .qualityScore(0.87)
                .category("health")
                .category("research")
                .embeddingGenerated(true)
                .keywords(List.of("public health", "epidemiology"))
                .timestamp(NOW)
                .build();
    }

    public static MatchComputedEvent matchComputed() {
        return MatchComputedEvent.builder()
                .matchId(UUID.fromString("0b7e2b8c-3f7a-4d0e-9f6e-2b3c4d5e6f70"))
                .grantId(GRANT_ID)
                .userId(UUID.fromString("9a8b7c6d-5e4f-4a3b-8c2d-1e0f9a8b7c6d"))
                .matchScore(0.92)
                .priorityLevel(PriorityLevel.HIGH)
                .matchingCriteria(List.of("research area", "career stage"))
                .explanation("Strong overlap with stated research focus")
                .timestamp(NOW)
                .build();
    }

    public static AlertPendingEvent alertPending() {
        return AlertPendingEvent.builder()
                .alertId(UUID.fromString("1d2c3b4a-5f6e-4d7c-8b9a-0f1e2d3c4b5a"))
                .matchId(UUID.fromString("0b7e2b8c-3f7a-4d0e-9f6e-2b3c4d5e6f70"))
                .channel(AlertChannel.EMAIL)
                .userEmail("researcher@example.edu")
                .alertTitle("New high-priority grant match")
                .timestamp(NOW)
                .build();
    }
}
