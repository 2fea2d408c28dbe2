package com.grantradar.eventbus.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A scored grant/user match. Published to matches:computed.
 */
@Value
@Builder
@Jacksonized
public class MatchComputedEvent implements DomainEvent {

    @NotNull
    @Builder.Default
    UUID eventId = UUID.randomUUID();

    @NotNull
    @Builder.Default
    Instant timestamp = Instant.now();

    @NotBlank
    @Builder.Default
    String version = DEFAULT_VERSION;

    @NotNull
    UUID matchId;

    @NotNull
    UUID grantId;

    @NotNull
    UUID userId;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double matchScore;

    @NotNull
    PriorityLevel priorityLevel;

    List<String> matchingCriteria;

    String explanation;

    Instant grantDeadline;
}
