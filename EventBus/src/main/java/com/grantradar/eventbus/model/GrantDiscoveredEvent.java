package com.grantradar.eventbus.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A new grant found by a scraper. Published to grants:discovered.
 */
@Value
@Builder
@Jacksonized
public class GrantDiscoveredEvent implements DomainEvent {

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
    UUID grantId;

    /** e.g. "grants.gov", "nih_reporter". */
    @NotBlank
    String source;

    @NotBlank
    String title;

    @NotBlank
    String url;

    Instant discoveredAt;

    String fundingAgency;

    /** USD. */
    @PositiveOrZero
    Double estimatedAmount;

    Instant deadline;

    /** Source record kept for debugging. */
    Map<String, Object> rawData;
}
