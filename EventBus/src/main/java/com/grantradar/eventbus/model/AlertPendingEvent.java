package com.grantradar.eventbus.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * An alert ready to be delivered. Published to alerts:pending.
 */
@Value
@Builder
@Jacksonized
public class AlertPendingEvent implements DomainEvent {

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
    UUID alertId;

    @NotNull
    UUID matchId;

    @NotNull
    AlertChannel channel;

    @Email
    String userEmail;

    String userPhone;

    UUID userId;

    String alertTitle;

    String alertBody;
}
