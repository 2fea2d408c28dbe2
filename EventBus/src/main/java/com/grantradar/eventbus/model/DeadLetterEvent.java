package com.grantradar.eventbus.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * An entry that exhausted its retries, published to dlq:&lt;original_stream&gt;.
 * Never retried automatically.
 */
@Value
@Builder
@Jacksonized
public class DeadLetterEvent implements DomainEvent {

    @NotNull
    @Builder.Default
    UUID eventId = UUID.randomUUID();

    @NotNull
    @Builder.Default
    Instant timestamp = Instant.now();

    @NotBlank
    @Builder.Default
    String version = DEFAULT_VERSION;

    @NotBlank
    String originalStream;

    @NotBlank
    String originalMessageId;

    @NotNull
    JsonNode originalPayload;

    String errorMessage;

    @NotBlank
    String errorType;

    @Min(1)
    int failureCount;

    @NotNull
    Instant firstFailureAt;

    @NotNull
    @Builder.Default
    Instant lastFailureAt = Instant.now();
}
