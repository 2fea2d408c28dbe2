package com.grantradar.eventbus.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A grant that passed quality validation. Published to grants:validated.
 */
@Value
@Builder
@Jacksonized
public class GrantValidatedEvent implements DomainEvent {

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

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double qualityScore;

    @Singular
    List<String> categories;

    boolean embeddingGenerated;

    Map<String, Object> validationDetails;

    List<String> eligibilityCriteria;

    List<String> keywords;
}
