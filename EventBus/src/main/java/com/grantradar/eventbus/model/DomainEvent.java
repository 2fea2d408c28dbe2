package com.grantradar.eventbus.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable event handed from one stage to the next.
 * Consumers dedupe on {@link #getEventId()}.
 */
public interface DomainEvent {

    String DEFAULT_VERSION = "1.0";

    UUID getEventId();

    Instant getTimestamp();

    /** Schema version, for backward compatible payload changes. */
    String getVersion();
}
