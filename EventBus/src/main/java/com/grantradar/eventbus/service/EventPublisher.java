package com.grantradar.eventbus.service;

import com.grantradar.eventbus.config.EventBusProperties;
import com.grantradar.eventbus.dto.DeliveryAttempt;
import com.grantradar.eventbus.model.AlertPendingEvent;
import com.grantradar.eventbus.model.DeadLetterEvent;
import com.grantradar.eventbus.model.DomainEvent;
import com.grantradar.eventbus.model.GrantDiscoveredEvent;
import com.grantradar.eventbus.model.GrantValidatedEvent;
import com.grantradar.eventbus.model.MatchComputedEvent;
import com.grantradar.eventbus.topology.StreamNames;
import com.grantradar.eventbus.util.RedisErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisStreamCommands.XAddOptions;
import org.springframework.data.redis.connection.stream.ByteRecord;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends envelopes to streams with approximate MAXLEN trimming.
 *
 * Transient connection failures are retried with exponential backoff;
 * serialization errors and broker command errors are not.
 */
@Service
@Slf4j
public class EventPublisher {

    private final StreamConnectionManager connectionManager;
    private final EnvelopeCodec codec;
    private final EventBusProperties properties;

    public EventPublisher(StreamConnectionManager connectionManager,
                          EnvelopeCodec codec,
                          EventBusProperties properties) {
        this.connectionManager = connectionManager;
        this.codec = codec;
        this.properties = properties;
    }

    public String publish(String stream, DomainEvent event) {
        return publish(stream, event, properties.getDefaultMaxLength());
    }

    /**
     * @param maxLength approximate cap on the stream length, zero or less for none
     * @return the broker-assigned message id
     */
    public String publish(String stream, DomainEvent event, long maxLength) {
        Map<String, String> fields = codec.serialize(event).toFields();
        String messageId = appendWithRetry(stream, fields, maxLength);
        log.info(" -- Published {} to stream={}, messageId={}, eventId={}",
                event.getClass().getSimpleName(), stream, messageId, event.getEventId());
        return messageId;
    }

    /**
     * Appends a requeued attempt as a new entry on the given stream.
     */
    public String republish(String stream, DeliveryAttempt attempt) {
        String messageId = appendWithRetry(stream, attempt.toFields(), properties.getDefaultMaxLength());
        log.info(" -- Requeued {} to stream={}, messageId={}, retryCount={}",
                attempt.getEnvelope().getEventType(), stream, messageId, attempt.getRetryCount());
        return messageId;
    }

    public String publishGrantDiscovered(GrantDiscoveredEvent event) {
        return publish(StreamNames.GRANTS_DISCOVERED, event);
    }

    public String publishGrantValidated(GrantValidatedEvent event) {
        return publish(StreamNames.GRANTS_VALIDATED, event);
    }

    public String publishMatchComputed(MatchComputedEvent event) {
        return publish(StreamNames.MATCHES_COMPUTED, event);
    }

    public String publishAlertPending(AlertPendingEvent event) {
        return publish(StreamNames.ALERTS_PENDING, event);
    }

    /**
     * Publishes to the dead-letter stream paired with {@code originalStream}.
     */
    public String publishDeadLetter(String originalStream, DeadLetterEvent event) {
        return publish(StreamNames.dlqFor(originalStream), event);
    }

    private String appendWithRetry(String stream, Map<String, String> fields, long maxLength) {
        EventBusProperties.PublishProps publish = properties.getPublish();
        int maxAttempts = publish.getAttempts();
        int attempts = 0;

        while (true) {
            try {
                return append(stream, fields, maxLength);
            } catch (DataAccessException e) {
                attempts++;
                if (!RedisErrors.isTransient(e) || attempts >= maxAttempts) {
                    log.error("Failed to publish to stream={} after {} attempt(s): {}",
                            stream, attempts, e.getMessage());
                    throw e;
                }
                Duration delay = backoff(attempts, publish.getInitialBackoff(), publish.getMaxBackoff());
                log.warn("Publish attempt {} to stream={} failed: {}. Retrying in {} ms",
                        attempts, stream, e.getMessage(), delay.toMillis());
                if (!sleep(delay.toMillis())) {
                    log.warn("Publish to stream={} interrupted after {} attempt(s)", stream, attempts);
                    throw e;
                }
            }
        }
    }

    private String append(String stream, Map<String, String> fields, long maxLength) {
        RedisSerializer<String> serializer = RedisSerializer.string();

        Map<byte[], byte[]> raw = new LinkedHashMap<>();
        fields.forEach((k, v) -> raw.put(serializer.serialize(k), serializer.serialize(v)));

        ByteRecord record = StreamRecords.rawBytes(raw).withStreamKey(serializer.serialize(stream));
        XAddOptions options = maxLength > 0
                ? XAddOptions.maxlen(maxLength).approximateTrimming(true)
                : XAddOptions.none();

        RecordId id = connectionManager.template().execute(
                (RedisCallback<RecordId>) connection -> connection.streamCommands().xAdd(record, options));
        if (id == null) {
            throw new IllegalStateException("XADD returned no id for stream " + stream);
        }
        return id.getValue();
    }

    /**
     * initial * 2^(attempt-1), capped at max.
     */
    static Duration backoff(int attempt, Duration initial, Duration max) {
        long millis = initial.toMillis() << Math.min(attempt - 1, 30);
        return millis > max.toMillis() || millis < 0 ? max : Duration.ofMillis(millis);
    }

    /**
     * @return false when interrupted, with the interrupt flag restored
     */
    private boolean sleep(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
