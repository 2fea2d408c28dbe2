package com.grantradar.eventbus.service;

import com.grantradar.eventbus.config.EventBusProperties;
import com.grantradar.eventbus.dto.DeliveryAttempt;
import com.grantradar.eventbus.dto.ProcessingOutcome;
import com.grantradar.eventbus.exception.EventSerializationException;
import com.grantradar.eventbus.model.DeadLetterEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Runs a processor against one delivered entry and resolves the outcome.
 *
 * <ul>
 *   <li>success: the entry is acknowledged</li>
 *   <li>failure below the retry ceiling: the envelope is appended again with its
 *       retry count incremented, then the original entry is acknowledged</li>
 *   <li>failure at the ceiling: a DeadLetterEvent goes to the paired DLQ stream,
 *       then the original entry is acknowledged</li>
 * </ul>
 *
 * Serialization errors propagate and leave the entry pending. So does a failure
 * to republish or dead-letter, in which case the entry can be claimed later.
 */
@Service
@Slf4j
public class RetryOrchestrator {

    private final ConsumerGroupCoordinator coordinator;
    private final EventPublisher publisher;
    private final EnvelopeCodec codec;
    private final EventBusProperties properties;
    private final Clock clock;

    public RetryOrchestrator(ConsumerGroupCoordinator coordinator,
                             EventPublisher publisher,
                             EnvelopeCodec codec,
                             EventBusProperties properties,
                             Clock clock) {
        this.coordinator = coordinator;
        this.publisher = publisher;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    public ProcessingOutcome processWithRetry(String stream, String group, String messageId,
                                              Map<String, String> fields, EntryProcessor processor) {
        try {
            processor.process(fields);
        } catch (EventSerializationException e) {
            log.error("Malformed entry left pending: stream={}, messageId={}, error={}",
                    stream, messageId, e.getMessage());
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleFailure(stream, group, messageId, fields, e);
        }

        coordinator.acknowledge(stream, group, messageId);
        return ProcessingOutcome.SUCCEEDED;
    }

    private ProcessingOutcome handleFailure(String stream, String group, String messageId,
                                            Map<String, String> fields, Exception error) {
        Instant now = Instant.now(clock);
        DeliveryAttempt attempt = DeliveryAttempt.fromFields(fields).failed(describe(error), now);
        int maxRetries = properties.getMaxRetries();

        if (attempt.getRetryCount() < maxRetries) {
            log.warn("Processing failed, requeueing: stream={}, messageId={}, attempt={}/{}, error={}",
                    stream, messageId, attempt.getRetryCount(), maxRetries, error.getMessage());
            publisher.republish(stream, attempt);
            coordinator.acknowledge(stream, group, messageId);
            return ProcessingOutcome.REQUEUED;
        }

        DeadLetterEvent deadLetter = DeadLetterEvent.builder()
                .originalStream(stream)
                .originalMessageId(messageId)
                .originalPayload(codec.payloadTree(attempt.getEnvelope().getPayload()))
                .errorMessage(attempt.getLastError())
                .errorType(error.getClass().getSimpleName())
                .failureCount(attempt.getRetryCount())
                .firstFailureAt(attempt.getFirstFailureAt())
                .lastFailureAt(now)
                .timestamp(now)
                .build();

        String dlqMessageId = publisher.publishDeadLetter(stream, deadLetter);
        coordinator.acknowledge(stream, group, messageId);
        log.warn("Max retries ({}) reached, dead-lettered: stream={}, messageId={}, dlqMessageId={}, error={}",
                maxRetries, stream, messageId, dlqMessageId, error.getMessage());
        return ProcessingOutcome.DEAD_LETTERED;
    }

    private String describe(Exception error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
