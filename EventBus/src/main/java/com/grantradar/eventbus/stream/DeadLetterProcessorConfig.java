package com.grantradar.eventbus.stream;

import com.grantradar.eventbus.service.EnvelopeCodec;
import com.grantradar.eventbus.topology.StreamNames;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One dead-letter log processor per DLQ stream, all in the dlq-handlers group.
 */
@Configuration
@ConditionalOnProperty(prefix = "eventbus.worker", name = "dead-letter-logging", havingValue = "true", matchIfMissing = true)
public class DeadLetterProcessorConfig {

    @Bean
    public StageProcessor grantsDiscoveredDeadLetters(EnvelopeCodec codec) {
        return new DeadLetterLogProcessor(codec, StreamNames.GRANTS_DISCOVERED);
    }

    @Bean
    public StageProcessor grantsValidatedDeadLetters(EnvelopeCodec codec) {
        return new DeadLetterLogProcessor(codec, StreamNames.GRANTS_VALIDATED);
    }

    @Bean
    public StageProcessor matchesComputedDeadLetters(EnvelopeCodec codec) {
        return new DeadLetterLogProcessor(codec, StreamNames.MATCHES_COMPUTED);
    }

    @Bean
    public StageProcessor alertsPendingDeadLetters(EnvelopeCodec codec) {
        return new DeadLetterLogProcessor(codec, StreamNames.ALERTS_PENDING);
    }
}
