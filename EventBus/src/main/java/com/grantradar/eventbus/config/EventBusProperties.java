package com.grantradar.eventbus.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed binding for all eventbus.* configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "eventbus")
@Validated
@Data
public class EventBusProperties {

    /** Broker connection. */
    @Valid
    private RedisProps redis = new RedisProps();

    /** Failed processing attempts before an entry is dead-lettered. */
    @Min(1)
    private int maxRetries = 3;

    /** Approximate MAXLEN applied on publish. Zero or less disables capping. */
    private long defaultMaxLength = 10000;

    /** Connect and create every consumer group at startup. */
    private boolean setupOnStartup = true;

    @Valid
    private PublishProps publish = new PublishProps();

    @Valid
    private WorkerProps worker = new WorkerProps();

    @Data
    public static class RedisProps {
        @NotBlank
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class PublishProps {
        /** Total XADD attempts on transient connection failures. */
        @Min(1)
        private int attempts = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class WorkerProps {
        private boolean enabled = true;
        @Min(1)
        private int consumersPerStage = 1;
        @Min(1)
        private int batchSize = 10;
        /** Must stay below redis.timeout. */
        @NotNull
        private Duration block = Duration.ofSeconds(5);
        @NotNull
        private Duration claimMinIdle = Duration.ofSeconds(60);
        @Min(1)
        private int claimBatchSize = 10;
        /** Pending entries delivered this many times are no longer claimed. Zero or less disables the ceiling. */
        private int claimMaxDeliveries = 3;
        @NotNull
        private Duration errorBackoff = Duration.ofSeconds(1);
        /** Log and acknowledge entries arriving on the dead-letter streams. */
        private boolean deadLetterLogging = true;
    }
}
