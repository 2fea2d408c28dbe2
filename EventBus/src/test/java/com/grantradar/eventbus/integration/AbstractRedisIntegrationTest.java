package com.grantradar.eventbus.integration;

import com.grantradar.eventbus.EventFixtures;
import com.grantradar.eventbus.config.EventBusProperties;
import com.grantradar.eventbus.config.ValkeyConfig;
import com.grantradar.eventbus.service.ConsumerGroupCoordinator;
import com.grantradar.eventbus.service.EnvelopeCodec;
import com.grantradar.eventbus.service.EventPublisher;
import com.grantradar.eventbus.service.RetryOrchestrator;
import com.grantradar.eventbus.service.StreamConnectionManager;
import com.grantradar.eventbus.service.StreamInspectionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.data.redis.core.RedisCallback;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the bus by hand against a throwaway Redis. Skipped without Docker.
 */
@Testcontainers(disabledWithoutDocker = true)
abstract class AbstractRedisIntegrationTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(
            DockerImageName.parse("redis:7-alpine")
    ).withExposedPorts(6379);

    protected EventBusProperties properties;
    protected StreamConnectionManager connectionManager;
    protected EnvelopeCodec codec;
    protected EventPublisher publisher;
    protected ConsumerGroupCoordinator coordinator;
    protected RetryOrchestrator retryOrchestrator;
    protected StreamInspectionService inspection;

    @BeforeEach
    void setUpBus() {
        properties = new EventBusProperties();
        properties.getRedis().setHost(REDIS.getHost());
        properties.getRedis().setPort(REDIS.getMappedPort(6379));
        properties.getPublish().setInitialBackoff(Duration.ofMillis(10));
        properties.getPublish().setMaxBackoff(Duration.ofMillis(50));

        ValkeyConfig config = new ValkeyConfig();
        Clock clock = Clock.systemUTC();
        connectionManager = new StreamConnectionManager(
                config.redisStandaloneConfiguration(properties),
                config.lettuceClientConfiguration(properties),
                clock);
        codec = EventFixtures.codec(clock);
        publisher = new EventPublisher(connectionManager, codec, properties);
        coordinator = new ConsumerGroupCoordinator(connectionManager);
        retryOrchestrator = new RetryOrchestrator(coordinator, publisher, codec, properties, clock);
        inspection = new StreamInspectionService(connectionManager);

        connectionManager.connect();
        connectionManager.template().execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
    }

    @AfterEach
    void tearDownBus() {
        connectionManager.disconnect();
    }
}
