package com.grantradar.eventbus.integration;

import com.grantradar.eventbus.EventFixtures;
import com.grantradar.eventbus.model.GrantDiscoveredEvent;
import com.grantradar.eventbus.service.EnvelopeCodec;
import com.grantradar.eventbus.service.EventPublisher;
import com.grantradar.eventbus.service.StreamConnectionManager;
import com.grantradar.eventbus.service.StreamInspectionService;
import com.grantradar.eventbus.stream.AbstractStageProcessor;
import com.grantradar.eventbus.stream.StageWorkerOrchestrator;
import com.grantradar.eventbus.topology.Stage;
import com.grantradar.eventbus.topology.StreamBinding;
import com.grantradar.eventbus.topology.StreamTopology;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class EventBusApplicationTests {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(
            DockerImageName.parse("redis:7-alpine")
    ).withExposedPorts(6379);

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("eventbus.redis.host", REDIS::getHost);
        registry.add("eventbus.redis.port", () -> REDIS.getMappedPort(6379));
        registry.add("eventbus.worker.block", () -> "200ms");
        registry.add("eventbus.worker.error-backoff", () -> "100ms");
    }

    @Autowired private StreamConnectionManager connectionManager;
    @Autowired private StreamInspectionService inspection;
    @Autowired private EventPublisher publisher;
    @Autowired private StageWorkerOrchestrator workers;
    @Autowired private RecordingDiscoveryProcessor discoveryProcessor;

    @Test
    @DisplayName("Startup connects and creates every consumer group")
    void startupCreatesTopology() {
        assertTrue(connectionManager.isConnected());
        for (StreamBinding binding : StreamTopology.bindings()) {
            assertTrue(inspection.streamInfo(binding.getStream()).getGroups().stream()
                            .anyMatch(g -> g.getName().equals(binding.getGroup())),
                    "group " + binding.getGroup() + " on " + binding.getStream());
        }
    }

    @Test
    @DisplayName("A stage worker receives, retries and acknowledges published events")
    void stageWorkerProcessesEvents() {
        assertTrue(workers.isRunning());
        GrantDiscoveredEvent event = EventFixtures.grantDiscovered();

        publisher.publishGrantDiscovered(event);

        await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
            assertTrue(discoveryProcessor.received.contains(event));
            assertEquals(0, inspection.pendingCount(Stage.DISCOVERY.getStream(), Stage.DISCOVERY.getGroup()));
        });
        assertEquals(2, discoveryProcessor.attempts.get());
        assertEquals(0, inspection.streamInfo(Stage.DISCOVERY.getDeadLetterStream()).getLength());
    }

    /**
     * Fails the first delivery of every event, then records it.
     */
    static class RecordingDiscoveryProcessor extends AbstractStageProcessor<GrantDiscoveredEvent> {

        final List<GrantDiscoveredEvent> received = new CopyOnWriteArrayList<>();
        final AtomicInteger attempts = new AtomicInteger();

        RecordingDiscoveryProcessor(EnvelopeCodec codec) {
            super(codec, GrantDiscoveredEvent.class);
        }

        @Override
        public String streamKey() {
            return Stage.DISCOVERY.getStream();
        }

        @Override
        public String consumerGroup() {
            return Stage.DISCOVERY.getGroup();
        }

        @Override
        protected void handle(GrantDiscoveredEvent event) {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first delivery fails");
            }
            received.add(event);
        }
    }

    @TestConfiguration
    static class StageConfig {

        @Bean
        RecordingDiscoveryProcessor recordingDiscoveryProcessor(EnvelopeCodec codec) {
            return new RecordingDiscoveryProcessor(codec);
        }
    }
}
