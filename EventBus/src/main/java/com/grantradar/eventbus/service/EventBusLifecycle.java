package com.grantradar.eventbus.service;

import com.grantradar.eventbus.config.EventBusProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Startup and shutdown of the bus: connect and create every consumer group,
 * then release the connection when the context closes.
 */
@Service
@Slf4j
public class EventBusLifecycle {

    private final StreamConnectionManager connectionManager;
    private final ConsumerGroupCoordinator coordinator;
    private final EventBusProperties properties;

    public EventBusLifecycle(StreamConnectionManager connectionManager,
                             ConsumerGroupCoordinator coordinator,
                             EventBusProperties properties) {
        this.connectionManager = connectionManager;
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.isSetupOnStartup()) {
            log.info("Event bus setup on startup disabled, connecting lazily");
            return;
        }
        log.info("Event bus initialising...");
        try {
            connectionManager.connect();
            coordinator.setupConsumerGroups();
        } catch (DataAccessException e) {
            log.error("Event bus setup failed, will connect on first use: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Event bus shutting down...");
        connectionManager.disconnect();
    }
}
