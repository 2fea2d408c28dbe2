package com.grantradar.eventbus.service;

import com.grantradar.eventbus.dto.BusHealth;
import com.grantradar.eventbus.topology.StreamNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single shared broker connection of this process.
 *
 * The connection is created on first use (or by EventBusLifecycle at startup)
 * and released by {@link #disconnect()}; a later {@link #connect()} starts over.
 */
@Service
@Slf4j
public class StreamConnectionManager {

    private final RedisStandaloneConfiguration standaloneConfiguration;
    private final LettuceClientConfiguration clientConfiguration;
    private final Clock clock;

    private final ReentrantLock connectionLock = new ReentrantLock();

    private volatile LettuceConnectionFactory connectionFactory;
    private volatile StringRedisTemplate template;

    public StreamConnectionManager(RedisStandaloneConfiguration standaloneConfiguration,
                                   LettuceClientConfiguration clientConfiguration,
                                   Clock clock) {
        this.standaloneConfiguration = standaloneConfiguration;
        this.clientConfiguration = clientConfiguration;
        this.clock = clock;
    }

    /**
     * Establishes the connection and pings the broker. No-op when already connected.
     *
     * @throws org.springframework.dao.DataAccessException when the broker is unreachable
     */
    public void connect() {
        if (template != null) {
            return;
        }
        connectionLock.lock();
        try {
            if (template != null) {
                return;
            }
            LettuceConnectionFactory factory = createConnectionFactory();
            try {
                factory.afterPropertiesSet();
                StringRedisTemplate candidate = new StringRedisTemplate(factory);
                String pong = ping(candidate);
                this.connectionFactory = factory;
                this.template = candidate;
                log.info("Connected to Valkey {}:{} (db={}), ping={}",
                        standaloneConfiguration.getHostName(), standaloneConfiguration.getPort(),
                        standaloneConfiguration.getDatabase(), pong);
            } catch (RuntimeException e) {
                destroyQuietly(factory);
                throw e;
            }
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Releases the connection. Safe to call when not connected.
     */
    public void disconnect() {
        connectionLock.lock();
        try {
            LettuceConnectionFactory factory = this.connectionFactory;
            this.template = null;
            this.connectionFactory = null;
            if (factory != null) {
                destroyQuietly(factory);
                log.info("Disconnected from Valkey");
            }
        } finally {
            connectionLock.unlock();
        }
    }

    public boolean isConnected() {
        return template != null;
    }

    /**
     * The shared template, connecting first if needed.
     */
    public StringRedisTemplate template() {
        StringRedisTemplate current = template;
        if (current != null) {
            return current;
        }
        connect();
        return template;
    }

    /**
     * Liveness probe plus the length of every primary and dead-letter stream.
     * Never throws.
     */
    public BusHealth healthCheck() {
        try {
            StringRedisTemplate redis = template();

            long start = System.nanoTime();
            ping(redis);
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            List<String> streams = new ArrayList<>(StreamNames.allStreams());
            streams.addAll(StreamNames.deadLetterStreams());

            Map<String, Long> lengths = new LinkedHashMap<>();
            for (String stream : streams) {
                Long size = redis.opsForStream().size(stream);
                lengths.put(stream, size != null ? size : 0L);
            }

            return BusHealth.builder()
                    .status(BusHealth.HEALTHY)
                    .connected(true)
                    .latencyMs(latencyMs)
                    .streamLengths(lengths)
                    .timestamp(Instant.now(clock))
                    .build();
        } catch (Exception e) {
            log.warn("Event bus health check failed: {}", e.getMessage());
            return BusHealth.builder()
                    .status(BusHealth.UNHEALTHY)
                    .connected(false)
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .timestamp(Instant.now(clock))
                    .build();
        }
    }

    protected LettuceConnectionFactory createConnectionFactory() {
        return new LettuceConnectionFactory(standaloneConfiguration, clientConfiguration);
    }

    private String ping(StringRedisTemplate redis) {
        return redis.execute((RedisCallback<String>) RedisConnection::ping);
    }

    private void destroyQuietly(LettuceConnectionFactory factory) {
        try {
            factory.destroy();
        } catch (Exception e) {
            log.error("Error closing Valkey connection factory: {}", e.getMessage());
        }
    }
}
