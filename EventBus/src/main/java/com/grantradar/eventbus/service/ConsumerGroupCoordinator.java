package com.grantradar.eventbus.service;

import com.grantradar.eventbus.dto.ConsumeResult;
import com.grantradar.eventbus.dto.GroupCreation;
import com.grantradar.eventbus.dto.StreamEntry;
import com.grantradar.eventbus.topology.StreamBinding;
import com.grantradar.eventbus.topology.StreamTopology;
import com.grantradar.eventbus.util.RedisErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumer group management, group reads, claiming of stale pending entries
 * and acknowledgement.
 */
@Service
@Slf4j
public class ConsumerGroupCoordinator {

    public static final String FROM_BEGINNING = "0";

    private final StreamConnectionManager connectionManager;

    public ConsumerGroupCoordinator(StreamConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    public GroupCreation createGroup(String stream, String group) {
        return createGroup(stream, group, FROM_BEGINNING);
    }

    /**
     * Creates the group (and the stream when absent) with its cursor at {@code startId}.
     * An existing group is reported, not raised.
     */
    public GroupCreation createGroup(String stream, String group, String startId) {
        try {
            operations().createGroup(stream, ReadOffset.from(startId), group);
            log.info("Created consumer group: stream={}, group={}, startId={}", stream, group, startId);
            return GroupCreation.CREATED;
        } catch (DataAccessException e) {
            if (RedisErrors.hasErrorCode(e, RedisErrors.BUSYGROUP)) {
                log.debug("Consumer group already exists: stream={}, group={}", stream, group);
                return GroupCreation.ALREADY_EXISTED;
            }
            throw e;
        }
    }

    /**
     * Creates every group of the stream topology.
     */
    public Map<StreamBinding, GroupCreation> setupConsumerGroups() {
        Map<StreamBinding, GroupCreation> outcomes = new LinkedHashMap<>();
        for (StreamBinding binding : StreamTopology.bindings()) {
            outcomes.put(binding, createGroup(binding.getStream(), binding.getGroup()));
        }
        log.info("Consumer groups ready: {} binding(s), {} created",
                outcomes.size(), outcomes.values().stream().filter(o -> o == GroupCreation.CREATED).count());
        return outcomes;
    }

    /**
     * Reads entries never delivered to any consumer of the group, blocking up to
     * {@code blockMs} (no blocking when zero or less). A missing group is created
     * from the start of the stream and an empty result is returned.
     */
    public ConsumeResult consume(String stream, String group, String consumer, int count, long blockMs) {
        StreamReadOptions options = StreamReadOptions.empty().count(count);
        if (blockMs > 0) {
            options = options.block(Duration.ofMillis(blockMs));
        }

        List<MapRecord<String, String, String>> records;
        try {
            records = operations().read(
                    Consumer.from(group, consumer),
                    options,
                    StreamOffset.create(stream, ReadOffset.lastConsumed()));
        } catch (DataAccessException e) {
            if (RedisErrors.hasErrorCode(e, RedisErrors.NOGROUP)) {
                log.warn("Consumer group missing, recreating: stream={}, group={}", stream, group);
                createGroup(stream, group, FROM_BEGINNING);
                return ConsumeResult.groupRecreated();
            }
            throw e;
        }

        List<StreamEntry> entries = toEntries(records);
        if (!entries.isEmpty()) {
            log.debug("Consumed {} entr(ies): stream={}, group={}, consumer={}",
                    entries.size(), stream, group, consumer);
        }
        return ConsumeResult.delivered(entries);
    }

    public List<StreamEntry> consumePending(String stream, String group, String consumer, long minIdleMs, int count) {
        return consumePending(stream, group, consumer, minIdleMs, count, 0);
    }

    /**
     * Claims up to {@code count} pending entries idle for at least {@code minIdleMs}
     * and returns their data. The pending list is paged through by id until enough
     * stale entries are found or it is exhausted. Entries already delivered
     * {@code maxDeliveries} times stay pending with their current owner (no ceiling
     * when zero or less). Entries trimmed away since delivery are skipped.
     * Broker command errors (such as a missing group) yield an empty list;
     * connection failures propagate.
     */
    public List<StreamEntry> consumePending(String stream, String group, String consumer,
                                            long minIdleMs, int count, int maxDeliveries) {
        try {
            StreamOperations<String, String, String> ops = operations();
            Duration minIdle = Duration.ofMillis(minIdleMs);
            List<RecordId> stale = new ArrayList<>();
            int parked = 0;

            Range<String> range = Range.unbounded();
            while (stale.size() < count) {
                PendingMessages page = ops.pending(stream, group, range, count);
                if (page == null || page.isEmpty()) {
                    break;
                }
                for (PendingMessage message : page) {
                    if (message.getElapsedTimeSinceLastDelivery().compareTo(minIdle) < 0) {
                        continue;
                    }
                    if (maxDeliveries > 0 && message.getTotalDeliveryCount() >= maxDeliveries) {
                        parked++;
                        continue;
                    }
                    stale.add(message.getId());
                    if (stale.size() >= count) {
                        break;
                    }
                }
                if (page.size() < count) {
                    break;
                }
                range = Range.rightUnbounded(Range.Bound.inclusive(after(page.get(page.size() - 1).getId())));
            }

            if (parked > 0) {
                log.debug("Left {} entr(ies) pending past {} deliveries: stream={}, group={}",
                        parked, maxDeliveries, stream, group);
            }
            if (stale.isEmpty()) {
                return Collections.emptyList();
            }

            List<MapRecord<String, String, String>> claimed =
                    ops.claim(stream, group, consumer, minIdle, stale.toArray(new RecordId[0]));
            List<StreamEntry> entries = toEntries(claimed);
            log.info("Claimed {} stale entr(ies): stream={}, group={}, consumer={}",
                    entries.size(), stream, group, consumer);
            return entries;
        } catch (DataAccessException e) {
            if (RedisErrors.isTransient(e)) {
                throw e;
            }
            log.warn("Could not claim pending entries: stream={}, group={}: {}", stream, group, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Smallest stream id greater than {@code id}.
     */
    static String after(RecordId id) {
        return id.getTimestamp() + "-" + (id.getSequence() + 1);
    }

    /**
     * @return true when the entry was removed from the group's pending list
     */
    public boolean acknowledge(String stream, String group, String messageId) {
        Long acked = operations().acknowledge(stream, group, messageId);
        boolean removed = acked != null && acked > 0;
        log.debug("Acknowledged message: stream={}, group={}, messageId={}, removed={}",
                stream, group, messageId, removed);
        return removed;
    }

    private StreamOperations<String, String, String> operations() {
        return connectionManager.template().opsForStream();
    }

    private List<StreamEntry> toEntries(List<MapRecord<String, String, String>> records) {
        if (records == null || records.isEmpty()) {
            return Collections.emptyList();
        }
        List<StreamEntry> entries = new ArrayList<>(records.size());
        for (MapRecord<String, String, String> record : records) {
            Map<String, String> value = record.getValue();
            if (value == null || value.isEmpty()) {
                continue;
            }
            entries.add(new StreamEntry(record.getId().getValue(), new LinkedHashMap<>(value)));
        }
        return entries;
    }
}
