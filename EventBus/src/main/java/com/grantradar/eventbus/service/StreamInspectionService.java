package com.grantradar.eventbus.service;

import com.grantradar.eventbus.dto.BusHealth;
import com.grantradar.eventbus.dto.StreamEntry;
import com.grantradar.eventbus.dto.StreamInfo;
import com.grantradar.eventbus.util.RedisErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessagesSummary;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Read-only stream introspection and on-demand trimming.
 */
@Service
@Slf4j
public class StreamInspectionService {

    private final StreamConnectionManager connectionManager;

    public StreamInspectionService(StreamConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    public StreamInfo streamInfo(String stream) {
        StringRedisTemplate redis = connectionManager.template();
        StreamOperations<String, String, String> ops = redis.opsForStream();

        StreamInfo info = StreamInfo.builder().stream(stream).build();
        if (!Boolean.TRUE.equals(redis.hasKey(stream))) {
            return info;
        }

        Long size = ops.size(stream);
        info.setLength(size != null ? size : 0L);
        info.setFirstEntry(first(ops.range(stream, Range.unbounded(), Limit.limit().count(1))));
        info.setLastEntry(first(ops.reverseRange(stream, Range.unbounded(), Limit.limit().count(1))));

        ops.groups(stream).stream().forEach(group -> info.getGroups().add(StreamInfo.GroupInfo.builder()
                .name(group.groupName())
                .consumers(group.consumerCount())
                .pending(group.pendingCount())
                .lastDeliveredId(group.lastDeliveredId())
                .build()));
        return info;
    }

    /**
     * Entries delivered to the group but not yet acknowledged; 0 when the stream
     * or group does not exist.
     */
    public long pendingCount(String stream, String group) {
        try {
            PendingMessagesSummary summary = connectionManager.template()
                    .opsForStream()
                    .pending(stream, group);
            return summary != null ? summary.getTotalPendingMessages() : 0L;
        } catch (DataAccessException e) {
            if (RedisErrors.isTransient(e)) {
                throw e;
            }
            log.debug("No pending info for stream={}, group={}: {}", stream, group, e.getMessage());
            return 0L;
        }
    }

    public long trim(String stream, long maxLength) {
        return trim(stream, maxLength, true);
    }

    /**
     * Trims the stream towards {@code maxLength} entries, oldest first.
     * With approximate trimming the broker may keep more.
     *
     * @return number of entries removed
     */
    public long trim(String stream, long maxLength, boolean approximate) {
        StreamOperations<String, String, String> ops = connectionManager.template().opsForStream();
        long before = sizeOf(ops, stream);
        ops.trim(stream, maxLength, approximate);
        long after = sizeOf(ops, stream);
        long removed = Math.max(0L, before - after);
        log.info("Trimmed stream={} to maxLength={} (approximate={}): removed={}",
                stream, maxLength, approximate, removed);
        return removed;
    }

    public BusHealth healthCheck() {
        return connectionManager.healthCheck();
    }

    private long sizeOf(StreamOperations<String, String, String> ops, String stream) {
        Long size = ops.size(stream);
        return size != null ? size : 0L;
    }

    private StreamEntry first(List<MapRecord<String, String, String>> records) {
        if (records == null || records.isEmpty()) {
            return null;
        }
        MapRecord<String, String, String> record = records.get(0);
        return new StreamEntry(record.getId().getValue(), new LinkedHashMap<>(record.getValue()));
    }
}
