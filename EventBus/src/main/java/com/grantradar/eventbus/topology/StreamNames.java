package com.grantradar.eventbus.topology;

import java.util.List;

/**
 * Primary stream names and their dead-letter counterparts.
 */
public final class StreamNames {

    public static final String GRANTS_DISCOVERED = "grants:discovered";
    public static final String GRANTS_VALIDATED = "grants:validated";
    public static final String MATCHES_COMPUTED = "matches:computed";
    public static final String ALERTS_PENDING = "alerts:pending";

    public static final String DLQ_PREFIX = "dlq:";

    private static final List<String> PRIMARY = List.of(
            GRANTS_DISCOVERED, GRANTS_VALIDATED, MATCHES_COMPUTED, ALERTS_PENDING);

    private StreamNames() {
    }

    public static String dlqFor(String stream) {
        return DLQ_PREFIX + stream;
    }

    public static boolean isDeadLetterStream(String stream) {
        return stream != null && stream.startsWith(DLQ_PREFIX);
    }

    public static List<String> allStreams() {
        return PRIMARY;
    }

    public static List<String> deadLetterStreams() {
        return PRIMARY.stream().map(StreamNames::dlqFor).toList();
    }
}
