package com.grantradar.eventbus.topology;

public final class ConsumerGroups {

    public static final String DISCOVERY_VALIDATORS = "discovery-validators";
    public static final String CURATION_PROCESSORS = "curation-processors";
    public static final String MATCHING_WORKERS = "matching-workers";
    public static final String ALERT_DISPATCHERS = "alert-dispatchers";

    /** Shared by every dead-letter stream. */
    public static final String DLQ_HANDLERS = "dlq-handlers";

    private ConsumerGroups() {
    }
}
