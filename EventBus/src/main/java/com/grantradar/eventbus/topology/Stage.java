package com.grantradar.eventbus.topology;

import lombok.Getter;

/**
 * Processing stages and the stream/group each one consumes.
 */
@Getter
public enum Stage {

    DISCOVERY(StreamNames.GRANTS_DISCOVERED, ConsumerGroups.DISCOVERY_VALIDATORS),
    CURATION(StreamNames.GRANTS_VALIDATED, ConsumerGroups.CURATION_PROCESSORS),
    MATCHING(StreamNames.MATCHES_COMPUTED, ConsumerGroups.MATCHING_WORKERS),
    ALERTING(StreamNames.ALERTS_PENDING, ConsumerGroups.ALERT_DISPATCHERS);

    private final String stream;
    private final String group;

    Stage(String stream, String group) {
        this.stream = stream;
        this.group = group;
    }

    public String getDeadLetterStream() {
        return StreamNames.dlqFor(stream);
    }

    public StreamBinding binding() {
        return new StreamBinding(stream, group);
    }
}
