package com.grantradar.eventbus.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Every (stream, group) pair the bus maintains: one stage group per primary
 * stream, and the dead-letter handler group on every DLQ stream.
 */
public final class StreamTopology {

    private static final List<StreamBinding> BINDINGS;

    static {
        List<StreamBinding> bindings = new ArrayList<>();
        for (Stage stage : Stage.values()) {
            bindings.add(stage.binding());
        }
        for (Stage stage : Stage.values()) {
            bindings.add(new StreamBinding(stage.getDeadLetterStream(), ConsumerGroups.DLQ_HANDLERS));
        }
        BINDINGS = Collections.unmodifiableList(bindings);
    }

    private StreamTopology() {
    }

    public static List<StreamBinding> bindings() {
        return BINDINGS;
    }

    /**
     * Group bound to the given stream, or null when the stream is not part of the topology.
     */
    public static String groupFor(String stream) {
        return BINDINGS.stream()
                .filter(b -> b.getStream().equals(stream))
                .map(StreamBinding::getGroup)
                .findFirst()
                .orElse(null);
    }
}
