package com.grantradar.eventbus.stream;

import com.grantradar.eventbus.model.DeadLetterEvent;
import com.grantradar.eventbus.service.EnvelopeCodec;
import com.grantradar.eventbus.topology.StreamNames;
import com.grantradar.eventbus.topology.StreamTopology;
import lombok.extern.slf4j.Slf4j;

/**
 * Dead-letter handler for one DLQ stream: records the failure in the log.
 * The entry itself stays in the stream for manual reprocessing.
 */
@Slf4j
public class DeadLetterLogProcessor extends AbstractStageProcessor<DeadLetterEvent> {

    private final String deadLetterStream;
    private final String group;

    public DeadLetterLogProcessor(EnvelopeCodec codec, String originalStream) {
        super(codec, DeadLetterEvent.class);
        this.deadLetterStream = StreamNames.dlqFor(originalStream);
        this.group = StreamTopology.groupFor(deadLetterStream);
        if (group == null) {
            throw new IllegalArgumentException("No dead-letter group bound to " + deadLetterStream);
        }
    }

    @Override
    public String streamKey() {
        return deadLetterStream;
    }

    @Override
    public String consumerGroup() {
        return group;
    }

    @Override
    protected void handle(DeadLetterEvent event) {
        log.error("Dead letter on {}: originalMessageId={}, failures={}, errorType={}, error={}, firstFailureAt={}",
                event.getOriginalStream(), event.getOriginalMessageId(), event.getFailureCount(),
                event.getErrorType(), event.getErrorMessage(), event.getFirstFailureAt());
    }
}
