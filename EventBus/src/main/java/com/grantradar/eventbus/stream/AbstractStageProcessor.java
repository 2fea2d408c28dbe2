package com.grantradar.eventbus.stream;

import com.grantradar.eventbus.model.DomainEvent;
import com.grantradar.eventbus.service.EnvelopeCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Template for stage processors: decodes the envelope into the stage's
 * event type, then hands it to {@link #handle}.
 */
@Slf4j
public abstract class AbstractStageProcessor<T extends DomainEvent> implements StageProcessor {

    private final EnvelopeCodec codec;
    private final Class<T> eventType;

    protected AbstractStageProcessor(EnvelopeCodec codec, Class<T> eventType) {
        this.codec = codec;
        this.eventType = eventType;
    }

    @Override
    public final void process(Map<String, String> fields) throws Exception {
        T event = codec.deserialize(fields, eventType);
        log.debug("Processing {} eventId={} from stream={}",
                eventType.getSimpleName(), event.getEventId(), streamKey());
        handle(event);
    }

    protected abstract void handle(T event) throws Exception;
}
