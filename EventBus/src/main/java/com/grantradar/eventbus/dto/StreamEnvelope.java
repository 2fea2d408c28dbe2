package com.grantradar.eventbus.dto;

import com.grantradar.eventbus.exception.EventSerializationException;
import com.grantradar.eventbus.util.Dates;
import lombok.Value;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The wire unit stored in a stream: serialized event, its type name and publish time.
 */
@Value
public class StreamEnvelope {

    public static final String PAYLOAD = "payload";
    public static final String EVENT_TYPE = "event_type";
    public static final String PUBLISHED_AT = "published_at";

    String payload;
    String eventType;
    Instant publishedAt;

    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(PAYLOAD, payload);
        fields.put(EVENT_TYPE, eventType);
        fields.put(PUBLISHED_AT, Dates.formatIso(publishedAt));
        return fields;
    }

    /**
     * Reads the envelope part of a stream record. Other fields are ignored.
     */
    public static StreamEnvelope fromFields(Map<String, String> fields) {
        String payload = fields.get(PAYLOAD);
        if (payload == null) {
            throw new EventSerializationException("Record has no '" + PAYLOAD + "' field");
        }
        try {
            return new StreamEnvelope(payload, fields.get(EVENT_TYPE), Dates.parseIso(fields.get(PUBLISHED_AT)));
        } catch (DateTimeParseException e) {
            throw new EventSerializationException("Invalid " + PUBLISHED_AT + ": " + fields.get(PUBLISHED_AT), e);
        }
    }
}
