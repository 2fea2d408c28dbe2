package com.grantradar.eventbus.dto;

import lombok.Value;

import java.util.Map;

/**
 * One stream entry as delivered to a consumer.
 */
@Value
public class StreamEntry {
    String messageId;
    Map<String, String> fields;
}
