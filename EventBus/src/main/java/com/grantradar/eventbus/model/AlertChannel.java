package com.grantradar.eventbus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertChannel {

    EMAIL("email"),
    SMS("sms"),
    SLACK("slack"),
    PUSH("push");

    private final String value;

    AlertChannel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AlertChannel fromValue(String value) {
        for (AlertChannel channel : values()) {
            if (channel.value.equalsIgnoreCase(value)) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown alert channel: " + value);
    }
}
