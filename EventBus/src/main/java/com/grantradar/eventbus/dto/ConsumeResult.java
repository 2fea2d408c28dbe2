package com.grantradar.eventbus.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a group read: entries delivered to the consumer, or an empty
 * result because the group was missing and has just been created.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConsumeResult {

    public enum Kind {
        DELIVERED,
        GROUP_RECREATED
    }

    Kind kind;
    List<StreamEntry> entries;

    public static ConsumeResult delivered(List<StreamEntry> entries) {
        return new ConsumeResult(Kind.DELIVERED, List.copyOf(entries));
    }

    public static ConsumeResult groupRecreated() {
        return new ConsumeResult(Kind.GROUP_RECREATED, List.of());
    }

    public boolean isGroupRecreated() {
        return kind == Kind.GROUP_RECREATED;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
