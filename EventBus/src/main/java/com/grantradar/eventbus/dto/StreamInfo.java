package com.grantradar.eventbus.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of one stream and its consumer groups.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamInfo {

    private String stream;
    private long length;
    private StreamEntry firstEntry;
    private StreamEntry lastEntry;

    @Builder.Default
    private List<GroupInfo> groups = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GroupInfo {
        private String name;
        private long consumers;
        private long pending;
        private String lastDeliveredId;
    }
}
