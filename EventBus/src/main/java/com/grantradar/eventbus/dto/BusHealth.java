package com.grantradar.eventbus.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusHealth {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private String status;
    private boolean connected;
    private Long latencyMs;

    @Builder.Default
    private Map<String, Long> streamLengths = new LinkedHashMap<>();

    private String error;
    private Instant timestamp;

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
