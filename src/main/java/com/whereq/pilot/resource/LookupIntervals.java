package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Minimum time between two measurements of the same dimension
 */
@Value
@Builder
public class LookupIntervals {
    Duration children;
    Duration cpu;
    Duration gpu;
    Duration memory;
    Duration disk;
    Duration time;

    public static LookupIntervals defaults() {
        return LookupIntervals.builder()
            .children(Duration.ofSeconds(60))
            .cpu(Duration.ofSeconds(1))
            .gpu(Duration.ofSeconds(1))
            .memory(Duration.ofSeconds(1))
            .disk(Duration.ofSeconds(180))
            .time(Duration.ofSeconds(1))
            .build();
    }

    public static LookupIntervals debug() {
        return LookupIntervals.builder()
            .children(Duration.ofSeconds(10))
            .cpu(Duration.ofMillis(100))
            .gpu(Duration.ofSeconds(1))
            .memory(Duration.ofMillis(100))
            .disk(Duration.ofSeconds(30))
            .time(Duration.ofSeconds(1))
            .build();
    }

    public Duration of(ResourceType type) {
        return switch (type) {
            case CPU -> cpu;
            case GPU -> gpu;
            case MEMORY -> memory;
            case DISK -> disk;
            case TIME -> time;
        };
    }
}
