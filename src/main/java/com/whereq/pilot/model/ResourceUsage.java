package com.whereq.pilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Measured resource usage of a claim
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsage {
    /**
     * Cores in use (1.0 = one fully busy core)
     */
    private double cpu;

    /**
     * Device equivalents in use (1.0 = one fully busy gpu)
     */
    private double gpu;

    /**
     * Resident memory in GB
     */
    private double memory;

    /**
     * Working directory size in GB
     */
    private double disk;

    /**
     * Hours since the process started
     */
    private double time;

    public double get(ResourceType type) {
        return switch (type) {
            case CPU -> cpu;
            case GPU -> gpu;
            case MEMORY -> memory;
            case DISK -> disk;
            case TIME -> time;
        };
    }

    public void set(ResourceType type, double value) {
        switch (type) {
            case CPU -> cpu = value;
            case GPU -> gpu = value;
            case MEMORY -> memory = value;
            case DISK -> disk = value;
            case TIME -> time = value;
        }
    }

    /**
     * Plain map form, as reported to the queue service
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (ResourceType type : ResourceType.values()) {
            map.put(type.getKey(), get(type));
        }
        return map;
    }
}
