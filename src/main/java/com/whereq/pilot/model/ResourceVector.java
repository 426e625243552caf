package com.whereq.pilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Quantities of each resource dimension held by a node, a claim or a pilot.
 *
 * Time is expressed in hours relative to the moment the vector was produced.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceVector {

    private int cpu;

    /**
     * Device ids, the gpu quantity is the size of this list
     */
    @Builder.Default
    private List<String> gpu = new ArrayList<>();

    /**
     * Memory in GB
     */
    private double memory;

    /**
     * Disk in GB
     */
    private double disk;

    /**
     * Wall time in hours
     */
    private double time;

    public static ResourceVector empty() {
        return new ResourceVector();
    }

    /**
     * Get the quantity of one dimension (device count for gpu)
     */
    public double quantity(ResourceType type) {
        return switch (type) {
            case CPU -> cpu;
            case GPU -> gpu.size();
            case MEMORY -> memory;
            case DISK -> disk;
            case TIME -> time;
        };
    }

    /**
     * Deep copy, the gpu list is not shared
     */
    public ResourceVector copy() {
        return toBuilder().gpu(new ArrayList<>(gpu)).build();
    }
}
