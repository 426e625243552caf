package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Ascending bin edges a requirement is rounded up to, per dimension
 */
@Value
@Builder
public class RequirementBins {

    @Singular("bin")
    Map<ResourceType, List<Double>> edges;

    public static RequirementBins defaults() {
        return RequirementBins.builder()
            .bin(ResourceType.CPU, List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0,
                10.0, 12.0, 16.0, 20.0, 24.0, 32.0, 48.0, 64.0))
            .bin(ResourceType.GPU, List.of(0.0, 1.0, 2.0, 3.0, 4.0, 6.0, 8.0))
            .bin(ResourceType.MEMORY, List.of(0.5, 1.0, 1.5, 2.0, 3.0, 4.0, 5.0, 6.0, 8.0, 10.0, 12.0,
                16.0, 20.0, 24.0, 32.0, 48.0, 64.0, 96.0, 128.0, 192.0, 256.0))
            .bin(ResourceType.DISK, List.of(1.0, 2.0, 5.0, 10.0, 20.0, 30.0, 50.0, 75.0, 100.0, 150.0,
                200.0, 300.0, 500.0, 750.0, 1000.0, 2000.0))
            .bin(ResourceType.TIME, List.of(0.25, 0.5, 1.0, 2.0, 3.0, 4.0, 6.0, 8.0, 10.0, 12.0, 16.0,
                20.0, 24.0, 36.0, 48.0, 72.0, 96.0, 168.0))
            .build();
    }

    /**
     * Edges of one dimension, empty when the dimension is not binned
     */
    public List<Double> of(ResourceType type) {
        return edges.getOrDefault(type, List.of());
    }
}
