package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceType;
import com.whereq.pilot.model.ResourceUsage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Running max and average of every checked dimension of one claim
 */
class UsageStats {

    private static class Stat {
        double max;
        long count;
        double avg;
    }

    private final Map<ResourceType, Stat> stats = new EnumMap<>(ResourceType.class);

    void record(ResourceType type, double value) {
        Stat stat = stats.computeIfAbsent(type, t -> new Stat());
        stat.avg = (value + stat.count * stat.avg) / (stat.count + 1);
        stat.count++;
        if (value > stat.max) {
            stat.max = value;
        }
    }

    ResourceUsage peak() {
        ResourceUsage usage = new ResourceUsage();
        stats.forEach((type, stat) -> usage.set(type, stat.max));
        return usage;
    }

    /**
     * gpu reports its average, every other dimension its max
     */
    ResourceUsage last() {
        ResourceUsage usage = new ResourceUsage();
        stats.forEach((type, stat) -> usage.set(type, type == ResourceType.GPU ? stat.avg : stat.max));
        return usage;
    }
}
