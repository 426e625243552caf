package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cached measurements of one claim.
 *
 * cpu and memory keep a bounded window and report its mean, a partially
 * filled window reports the mean of the samples it has. disk and gpu keep
 * the last value.
 */
class UsageHistory {

    private final int window;

    private final Instant createTime;

    private final List<Long> children = new ArrayList<>();

    private Instant childrenLastLookup = Instant.EPOCH;

    private final Map<ResourceType, Instant> lastLookup = new EnumMap<>(ResourceType.class);

    private final Map<ResourceType, Deque<Double>> windows = new EnumMap<>(ResourceType.class);

    private final Map<ResourceType, Double> lastValues = new EnumMap<>(ResourceType.class);

    UsageHistory(int window, Instant createTime) {
        this.window = window;
        this.createTime = createTime;
        windows.put(ResourceType.CPU, new ArrayDeque<>(window));
        windows.put(ResourceType.MEMORY, new ArrayDeque<>(window));
    }

    Instant getCreateTime() {
        return createTime;
    }

    List<Long> getChildren() {
        return children;
    }

    /**
     * True (and the lookup instant advanced) when the children should be re-read
     */
    boolean childrenDue(Instant now, Duration interval, boolean force) {
        if (force || Duration.between(childrenLastLookup, now).compareTo(interval) > 0) {
            childrenLastLookup = now;
            return true;
        }
        return false;
    }

    void setChildren(List<Long> pids) {
        children.clear();
        children.addAll(pids);
    }

    /**
     * True (and the lookup instant advanced) when the dimension should be re-measured
     */
    boolean due(ResourceType type, Instant now, Duration interval, boolean force) {
        Instant last = lastLookup.getOrDefault(type, Instant.EPOCH);
        if (force || Duration.between(last, now).compareTo(interval) > 0) {
            lastLookup.put(type, now);
            return true;
        }
        return false;
    }

    void record(ResourceType type, double value) {
        Deque<Double> samples = windows.get(type);
        if (samples != null) {
            if (samples.size() >= window) {
                samples.removeFirst();
            }
            samples.addLast(value);
        } else {
            lastValues.put(type, value);
        }
    }

    double value(ResourceType type) {
        Deque<Double> samples = windows.get(type);
        if (samples != null) {
            if (samples.isEmpty()) {
                return 0;
            }
            double sum = 0;
            for (double sample : samples) {
                sum += sample;
            }
            return sum / samples.size();
        }
        return lastValues.getOrDefault(type, 0.0);
    }
}
