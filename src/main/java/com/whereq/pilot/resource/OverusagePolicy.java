package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceType;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * Decides whether a claim using more than it asked for is tolerated.
 *
 * Usage below {@code ignore} times the claim is never flagged. Above that,
 * extra usage is tolerated while it fits in the unclaimed capacity and stays
 * below {@code allowed} times the claim. Wall time is tolerated as long as the
 * node has any time left.
 */
public class OverusagePolicy {

    public enum Verdict {
        WITHIN,
        IGNORED,
        TOLERATED,
        VIOLATION;

        public boolean isViolation() {
            return this == VIOLATION;
        }
    }

    @Data
    @AllArgsConstructor
    public static class Limit {
        /**
         * Usage ratio below which overusage is ignored
         */
        private double ignore;

        /**
         * Usage ratio below which overusage is tolerated if capacity is spare
         */
        private double allowed;
    }

    private final Map<ResourceType, Limit> limits = new EnumMap<>(ResourceType.class);

    public OverusagePolicy(Map<ResourceType, Limit> limits) {
        this.limits.putAll(limits);
        for (ResourceType type : ResourceType.values()) {
            if (!this.limits.containsKey(type)) {
                throw new IllegalArgumentException("missing overusage limit for " + type.getKey());
            }
        }
    }

    public static OverusagePolicy defaults() {
        Map<ResourceType, Limit> limits = new EnumMap<>(ResourceType.class);
        limits.put(ResourceType.CPU, new Limit(2.0, 4.0));
        limits.put(ResourceType.GPU, new Limit(1.5, 1.5));
        limits.put(ResourceType.MEMORY, new Limit(0, 10.0));
        limits.put(ResourceType.DISK, new Limit(0, 10.0));
        limits.put(ResourceType.TIME, new Limit(0, 10.0));
        return new OverusagePolicy(limits);
    }

    public Limit getLimit(ResourceType type) {
        return limits.get(type);
    }

    /**
     * Evaluate one dimension of one claim.
     *
     * @param type dimension
     * @param used measured usage
     * @param claimed claimed amount, a zero claim makes any usage an infinite ratio
     * @param spare unclaimed capacity of the node (remaining hours for time)
     */
    public Verdict evaluate(ResourceType type, double used, double claimed, double spare) {
        double overusage = used - claimed;
        if (overusage <= 0) {
            return Verdict.WITHIN;
        }
        double ratio = claimed > 0 ? used / claimed : Double.POSITIVE_INFINITY;
        Limit limit = limits.get(type);
        if (ratio < limit.getIgnore()) {
            return Verdict.IGNORED;
        }
        if (type == ResourceType.TIME) {
            return spare > 0 ? Verdict.TOLERATED : Verdict.VIOLATION;
        }
        if (overusage < spare && ratio < limit.getAllowed()) {
            return Verdict.TOLERATED;
        }
        return Verdict.VIOLATION;
    }

    /**
     * Reason string reported for a violation
     */
    public static String reason(ResourceType type, double value) {
        return "Resource overusage for " + type.getKey() + ": " + value;
    }
}
