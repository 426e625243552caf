package com.whereq.pilot.model;

import java.util.Collection;
import java.util.Optional;

/**
 * Resource dimensions tracked for nodes, pilots and tasks.
 *
 * Declaration order is the matching priority: gpu, memory, disk, time, cpu.
 */
public enum ResourceType {
    /**
     * Fungible devices, quantity is the number of device ids
     */
    GPU("gpu", Kind.DEVICES, 0),

    /**
     * Memory in GB
     */
    MEMORY("memory", Kind.REAL, 1.0),

    /**
     * Scratch disk in GB
     */
    DISK("disk", Kind.REAL, 10.0),

    /**
     * Wall time in hours
     */
    TIME("time", Kind.REAL, 1.0),

    /**
     * Whole cores
     */
    CPU("cpu", Kind.INTEGER, 1);

    public enum Kind {
        INTEGER,
        REAL,
        DEVICES
    }

    private final String key;
    private final Kind kind;
    private final double defaultValue;

    ResourceType(String key, Kind kind, double defaultValue) {
        this.key = key;
        this.kind = kind;
        this.defaultValue = defaultValue;
    }

    public String getKey() {
        return key;
    }

    public Kind getKind() {
        return kind;
    }

    public double getDefaultValue() {
        return defaultValue;
    }

    public boolean isIntegral() {
        return kind != Kind.REAL;
    }

    /**
     * Look up a dimension by its lowercase name
     */
    public static Optional<ResourceType> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (ResourceType type : values()) {
            if (type.key.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Coerce a raw value to this dimension's declared type.
     *
     * Integral dimensions truncate, device dimensions also accept a collection
     * and use its size.
     *
     * @param raw number, numeric string or (for gpu) a collection
     * @return the coerced quantity
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public double coerce(Object raw) {
        double value;
        if (raw instanceof Collection && kind == Kind.DEVICES) {
            value = ((Collection<?>) raw).size();
        } else if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String && !((String) raw).isBlank()) {
            try {
                value = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("bad value for " + key + ": " + raw, e);
            }
        } else {
            throw new IllegalArgumentException("bad value for " + key + ": " + raw);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("bad value for " + key + ": " + raw);
        }
        return isIntegral() ? (long) value : value;
    }
}
