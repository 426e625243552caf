package com.whereq.pilot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pilot lifecycle states as seen by the batch system
 *
 * State transitions (driven by batch system queries only):
 * QUEUED → PROCESSING → {COMPLETED, ERROR, UNKNOWN}
 */
public enum GridJobStatus {
    /**
     * Waiting in the batch system for a slot
     */
    QUEUED("queued"),

    /**
     * Running, or suspended/transferring on a slot
     */
    PROCESSING("processing"),

    /**
     * Finished, not yet collected
     */
    COMPLETED("completed"),

    /**
     * Held by the batch system
     */
    ERROR("error"),

    /**
     * Native status with no translation, treated as alive
     */
    UNKNOWN("unknown");

    private final String value;

    GridJobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GridJobStatus fromValue(String value) {
        for (GridJobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
