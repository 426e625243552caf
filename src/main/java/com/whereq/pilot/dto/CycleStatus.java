package com.whereq.pilot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of the last reconcile and queue cycle
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CycleStatus {
    private Instant startedAt;

    private Instant finishedAt;

    /**
     * Pilots running in the batch system
     */
    private int processing;

    /**
     * Pilots waiting in the batch system
     */
    private int idle;

    private int pilotsDeleted;

    private int gridJobsRemoved;

    private int submitDirsCleaned;

    private int pilotsQueued;

    private int queueFailures;

    /**
     * Error of a failed cycle, null on success
     */
    private String error;
}
