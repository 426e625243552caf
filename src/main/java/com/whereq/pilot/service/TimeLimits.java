package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.model.GridJobStatus;
import lombok.Value;

import java.time.Duration;

/**
 * Age limits of a pilot per batch status, measured from its submit date
 */
@Value
public class TimeLimits {
    Duration queued;

    /**
     * Queued plus processing time
     */
    Duration processing;

    /**
     * Queued plus processing plus the suspend time, also the submit dir retention
     */
    Duration all;

    public static TimeLimits from(PilotProperties.QueueConfig queue) {
        Duration queued = Duration.ofSeconds(queue.getMaxTaskQueuedTime());
        Duration processing = queued.plusSeconds(queue.getMaxTaskProcessingTime());
        Duration all = processing.plusSeconds(queue.getSuspendSubmitDirTime());
        return new TimeLimits(queued, processing, all);
    }

    public Duration of(GridJobStatus status) {
        return switch (status) {
            case QUEUED -> queued;
            case PROCESSING -> processing;
            case COMPLETED, ERROR, UNKNOWN -> all;
        };
    }
}
