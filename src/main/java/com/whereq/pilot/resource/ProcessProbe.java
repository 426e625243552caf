package com.whereq.pilot.resource;

import lombok.Value;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Reads process level metrics from the operating system
 */
public interface ProcessProbe {

    /**
     * One measurement of one process
     */
    @Value
    class Sample {
        /**
         * Cores in use since the previous sample of this pid (1.0 = one core)
         */
        double cpu;

        /**
         * Resident set size
         */
        long rssBytes;
    }

    /**
     * All descendants of a process, recursively
     */
    List<Long> descendants(long pid);

    /**
     * Sample a process, empty if it is gone
     */
    Optional<Sample> sample(long pid);

    /**
     * Creation time of a process, empty if it is gone
     */
    Optional<Instant> startTime(long pid);

    /**
     * Drop any state kept between samples of processes that are no longer tracked
     */
    void forget(Collection<Long> pids);
}
