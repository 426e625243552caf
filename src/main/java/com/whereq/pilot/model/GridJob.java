package com.whereq.pilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A live job in the batch system
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridJob {
    /**
     * Batch system job id
     */
    private String gridQueueId;

    private GridJobStatus status;

    /**
     * Directory holding the loader the job executes
     */
    private String submitDir;

    /**
     * Execution site reported by the batch system, may be null
     */
    private String site;
}
