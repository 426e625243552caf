package com.whereq.pilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A job that left the batch system inside the completion window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridCompletion {

    public enum Outcome {
        OK,
        ERROR
    }

    private String gridQueueId;

    private Outcome outcome;

    private String submitDir;

    /**
     * Execution site, null when the batch system did not record one
     */
    private String site;

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
