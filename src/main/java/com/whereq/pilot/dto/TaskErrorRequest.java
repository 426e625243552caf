package com.whereq.pilot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error or kill report for a task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskErrorRequest {
    private String datasetId;

    /**
     * Classified failure reason
     */
    private String reason;

    /**
     * Resources the task was seen using
     */
    @Builder.Default
    private Map<String, Object> resources = new LinkedHashMap<>();

    private String site;

    /**
     * Free text detail, kills carry the pilot and host here
     */
    private String message;

    /**
     * The payload itself failed, not the node
     */
    private boolean failed;
}
