package com.whereq.pilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task handed out by the queue service, enriched while a pilot is built for it
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskInfo {
    private String taskId;

    private String datasetId;

    private String jobId;

    private Integer taskIndex;

    /**
     * Task name, matches an entry in the dataset config
     */
    private String name;

    /**
     * Raw requirements as stored by the queue service
     */
    @Builder.Default
    private Map<String, Object> requirements = new LinkedHashMap<>();

    private String status;

    /**
     * Dataset number
     */
    @JsonIgnore
    private Integer dataset;

    @JsonIgnore
    private Integer jobIndex;

    @JsonIgnore
    private boolean debug;

    /**
     * Dataset config with the dataset options applied
     */
    @JsonIgnore
    private Map<String, Object> config;

    /**
     * The entry of config.tasks this task runs
     */
    @JsonIgnore
    private Map<String, Object> taskConfig;

    /**
     * Sanitized, merged and rounded requirement
     */
    @JsonIgnore
    private ResourceRequirement requirement;

    @JsonIgnore
    private Pilot pilot;

    @JsonIgnore
    private String submitDir;
}
