package com.whereq.pilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pilot record shared with the queue service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Pilot {
    private static final DateTimeFormatter SUBMIT_DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    /**
     * Allocated by the queue service on creation
     */
    private String pilotId;

    /**
     * Identity of the submitter owning this pilot
     */
    private String queueHost;

    private String queueVersion;

    /**
     * Site name
     */
    private String host;

    /**
     * Batch job ids, comma separated when one submission produced several
     */
    private String gridQueueId;

    /**
     * Site envelope the pilot was sized from
     */
    @Builder.Default
    private Map<String, Object> resources = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> resourcesAvailable = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> resourcesClaimed = new LinkedHashMap<>();

    @Builder.Default
    private List<String> tasks = new ArrayList<>();

    private String submitDir;

    /**
     * UTC timestamp, ISO format with optional fraction and no zone
     */
    private String submitDate;

    private String version;

    /**
     * Every batch job id this pilot owns
     */
    @JsonIgnore
    public List<String> getGridQueueIds() {
        if (gridQueueId == null || gridQueueId.isBlank()) {
            return List.of();
        }
        return Arrays.stream(gridQueueId.split(","))
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .toList();
    }

    /**
     * First task id, or null for an empty pilot
     */
    @JsonIgnore
    public String getFirstTask() {
        return tasks == null || tasks.isEmpty() ? null : tasks.get(0);
    }

    /**
     * Parse the submit date, null if absent
     */
    @JsonIgnore
    public Instant getSubmitInstant() {
        if (submitDate == null || submitDate.isBlank()) {
            return null;
        }
        return LocalDateTime.parse(submitDate, SUBMIT_DATE_FORMAT).toInstant(ZoneOffset.UTC);
    }
}
