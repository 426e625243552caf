package com.whereq.pilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sanitized resource requirement for a task or a site.
 *
 * Every dimension is optional, a null value means "not requested".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceRequirement implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Whole cores
     */
    private Integer cpu;

    /**
     * Number of gpu devices
     */
    private Integer gpu;

    /**
     * Memory in GB
     */
    private Double memory;

    /**
     * Disk in GB
     */
    private Double disk;

    /**
     * Wall time in hours
     */
    private Double time;

    /**
     * Acceptable OS / architecture strings, e.g. RHEL_7_x86_64
     */
    private List<String> os;

    /**
     * Site name restriction
     */
    private String site;

    /**
     * Get a numeric dimension, null if not requested
     */
    @JsonIgnore
    public Double get(ResourceType type) {
        return switch (type) {
            case CPU -> cpu == null ? null : cpu.doubleValue();
            case GPU -> gpu == null ? null : gpu.doubleValue();
            case MEMORY -> memory;
            case DISK -> disk;
            case TIME -> time;
        };
    }

    /**
     * Set a numeric dimension, integral dimensions are truncated
     */
    public void set(ResourceType type, Double value) {
        switch (type) {
            case CPU -> cpu = value == null ? null : value.intValue();
            case GPU -> gpu = value == null ? null : value.intValue();
            case MEMORY -> memory = value;
            case DISK -> disk = value;
            case TIME -> time = value;
        }
    }

    /**
     * First OS entry, or null
     */
    @JsonIgnore
    public String getPrimaryOs() {
        return os == null || os.isEmpty() ? null : os.get(0);
    }

    /**
     * Flatten into the plain map shape used by the queue service
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (ResourceType type : ResourceType.values()) {
            Double value = get(type);
            if (value != null) {
                map.put(type.getKey(), type.isIntegral() ? (Object) value.intValue() : (Object) value);
            }
        }
        if (os != null && !os.isEmpty()) {
            map.put("os", os);
        }
        if (site != null) {
            map.put("site", site);
        }
        return map;
    }
}
