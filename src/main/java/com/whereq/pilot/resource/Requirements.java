package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceRequirement;
import com.whereq.pilot.model.ResourceType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Sanitizing, rounding and grouping of task resource requirements.
 *
 * All functions are pure.
 */
@Slf4j
public final class Requirements {

    private static final int NOT_REQUESTED = Integer.MIN_VALUE;

    private Requirements() {
    }

    /**
     * Build a requirement from raw, possibly malformed input.
     *
     * Numeric strings are accepted. Unknown keys, nulls, blanks, negative and
     * unconvertible values are dropped.
     *
     * @param raw requirement map as stored with a task
     * @param useDefaults fill missing dimensions with the resource defaults
     */
    public static ResourceRequirement sanitize(Map<String, ?> raw, boolean useDefaults) {
        ResourceRequirement requirement = new ResourceRequirement();
        if (raw != null) {
            for (ResourceType type : ResourceType.values()) {
                Object value = raw.get(type.getKey());
                if (value == null) {
                    continue;
                }
                try {
                    double coerced = type.coerce(value);
                    if (coerced >= 0) {
                        requirement.set(type, coerced);
                    }
                } catch (IllegalArgumentException e) {
                    log.debug("dropping requirement {}: {}", type.getKey(), e.getMessage());
                }
            }
            List<String> os = sanitizeOs(raw.get("os"));
            if (!os.isEmpty()) {
                requirement.setOs(os);
            }
            Object site = raw.get("site");
            if (site instanceof String && !((String) site).isBlank()) {
                requirement.setSite(((String) site).trim());
            }
        }
        if (useDefaults) {
            for (ResourceType type : ResourceType.values()) {
                if (requirement.get(type) == null) {
                    requirement.set(type, type.getDefaultValue());
                }
            }
        }
        return requirement;
    }

    /**
     * Round every numeric dimension up to the smallest bin that holds it
     *
     * @throws IllegalArgumentException when a value is above the largest bin
     */
    public static ResourceRequirement round(ResourceRequirement requirement, RequirementBins bins) {
        RequirementBins edges = bins != null ? bins : RequirementBins.defaults();
        ResourceRequirement rounded = requirement.toBuilder()
            .os(requirement.getOs() == null ? null : new ArrayList<>(requirement.getOs()))
            .build();
        for (ResourceType type : ResourceType.values()) {
            Double value = requirement.get(type);
            List<Double> typeBins = edges.of(type);
            if (value == null || typeBins.isEmpty()) {
                continue;
            }
            Double bin = typeBins.stream()
                .filter(edge -> edge >= value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                    "%s value %s exceeds the largest bin %s",
                    type.getKey(), value, typeBins.get(typeBins.size() - 1))));
            rounded.set(type, bin);
        }
        return rounded;
    }

    public static ResourceRequirement round(ResourceRequirement requirement) {
        return round(requirement, RequirementBins.defaults());
    }

    /**
     * Hash a requirement into a coarse group.
     *
     * cpu and gpu count linearly, memory, disk and time by powers of two, os
     * by its sorted entries. Collisions only merge groups.
     */
    public static int groupHash(ResourceRequirement requirement) {
        List<String> os = requirement.getOs() == null
            ? List.of()
            : requirement.getOs().stream().sorted().collect(Collectors.toList());
        return Objects.hash(
            requirement.getCpu(),
            requirement.getGpu(),
            log2Bucket(requirement.getMemory()),
            log2Bucket(requirement.getDisk()),
            log2Bucket(requirement.getTime()),
            String.join(",", os));
    }

    /**
     * Count requirements per group, keyed by {@link #groupHash}
     */
    public static Map<Integer, Long> groupCounts(Collection<ResourceRequirement> requirements) {
        return requirements.stream()
            .collect(Collectors.groupingBy(Requirements::groupHash, LinkedHashMap::new, Collectors.counting()));
    }

    /**
     * Apply a config requirement on top of a task requirement.
     *
     * Numeric config values only raise the task's values, os and site replace.
     */
    public static ResourceRequirement merge(ResourceRequirement task, ResourceRequirement config) {
        ResourceRequirement merged = task == null ? new ResourceRequirement() : task.toBuilder().build();
        if (config == null) {
            return merged;
        }
        for (ResourceType type : ResourceType.values()) {
            Double configValue = config.get(type);
            if (configValue == null) {
                continue;
            }
            Double taskValue = merged.get(type);
            if (taskValue == null || taskValue < configValue) {
                merged.set(type, configValue);
            }
        }
        if (config.getOs() != null && !config.getOs().isEmpty()) {
            merged.setOs(new ArrayList<>(config.getOs()));
        }
        if (config.getSite() != null) {
            merged.setSite(config.getSite());
        }
        return merged;
    }

    private static int log2Bucket(Double value) {
        if (value == null || value <= 0) {
            return NOT_REQUESTED;
        }
        return Math.getExponent(value);
    }

    private static List<String> sanitizeOs(Object raw) {
        List<String> os = new ArrayList<>();
        if (raw instanceof String) {
            addIfPresent(os, (String) raw);
        } else if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                if (item instanceof String) {
                    addIfPresent(os, (String) item);
                }
            }
        }
        return os;
    }

    private static void addIfPresent(List<String> target, String value) {
        if (!value.isBlank()) {
            target.add(value.trim());
        }
    }
}
