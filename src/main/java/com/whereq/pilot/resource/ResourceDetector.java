package com.whereq.pilot.resource;

import com.whereq.pilot.exception.BadResourceTypeException;
import com.whereq.pilot.model.ResourceType;
import com.whereq.pilot.model.ResourceVector;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Detects the resources allocated to this node.
 *
 * Each dimension is read from the HTCondor machine ad first, then from
 * environment variables, then falls back to the default. Auto-detected
 * memory, disk and time are trimmed by a small margin so usage never reaches
 * the hard limit.
 */
@Slf4j
public class ResourceDetector {

    public static final String MACHINE_AD = ".machine.ad";

    static final double MARGIN = 0.1;

    private final Path machineAd;

    private final Map<String, String> env;

    public ResourceDetector() {
        this(Path.of(MACHINE_AD), System.getenv());
    }

    public ResourceDetector(Path machineAd, Map<String, String> env) {
        this.machineAd = machineAd;
        this.env = env;
    }

    /**
     * Detect the node total, then apply explicit overrides as given
     *
     * @param overrides dimension name to quantity, applied without margin
     * @throws BadResourceTypeException for an unknown dimension in the overrides
     */
    public ResourceVector detect(Map<String, Object> overrides) {
        Map<String, String> ad = readMachineAd();

        ResourceVector total = ResourceVector.builder()
            .cpu(getCpus(ad))
            .gpu(getGpus(ad))
            .memory(getMemory(ad) - MARGIN)
            .disk(getDisk(ad) - MARGIN)
            .time(getTime(ad) - MARGIN)
            .build();

        if (overrides != null) {
            for (Map.Entry<String, Object> entry : overrides.entrySet()) {
                ResourceType type = ResourceType.fromKey(entry.getKey())
                    .orElseThrow(() -> new BadResourceTypeException("bad resource type: " + entry.getKey()));
                applyOverride(total, type, entry.getValue());
            }
        }
        log.info("detected resources: {}", total);
        return total;
    }

    int getCpus(Map<String, String> ad) {
        Optional<Integer> cpus = fromAd(ad, "totalcpus", v -> (int) Double.parseDouble(v))
            .or(() -> fromEnv("NUM_CPUS", v -> (int) Double.parseDouble(v)))
            .filter(v -> v > 0);
        return cpus.orElse((int) ResourceType.CPU.getDefaultValue());
    }

    List<String> getGpus(Map<String, String> ad) {
        Optional<List<String>> gpus = fromAd(ad, "assignedgpus", ResourceDetector::splitIds)
            .or(() -> fromEnv("CUDA_VISIBLE_DEVICES", ResourceDetector::splitIds))
            .or(() -> fromEnv("GPU_DEVICE_ORDINAL", ResourceDetector::splitIds))
            .or(() -> fromEnv("_CONDOR_AssignedGPUs", ResourceDetector::splitIds))
            .or(() -> fromEnv("NUM_GPUS", v -> IntStream.range(0, Integer.parseInt(v.trim()))
                .mapToObj(String::valueOf)
                .collect(Collectors.toList())))
            .filter(list -> !list.isEmpty());
        return gpus.orElseGet(ArrayList::new);
    }

    double getMemory(Map<String, String> ad) {
        return fromAd(ad, "totalmemory", v -> Double.parseDouble(v) / 1000.0)
            .or(() -> fromEnv("NUM_MEMORY", Double::parseDouble))
            .filter(v -> v > 0)
            .orElse(ResourceType.MEMORY.getDefaultValue());
    }

    double getDisk(Map<String, String> ad) {
        return fromAd(ad, "totaldisk", v -> Double.parseDouble(v) / 1_000_000.0)
            .or(() -> fromEnv("NUM_DISK", Double::parseDouble))
            .filter(v -> v > 0)
            .orElse(ResourceType.DISK.getDefaultValue());
    }

    double getTime(Map<String, String> ad) {
        return fromAd(ad, "timetolive", v -> Double.parseDouble(v) / 3600.0)
            .or(() -> fromEnv("NUM_TIME", Double::parseDouble))
            .filter(v -> v > 0)
            .orElse(ResourceType.TIME.getDefaultValue());
    }

    /**
     * Read "key = value" lines, keys lowercased
     */
    Map<String, String> readMachineAd() {
        Map<String, String> ad = new LinkedHashMap<>();
        if (machineAd == null || !Files.isRegularFile(machineAd)) {
            return ad;
        }
        try {
            for (String line : Files.readAllLines(machineAd, StandardCharsets.UTF_8)) {
                int eq = line.indexOf('=');
                if (eq > 0) {
                    ad.putIfAbsent(line.substring(0, eq).trim().toLowerCase(Locale.ROOT), line.substring(eq + 1).trim());
                }
            }
        } catch (IOException e) {
            log.warn("cannot read machine ad {}: {}", machineAd, e.getMessage());
        }
        return ad;
    }

    private <T> Optional<T> fromAd(Map<String, String> ad, String key, Function<String, T> parser) {
        return parse(ad.get(key), parser, "machine ad " + key);
    }

    private <T> Optional<T> fromEnv(String name, Function<String, T> parser) {
        return parse(env.get(name), parser, name);
    }

    private static <T> Optional<T> parse(String raw, Function<String, T> parser, String source) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            T value = parser.apply(raw.trim());
            log.info("got {} from {}", value, source);
            return Optional.ofNullable(value);
        } catch (RuntimeException e) {
            log.debug("unreadable {} value: {}", source, raw);
            return Optional.empty();
        }
    }

    private static List<String> splitIds(String raw) {
        return Arrays.stream(raw.replace("\"", "").split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static void applyOverride(ResourceVector total, ResourceType type, Object raw) {
        if (type == ResourceType.GPU && raw instanceof Collection) {
            List<String> ids = ((Collection<?>) raw).stream().map(String::valueOf).collect(Collectors.toList());
            total.setGpu(ids);
            return;
        }
        double value;
        try {
            value = type.coerce(raw);
        } catch (IllegalArgumentException e) {
            throw new BadResourceTypeException(e.getMessage(), e);
        }
        switch (type) {
            case CPU -> total.setCpu((int) value);
            case GPU -> total.setGpu(IntStream.range(0, (int) value)
                .mapToObj(String::valueOf)
                .collect(Collectors.toList()));
            case MEMORY -> total.setMemory(value);
            case DISK -> total.setDisk(value);
            case TIME -> total.setTime(value);
        }
    }
}
