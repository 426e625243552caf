package com.whereq.pilot.resource;

import com.whereq.pilot.exception.BadResourceTypeException;
import com.whereq.pilot.exception.InsufficientResourceException;
import com.whereq.pilot.exception.ResourceException;
import com.whereq.pilot.model.ResourceType;
import com.whereq.pilot.model.ResourceUsage;
import com.whereq.pilot.model.ResourceVector;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node-local accounting of total, available and claimed resources.
 *
 * One ledger belongs to one pilot process. Claims and releases are serialized
 * on a single lock, usage measurements read the claim under the lock and
 * measure outside of it.
 */
@Slf4j
public class ResourceLedger {

    public static final int DEFAULT_WINDOW = 10;

    /**
     * Order in which a claim's dimensions are checked, the first violation wins
     */
    static final List<ResourceType> CHECK_ORDER = List.of(
        ResourceType.CPU, ResourceType.MEMORY, ResourceType.DISK, ResourceType.GPU, ResourceType.TIME);

    private static final double HOUR_MILLIS = 3_600_000.0;

    private static final String NO_GPU = "9999";

    private final Object lock = new Object();

    private final Clock clock;
    private final ProcessProbe processProbe;
    private final GpuProbe gpuProbe;
    private final OverusagePolicy overusagePolicy;
    private final LookupIntervals lookupIntervals;
    private final int window;

    private final ResourceVector total;
    private final Instant deadline;
    private final ResourceVector available;
    private final Map<String, Claim> claims = new LinkedHashMap<>();

    public ResourceLedger(ResourceVector total) {
        this(total, null, null, null, null, null, null);
    }

    @Builder
    private ResourceLedger(ResourceVector total, Clock clock, ProcessProbe processProbe, GpuProbe gpuProbe,
                           OverusagePolicy overusagePolicy, LookupIntervals lookupIntervals, Integer window) {
        if (total == null) {
            throw new IllegalArgumentException("total resources are required");
        }
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.processProbe = processProbe != null ? processProbe : new OshiProcessProbe();
        this.gpuProbe = gpuProbe != null ? gpuProbe : new NvidiaSmiGpuProbe();
        this.overusagePolicy = overusagePolicy != null ? overusagePolicy : OverusagePolicy.defaults();
        this.lookupIntervals = lookupIntervals != null ? lookupIntervals : LookupIntervals.defaults();
        this.window = window != null ? window : DEFAULT_WINDOW;

        this.total = total.copy();
        this.deadline = this.clock.instant().plusMillis(Math.round(total.getTime() * HOUR_MILLIS));
        this.available = total.copy();
        this.available.setTime(0);

        log.info("total resources: cpu={}, gpu={}, memory={} GB, disk={} GB, time={} h",
            total.getCpu(), total.getGpu(), total.getMemory(), total.getDisk(), total.getTime());
    }

    /**
     * Claim resources for a task.
     *
     * @param taskId claimant, at most one claim per task
     * @param requested dimension name to quantity, null or empty claims everything available
     * @return the granted resources, time relative to now
     * @throws BadResourceTypeException for an unknown dimension or unconvertible value
     * @throws InsufficientResourceException when a dimension exceeds what is available
     */
    public ResourceVector claim(String taskId, Map<String, Object> requested) {
        synchronized (lock) {
            if (claims.containsKey(taskId)) {
                throw new IllegalStateException("task " + taskId + " already holds a claim");
            }
            Instant now = clock.instant();
            ResourceVector granted;
            Instant claimDeadline = deadline;

            if (requested == null || requested.isEmpty()) {
                log.info("claiming all available resources for {}", taskId);
                granted = available.copy();
            } else {
                log.info("task {} asking for {}", taskId, requested);
                granted = ResourceVector.empty();
                for (Map.Entry<String, Object> entry : requested.entrySet()) {
                    ResourceType type = ResourceType.fromKey(entry.getKey())
                        .orElseThrow(() -> new BadResourceTypeException("bad resource type: " + entry.getKey()));
                    double value = coerce(type, entry.getValue());

                    switch (type) {
                        case TIME -> {
                            double remaining = hoursBetween(now, deadline);
                            if (value > remaining) {
                                throw insufficient(type, value, remaining);
                            }
                            if (value > 0) {
                                claimDeadline = now.plusMillis(Math.round(value * HOUR_MILLIS));
                            }
                        }
                        case GPU -> {
                            int count = (int) value;
                            if (count > available.getGpu().size()) {
                                throw insufficient(type, count, available.getGpu().size());
                            }
                            if (count > 0) {
                                granted.setGpu(new ArrayList<>(available.getGpu().subList(0, count)));
                            }
                        }
                        default -> {
                            if (value > available.quantity(type)) {
                                throw insufficient(type, value, available.quantity(type));
                            }
                            if (value > 0) {
                                setQuantity(granted, type, value);
                            }
                        }
                    }
                }
            }

            // The claim is valid, take it out of available
            available.setCpu(available.getCpu() - granted.getCpu());
            available.getGpu().removeAll(granted.getGpu());
            available.setMemory(available.getMemory() - granted.getMemory());
            available.setDisk(available.getDisk() - granted.getDisk());

            granted.setTime(0);
            claims.put(taskId, new Claim(taskId, granted.copy(), now, claimDeadline));

            ResourceVector result = granted.copy();
            result.setTime(hoursBetween(now, claimDeadline));
            log.info("granted {} to {}", result, taskId);
            return result;
        }
    }

    /**
     * Return a claim to available and forget its usage history
     */
    public void release(String taskId) {
        synchronized (lock) {
            Claim claim = claims.remove(taskId);
            if (claim == null) {
                log.warn("release: task {} has no claim", taskId);
                return;
            }
            ResourceVector resources = claim.getResources();
            available.setCpu(available.getCpu() + resources.getCpu());
            available.getGpu().addAll(resources.getGpu());
            available.setMemory(available.getMemory() + resources.getMemory());
            available.setDisk(available.getDisk() + resources.getDisk());
            log.info("released {} from {}", resources, taskId);
            List<Long> pids = claim.trackedPids();
            if (!pids.isEmpty()) {
                processProbe.forget(pids);
            }
        }
    }

    /**
     * Attach the process tree and working directory of an already claimed task
     */
    public void registerProcess(String taskId, long pid, Path workDir) {
        synchronized (lock) {
            Claim claim = claims.get(taskId);
            if (claim == null) {
                log.warn("register: task {} has no claim", taskId);
                return;
            }
            claim.register(pid, workDir);
        }
    }

    /**
     * Measure what a claim's process tree is using.
     *
     * Dimensions whose lookup interval has not elapsed report cached values.
     *
     * @param force re-measure everything now
     * @throws ResourceException for an unknown claim or one without a process or directory
     */
    public ResourceUsage getUsage(String taskId, boolean force) {
        long pid;
        Path workDir;
        List<String> gpus;
        UsageHistory history;
        synchronized (lock) {
            Claim claim = claims.get(taskId);
            if (claim == null) {
                throw new ResourceException("unknown claim for " + taskId);
            }
            if (claim.getPid() == null) {
                throw new ResourceException("no process to examine for " + taskId);
            }
            if (claim.getWorkDir() == null) {
                throw new ResourceException("no working directory to examine for " + taskId);
            }
            pid = claim.getPid();
            workDir = claim.getWorkDir();
            gpus = new ArrayList<>(claim.getResources().getGpu());
            history = claim.historyOrCreate(window,
                processProbe.startTime(pid).orElse(claim.getClaimedAt()));
        }
        return measure(history, pid, workDir, gpus, force);
    }

    private ResourceUsage measure(UsageHistory history, long pid, Path workDir, List<String> gpus, boolean force) {
        synchronized (history) {
            Instant now = clock.instant();

            if (history.childrenDue(now, lookupIntervals.getChildren(), force)) {
                List<Long> children = processProbe.descendants(pid);
                List<Long> gone = new ArrayList<>(history.getChildren());
                gone.removeAll(children);
                if (!gone.isEmpty()) {
                    processProbe.forget(gone);
                }
                history.setChildren(children);
                log.debug("children of {}: {}", pid, history.getChildren());
            }

            boolean cpuDue = history.due(ResourceType.CPU, now, lookupIntervals.getCpu(), force);
            boolean memoryDue = history.due(ResourceType.MEMORY, now, lookupIntervals.getMemory(), force);
            boolean diskDue = history.due(ResourceType.DISK, now, lookupIntervals.getDisk(), force);
            boolean gpuDue = history.due(ResourceType.GPU, now, lookupIntervals.getGpu(), force);

            if (cpuDue || memoryDue) {
                List<Long> pids = new ArrayList<>();
                pids.add(pid);
                pids.addAll(history.getChildren());
                double cpu = 0;
                long rss = 0;
                int sampled = 0;
                for (long p : pids) {
                    Optional<ProcessProbe.Sample> sample = processProbe.sample(p);
                    if (sample.isPresent()) {
                        cpu += sample.get().getCpu();
                        rss += sample.get().getRssBytes();
                        sampled++;
                    }
                }
                if (sampled > 0) {
                    if (cpuDue) {
                        history.record(ResourceType.CPU, cpu);
                    }
                    if (memoryDue) {
                        history.record(ResourceType.MEMORY, rss / 1e9);
                    }
                }
            }

            if (diskDue) {
                history.record(ResourceType.DISK, DiskUsage.du(workDir) / 1e9);
            }

            if (gpuDue) {
                double utilization = 0;
                for (String device : new LinkedHashSet<>(gpus)) {
                    int value = gpuProbe.utilization(device.replaceAll("[^0-9,]", ""));
                    if (value != -1) {
                        utilization += value;
                    }
                }
                history.record(ResourceType.GPU, utilization / 100.0);
            }

            ResourceUsage usage = new ResourceUsage();
            for (ResourceType type : List.of(ResourceType.CPU, ResourceType.MEMORY, ResourceType.DISK, ResourceType.GPU)) {
                usage.set(type, history.value(type));
            }
            usage.setTime(hoursBetween(history.getCreateTime(), now));
            return usage;
        }
    }

    /**
     * Check every claim for overusage.
     *
     * Claims whose usage cannot be measured are skipped.
     *
     * @param force re-measure everything now
     * @return task id to violation reason
     */
    public Map<String, String> checkClaims(boolean force) {
        List<String> taskIds;
        synchronized (lock) {
            taskIds = new ArrayList<>(claims.keySet());
        }

        Map<String, String> violations = new LinkedHashMap<>();
        for (String taskId : taskIds) {
            ResourceUsage usage;
            try {
                usage = getUsage(taskId, force);
                log.debug("{} is using {}", taskId, usage);
            } catch (RuntimeException e) {
                log.warn("error getting usage for {}: {}", taskId, e.getMessage());
                continue;
            }

            Instant now = clock.instant();
            Claim claim;
            ResourceVector spare;
            synchronized (lock) {
                claim = claims.get(taskId);
                if (claim == null) {
                    continue;
                }
                spare = available.copy();
            }

            for (ResourceType type : CHECK_ORDER) {
                double used;
                double claimed;
                double free;
                if (type == ResourceType.TIME) {
                    used = hoursBetween(claim.getClaimedAt(), now);
                    claimed = hoursBetween(claim.getClaimedAt(), claim.getDeadline());
                    free = hoursBetween(now, deadline);
                } else {
                    used = usage.get(type);
                    claimed = claim.getResources().quantity(type);
                    free = spare.quantity(type);
                }

                OverusagePolicy.Verdict verdict = overusagePolicy.evaluate(type, used, claimed, free);
                if (verdict == OverusagePolicy.Verdict.IGNORED) {
                    log.info("ignoring overusage of {} for {}", type.getKey(), taskId);
                } else if (verdict == OverusagePolicy.Verdict.TOLERATED) {
                    log.info("manageable overusage of {} for {}", type.getKey(), taskId);
                } else if (verdict.isViolation()) {
                    String reason = OverusagePolicy.reason(type, usage.get(type));
                    log.warn("task {}: {}", taskId, reason);
                    violations.put(taskId, reason);
                    break;
                }
            }

            synchronized (lock) {
                UsageStats stats = claim.statsOrCreate();
                for (ResourceType type : CHECK_ORDER) {
                    stats.record(type, usage.get(type));
                }
            }
        }
        return violations;
    }

    /**
     * Peak usage seen by {@link #checkClaims(boolean)}, empty if never checked
     */
    public Optional<ResourceUsage> getPeak(String taskId) {
        synchronized (lock) {
            Claim claim = claims.get(taskId);
            if (claim == null || claim.getStatsIfPresent() == null) {
                return Optional.empty();
            }
            return Optional.of(claim.getStatsIfPresent().peak());
        }
    }

    /**
     * Usage to report when a task ends: gpu as its average, the rest as their peak
     */
    public Optional<ResourceUsage> getFinal(String taskId) {
        synchronized (lock) {
            Claim claim = claims.get(taskId);
            if (claim == null || claim.getStatsIfPresent() == null) {
                return Optional.empty();
            }
            return Optional.of(claim.getStatsIfPresent().last());
        }
    }

    /**
     * Unclaimed resources, time as hours left on this node
     */
    public ResourceVector getAvailable() {
        synchronized (lock) {
            ResourceVector result = available.copy();
            result.setTime(hoursBetween(clock.instant(), deadline));
            return result;
        }
    }

    public ResourceVector getTotal() {
        return total.copy();
    }

    /**
     * Sum of all claims, time as the longest remaining claim
     */
    public ResourceVector getClaimed() {
        synchronized (lock) {
            Instant now = clock.instant();
            ResourceVector sum = ResourceVector.empty();
            double time = 0;
            for (Claim claim : claims.values()) {
                ResourceVector resources = claim.getResources();
                sum.setCpu(sum.getCpu() + resources.getCpu());
                sum.getGpu().addAll(resources.getGpu());
                sum.setMemory(sum.getMemory() + resources.getMemory());
                sum.setDisk(sum.getDisk() + resources.getDisk());
                time = Math.max(time, hoursBetween(now, claim.getDeadline()));
            }
            sum.setTime(time);
            return sum;
        }
    }

    /**
     * Task ids holding a claim
     */
    public Set<String> getClaimIds() {
        synchronized (lock) {
            return new LinkedHashSet<>(claims.keySet());
        }
    }

    /**
     * Registered process of a claim
     */
    public Optional<Long> getProcessId(String taskId) {
        synchronized (lock) {
            Claim claim = claims.get(taskId);
            return claim == null ? Optional.empty() : Optional.ofNullable(claim.getPid());
        }
    }

    /**
     * Environment a task needs to see only its own gpus
     */
    public static Map<String, String> environmentFor(ResourceVector claim) {
        String devices = NO_GPU;
        if (claim != null && !claim.getGpu().isEmpty()) {
            devices = claim.getGpu().stream()
                .distinct()
                .map(id -> id.replaceAll("[^0-9,]", ""))
                .collect(Collectors.joining(","));
        }
        Map<String, String> env = new LinkedHashMap<>();
        env.put("CUDA_VISIBLE_DEVICES", devices);
        env.put("GPU_DEVICE_ORDINAL", devices);
        return env;
    }

    private static double coerce(ResourceType type, Object raw) {
        try {
            return type.coerce(raw);
        } catch (IllegalArgumentException e) {
            throw new BadResourceTypeException(e.getMessage(), e);
        }
    }

    private static InsufficientResourceException insufficient(ResourceType type, double requested, double available) {
        return new InsufficientResourceException(String.format(
            "not enough %s resources available: %s > %s", type.getKey(), requested, available));
    }

    private static void setQuantity(ResourceVector vector, ResourceType type, double value) {
        switch (type) {
            case CPU -> vector.setCpu((int) value);
            case MEMORY -> vector.setMemory(value);
            case DISK -> vector.setDisk(value);
            default -> throw new IllegalArgumentException("not a scalar dimension: " + type.getKey());
        }
    }

    private static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / HOUR_MILLIS;
    }
}
