package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceVector;
import lombok.AccessLevel;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Resources held by one task.
 *
 * The claimed vector never changes after creation. Time is kept as an
 * absolute deadline.
 */
@Getter
public class Claim {
    private final String taskId;

    private final ResourceVector resources;

    private final Instant claimedAt;

    private final Instant deadline;

    /**
     * Root of the task's process tree, null until registered
     */
    private Long pid;

    private Path workDir;

    @Getter(AccessLevel.NONE)
    private UsageHistory history;

    @Getter(AccessLevel.NONE)
    private UsageStats stats;

    Claim(String taskId, ResourceVector resources, Instant claimedAt, Instant deadline) {
        this.taskId = taskId;
        this.resources = resources;
        this.claimedAt = claimedAt;
        this.deadline = deadline;
    }

    void register(long pid, Path workDir) {
        this.pid = pid;
        this.workDir = workDir;
    }

    /**
     * Root pid and the last known children, empty before registration
     */
    List<Long> trackedPids() {
        List<Long> pids = new ArrayList<>();
        if (pid == null) {
            return pids;
        }
        pids.add(pid);
        if (history != null) {
            synchronized (history) {
                pids.addAll(history.getChildren());
            }
        }
        return pids;
    }

    UsageHistory historyOrCreate(int window, Instant createTime) {
        if (history == null) {
            history = new UsageHistory(window, createTime);
        }
        return history;
    }

    UsageStats getStatsIfPresent() {
        return stats;
    }

    UsageStats statsOrCreate() {
        if (stats == null) {
            stats = new UsageStats();
        }
        return stats;
    }
}
