package com.whereq.pilot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Pilot.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "pilot")
@Validated
@Data
public class PilotProperties {

    /**
     * Identity of this submitter, stamped on every batch job it owns.
     */
    private String siteId = "default";

    /**
     * Queue host name, the local FQDN when empty.
     */
    private String queueHost;

    @Valid
    private RestConfig rest = new RestConfig();

    @Valid
    private QueueConfig queue = new QueueConfig();

    @Valid
    private CycleConfig cycle = new CycleConfig();

    @Valid
    private LedgerConfig ledger = new LedgerConfig();

    @Data
    public static class RestConfig {
        /**
         * Base URL of the queue service.
         */
        @NotBlank
        private String url = "http://localhost:8080";

        /**
         * Bearer token for the queue service.
         */
        private String token;

        @Min(1)
        private int timeoutSeconds = 30;
    }

    @Data
    public static class QueueConfig {
        /**
         * Batch system to submit to.
         */
        @NotNull
        private BatchSystem type = BatchSystem.CONDOR;

        /**
         * Site name, also the default execution site of completions.
         */
        private String site;

        /**
         * Only take tasks that require this site.
         */
        private boolean exclusive = false;

        /**
         * Capacity envelope of one pilot (cpu, gpu, memory, disk, time).
         */
        private Map<String, Object> resources = new LinkedHashMap<>();

        /**
         * Extra submit descriptor options, "requirements" entries are and-ed together.
         */
        private Map<String, String> batchopts = new LinkedHashMap<>();

        /**
         * Root of the per-pilot submit directories.
         */
        private String submitDir = "/tmp/pilot-submit";

        /**
         * Loader script copied into every submit directory.
         */
        private String loaderScript;

        /**
         * Use container images instead of OS requirements.
         */
        private boolean singularity = true;

        /**
         * Seconds a pilot may stay queued.
         */
        private long maxTaskQueuedTime = 86400 * 2;

        /**
         * Seconds a pilot may run, added to the queued limit.
         */
        private long maxTaskProcessingTime = 86400 * 2;

        /**
         * Seconds a finished submit directory is kept.
         */
        private long suspendSubmitDirTime = 86400;

        /**
         * Ceiling of pilots in the batch system.
         */
        @Min(0)
        private int pilotsTaskMax = 1000;

        /**
         * Ceiling of idle pilots.
         */
        @Min(0)
        private int pilotsTaskIdle = 100;

        /**
         * Ceiling of pilots submitted per cycle.
         */
        @Min(0)
        private int pilotsPerCycle = 50;

        /**
         * Parallel per-task pipelines in one cycle.
         */
        @Min(1)
        private int concurrency = 10;

        @Min(1)
        private int submitAttempts = 3;

        @Min(0)
        private long submitBackoffMillis = 1000;

        /**
         * Days of batch history scanned for completions.
         */
        @Min(1)
        private int completionWindowDays = 4;

        /**
         * Timeout of a single batch system command.
         */
        @Min(1)
        private int commandTimeoutSeconds = 120;

        /**
         * Lifetime of the credential handed to a pilot.
         */
        private long credentialLifetimeSeconds = 86400 * 3;
    }

    @Data
    public static class CycleConfig {
        /**
         * Enable the scheduled reconcile and queue loop.
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one cycle and the start of the next.
         */
        private long intervalMillis = 300000;
    }

    @Data
    public static class LedgerConfig {
        /**
         * Build a node-local ledger and watch its claims.
         */
        private boolean enabled = false;

        /**
         * Shorter lookup intervals for debugging.
         */
        private boolean debug = false;

        /**
         * Explicit node totals, detected from the machine ad and environment when absent.
         */
        private Map<String, Object> resources = new LinkedHashMap<>();

        private long monitorIntervalMillis = 60000;
    }

    public enum BatchSystem {
        /**
         * HTCondor via condor_submit / condor_q / condor_history / condor_rm
         */
        CONDOR,

        /**
         * SLURM via sbatch / squeue / sacct / scancel
         */
        SLURM
    }
}
