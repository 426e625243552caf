package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.dto.CycleStatus;
import com.whereq.pilot.executor.BatchAdapter;
import com.whereq.pilot.model.Pilot;
import com.whereq.pilot.model.ResourceRequirement;
import com.whereq.pilot.model.ResourceType;
import com.whereq.pilot.model.RetryPolicy;
import com.whereq.pilot.model.TaskInfo;
import com.whereq.pilot.queue.TaskQueueClient;
import com.whereq.pilot.resource.Requirements;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Phase B of a cycle: claims tasks from the queue service and submits one
 * pilot per task, within the configured pilot ceilings.
 *
 * A failure in one task's pipeline is reported for that task and cleaned up,
 * it never stops the other tasks. A failed claim fails the whole cycle.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class PilotSubmitter {

    private static final List<ResourceType> CLAIMED_TYPES =
        List.of(ResourceType.CPU, ResourceType.GPU, ResourceType.MEMORY, ResourceType.DISK);

    @Autowired
    private TaskQueueClient queueClient;

    @Autowired
    private BatchAdapterFactory adapterFactory;

    @Autowired
    private LogCollector logCollector;

    @Autowired
    private TaskOutcomeReporter outcomeReporter;

    @Autowired
    private SubmitDirectoryManager submitDirs;

    @Autowired
    private QueueEnvelope envelope;

    @Autowired
    private PilotProperties properties;

    /**
     * Number of pilots to queue given the current pilot counts, never negative
     */
    int queueNum(int processing, int idle) {
        PilotProperties.QueueConfig queue = properties.getQueue();
        int num = Math.min(queue.getPilotsTaskMax() - processing - idle, queue.getPilotsTaskIdle() - idle);
        num = Math.min(num, queue.getPilotsPerCycle());
        return Math.max(num, 0);
    }

    /**
     * Claim and submit tasks
     *
     * @param status result of this cycle's reconcile, provides the pilot counts
     * @return Mono with the status extended by the queue counts
     */
    public Mono<CycleStatus> queue(CycleStatus status) {
        int queueNum = queueNum(status.getProcessing(), status.getIdle());
        Map<String, Object> requirements = envelope.getResources();
        Map<String, Object> queryParams = envelope.getQueryParams();
        log.info("attempting to queue {} tasks, with requirements {} and query params {}", queueNum, requirements, queryParams);

        DatasetCache cache = new DatasetCache();
        return Flux.range(0, queueNum)
            .concatMap(i -> queueClient.claimTask(requirements, queryParams)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty()))
            .takeWhile(task -> {
                if (task.isEmpty()) {
                    log.info("no more tasks to queue");
                }
                return task.isPresent();
            })
            .map(Optional::get)
            .flatMap(task -> makePilot(task, cache)
                    .thenReturn(true)
                    .onErrorResume(e -> handleFailure(task, e).thenReturn(false)),
                properties.getQueue().getConcurrency())
            .collectList()
            .map(results -> {
                int queued = (int) results.stream().filter(Boolean::booleanValue).count();
                int failures = results.size() - queued;
                log.info("queued {} pilots, {} failures", queued, failures);
                return status.toBuilder()
                    .pilotsQueued(queued)
                    .queueFailures(failures)
                    .build();
            });
    }

    /**
     * Per-task pipeline: context, pilot record, submit dir, credential, descriptor, submit, register
     */
    Mono<Void> makePilot(TaskInfo task, DatasetCache cache) {
        BatchAdapter adapter = adapterFactory.getAdapter();
        return Mono.zip(queueClient.getJob(task.getJobId()),
                cache.dataset(task.getDatasetId()),
                cache.config(task.getDatasetId()))
            .switchIfEmpty(Mono.error(() ->
                new IllegalStateException("missing job, dataset or config for " + task.getTaskId())))
            .flatMap(context -> {
                enrich(task, context.getT1(), context.getT2(), context.getT3());
                Pilot pilot = buildPilot(task.getTaskId(), task.getRequirement());
                task.setPilot(pilot);
                return queueClient.createPilot(pilot)
                    .switchIfEmpty(Mono.error(() ->
                        new IllegalStateException("no pilot id returned for " + task.getTaskId())));
            })
            .flatMap(pilotId -> {
                task.getPilot().setPilotId(pilotId);
                return blocking(() -> submitDirs.create(task));
            })
            .flatMap(dir -> {
                task.setSubmitDir(dir.toString());
                task.getPilot().setSubmitDir(dir.toString());
                Duration lifetime = Duration.ofSeconds(properties.getQueue().getCredentialLifetimeSeconds());
                return queueClient.issueCredential(task.getPilot().getPilotId(), task.getTaskId(), lifetime)
                    .flatMap(token -> blocking(() -> submitDirs.writeCredential(dir, token)))
                    .map(file -> Optional.of(file.getFileName().toString()))
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(credential -> blocking(() ->
                        adapter.renderSubmitDescriptor(task, credential.orElse(null), submitDirs.inputFiles(dir))))
                    .then(blocking(() -> adapter.submit(dir)).retryWhen(submitRetry().toRetry()));
            })
            .flatMap(gridQueueId -> {
                log.info("submitted task {} as grid job {}", task.getTaskId(), gridQueueId);
                task.getPilot().setGridQueueId(gridQueueId);
                Map<String, Object> update = new LinkedHashMap<>();
                update.put("grid_queue_id", gridQueueId);
                update.put("submit_dir", task.getSubmitDir());
                return queueClient.updatePilot(task.getPilot().getPilotId(), update);
            });
    }

    /**
     * Fill in job, dataset and config context, and the final resource requirement
     */
    void enrich(TaskInfo task, Map<String, Object> job, Map<String, Object> dataset, Map<String, Object> datasetConfig) {
        Map<String, Object> config = new LinkedHashMap<>(datasetConfig);
        config.put("dataset", dataset.get("dataset"));
        task.setConfig(config);
        task.setDataset(asInteger(dataset.get("dataset")));
        task.setJobIndex(asInteger(job.get("job_index")));
        task.setDebug(Boolean.TRUE.equals(dataset.get("debug")));

        Map<String, Object> taskConfig = findTaskConfig(config, task.getName())
            .orElseThrow(() -> new IllegalStateException("cannot find task in config for " + task.getTaskId()));
        task.setTaskConfig(taskConfig);

        ResourceRequirement requirement = task.getRequirements() != null && !task.getRequirements().isEmpty()
            ? Requirements.sanitize(task.getRequirements(), false)
            : Requirements.sanitize(envelope.getResources(), false);
        Object configRequirements = taskConfig.get("requirements");
        if (configRequirements instanceof Map) {
            requirement = Requirements.merge(requirement,
                Requirements.sanitize(stringKeys((Map<?, ?>) configRequirements), false));
        }
        task.setRequirement(Requirements.round(requirement));
    }

    /**
     * Pilot record for one task, available is what the envelope has left after the task
     */
    Pilot buildPilot(String taskId, ResourceRequirement requirement) {
        Map<String, Object> resources = new LinkedHashMap<>(envelope.getResources());
        Map<String, Object> available = new LinkedHashMap<>();
        Map<String, Object> claimed = new LinkedHashMap<>();
        available.put(ResourceType.TIME.getKey(), resources.getOrDefault(ResourceType.TIME.getKey(), 1));
        for (ResourceType type : CLAIMED_TYPES) {
            Double required = requirement == null ? null : requirement.get(type);
            Double offered = asDouble(resources.get(type.getKey()));
            if (required != null && offered != null) {
                available.put(type.getKey(), offered - required);
            } else {
                available.put(type.getKey(), 0);
            }
            if (required != null) {
                claimed.put(type.getKey(), required);
            } else if (offered != null) {
                claimed.put(type.getKey(), offered);
            } else {
                claimed.put(type.getKey(), 0);
            }
        }
        List<String> tasks = new ArrayList<>();
        tasks.add(taskId);
        return Pilot.builder()
            .resources(resources)
            .resourcesAvailable(available)
            .resourcesClaimed(claimed)
            .tasks(tasks)
            .queueHost(envelope.getQueueHost())
            .queueVersion(envelope.getVersion())
            .host(envelope.getSite())
            .version(envelope.getVersion())
            .build();
    }

    /**
     * Report a failed pipeline and undo what it created
     */
    Mono<Void> handleFailure(TaskInfo task, Throwable error) {
        String reason = "failed queue task\n" + error.getMessage();
        log.warn("{} for task {}", reason, task.getTaskId(), error);
        Path submitDir = task.getSubmitDir() == null ? null : Path.of(task.getSubmitDir());
        Pilot pilot = task.getPilot();

        Mono<Void> report = logCollector.uploadLogs(task.getTaskId(), task.getDatasetId(), submitDir, reason)
            .then(outcomeReporter.error(task.getTaskId(), task.getDatasetId(), submitDir, reason, null, false))
            .onErrorResume(e -> {
                log.error("Cannot report failure of task {}: {}", task.getTaskId(), e.getMessage());
                return Mono.empty();
            });

        Mono<Void> deletePilot = Mono.defer(() -> {
            if (pilot == null || pilot.getPilotId() == null) {
                return Mono.<Void>empty();
            }
            log.info("deleting just submitted pilot: {}", pilot.getPilotId());
            return queueClient.deletePilot(pilot.getPilotId());
        }).onErrorResume(e -> {
            log.warn("Cannot delete pilot of task {}: {}", task.getTaskId(), e.getMessage());
            return Mono.empty();
        });

        Mono<Void> removeJob = Mono.defer(() -> {
            if (pilot == null || pilot.getGridQueueIds().isEmpty()) {
                return Mono.<Void>empty();
            }
            log.info("deleting just submitted job: {}", pilot.getGridQueueId());
            return blocking(() -> {
                adapterFactory.getAdapter().remove(pilot.getGridQueueIds());
                return true;
            }).then();
        }).onErrorResume(e -> {
            log.warn("Cannot remove grid job of task {}: {}", task.getTaskId(), e.getMessage());
            return Mono.empty();
        });

        return report.then(deletePilot).then(removeJob);
    }

    private RetryPolicy submitRetry() {
        return RetryPolicy.builder()
            .maxAttempts(properties.getQueue().getSubmitAttempts())
            .backoffMs(properties.getQueue().getSubmitBackoffMillis())
            .build();
    }

    private static Optional<Map<String, Object>> findTaskConfig(Map<String, Object> config, String name) {
        Object tasks = config.get("tasks");
        if (!(tasks instanceof List) || name == null) {
            return Optional.empty();
        }
        for (Object entry : (List<?>) tasks) {
            if (entry instanceof Map && name.equals(((Map<?, ?>) entry).get("name"))) {
                return Optional.of(stringKeys((Map<?, ?>) entry));
            }
        }
        return Optional.empty();
    }

    private static Map<String, Object> stringKeys(Map<?, ?> raw) {
        Map<String, Object> map = new LinkedHashMap<>();
        raw.forEach((key, value) -> map.put(String.valueOf(key), value));
        return map;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    private static Double asDouble(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Dataset and config lookups shared by the tasks of one cycle
     */
    class DatasetCache {
        private final Map<String, Mono<Map<String, Object>>> datasets = new ConcurrentHashMap<>();
        private final Map<String, Mono<Map<String, Object>>> configs = new ConcurrentHashMap<>();

        Mono<Map<String, Object>> dataset(String datasetId) {
            return datasets.computeIfAbsent(datasetId, id -> queueClient.getDataset(id).cache());
        }

        Mono<Map<String, Object>> config(String datasetId) {
            return configs.computeIfAbsent(datasetId, id -> queueClient.getConfig(id).cache());
        }
    }
}
