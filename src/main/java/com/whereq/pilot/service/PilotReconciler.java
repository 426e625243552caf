package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.dto.CycleStatus;
import com.whereq.pilot.executor.BatchAdapter;
import com.whereq.pilot.model.GridCompletion;
import com.whereq.pilot.model.GridJob;
import com.whereq.pilot.model.GridJobStatus;
import com.whereq.pilot.model.Pilot;
import com.whereq.pilot.queue.TaskQueueClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Phase A of a cycle: reconciles the queue service's pilot records with the
 * batch system.
 *
 * Completed jobs get their task finished or errored, pilots whose job vanished
 * are deleted, orphan jobs and jobs over their time limit are removed, and old
 * submit directories are cleaned.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class PilotReconciler {

    static final String PILOT_KEYS = "pilot_id|queue_host|grid_queue_id|submit_date|tasks";

    private static final String PROCESSING = "processing";

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

    private Clock clock = Clock.systemUTC();

    /**
     * Orphan jobs seen in the previous cycle
     */
    private Set<String> gridRemoveOnce = Collections.emptySet();

    public Mono<CycleStatus> reconcile() {
        BatchAdapter adapter = adapterFactory.getAdapter();
        TimeLimits limits = TimeLimits.from(properties.getQueue());
        Instant now = clock.instant();
        String queueHost = envelope.getQueueHost();

        return queueClient.getPilots(queueHost, envelope.getSite(), PILOT_KEYS)
            .filter(pilot -> queueHost.equals(pilot.getQueueHost()) && !pilot.getGridQueueIds().isEmpty())
            .collect(LinkedHashMap<String, Pilot>::new, (pilots, pilot) ->
                pilot.getGridQueueIds().forEach(gid -> pilots.put(gid, pilot)))
            // live status before completions, so a job completing in between is not reset
            .flatMap(pilots -> blocking(adapter::getLiveStatus)
                .flatMap(live -> blocking(adapter::getCompletions)
                    .flatMap(history -> {
                        log.debug("queue pilots: {}", pilots.keySet());
                        log.debug("grid jobs: {}", live.keySet());
                        log.debug("grid history: {}", history.keySet());
                        return processCompletions(pilots, history)
                            .flatMap(deleted -> checkLive(adapter, pilots, live, limits, now)
                                .map(status -> status.toBuilder()
                                    .pilotsDeleted(status.getPilotsDeleted() + deleted)
                                    .build()));
                    })));
    }

    /**
     * Post-process pilots whose job completed, then delete them
     *
     * @return Mono with the number of pilots deleted
     */
    Mono<Integer> processCompletions(Map<String, Pilot> pilots, Map<String, GridCompletion> history) {
        List<String> completed = new ArrayList<>();
        for (String gid : pilots.keySet()) {
            if (history.containsKey(gid)) {
                completed.add(gid);
            }
        }
        if (completed.isEmpty()) {
            return Mono.just(0);
        }

        Map<String, String> pilotsToDelete = new LinkedHashMap<>();
        for (String gid : completed) {
            String pilotId = pilots.get(gid).getPilotId();
            if (pilotId != null) {
                pilotsToDelete.putIfAbsent(pilotId, gid);
            }
        }

        return Flux.fromIterable(completed)
            .flatMap(gid -> postProcess(pilots.get(gid), history.get(gid)), properties.getQueue().getConcurrency())
            .then(Flux.fromIterable(pilotsToDelete.entrySet())
                .concatMap(entry -> {
                    log.info("deleting completed pilot {}, with gid {}", entry.getKey(), entry.getValue());
                    return deletePilot(entry.getKey());
                })
                .then(Mono.fromCallable(() -> {
                    completed.forEach(pilots::remove);
                    return pilotsToDelete.size();
                })));
    }

    private Mono<Void> postProcess(Pilot pilot, GridCompletion completion) {
        String taskId = pilot.getFirstTask();
        if (taskId == null) {
            return Mono.empty();
        }
        Path submitDir = completion.getSubmitDir() == null ? null : Path.of(completion.getSubmitDir());
        log.info("post-processing task {}", taskId);

        return queueClient.getTask(taskId)
            .filter(task -> PROCESSING.equals(task.getStatus()))
            .flatMap(task -> {
                String datasetId = task.getDatasetId();
                return logCollector.uploadLogs(taskId, datasetId, submitDir, null)
                    .flatMap(payloadFailure -> {
                        if (completion.isOk()) {
                            return outcomeReporter.finish(taskId, datasetId, submitDir, completion.getSite());
                        }
                        if (payloadFailure) {
                            log.info("payload failed for task {}", taskId);
                        }
                        return outcomeReporter.error(taskId, datasetId, submitDir, null, completion.getSite(), payloadFailure);
                    })
                    .onErrorResume(e -> {
                        String reason = "failed post-processing task\n" + e.getMessage();
                        log.warn(reason);
                        return logCollector.uploadLogs(taskId, datasetId, submitDir, reason)
                            .then(outcomeReporter.error(taskId, datasetId, submitDir, reason, null, false));
                    });
            })
            .onErrorResume(e -> {
                log.error("Error handling task {}: {}", taskId, e.getMessage(), e);
                return Mono.empty();
            });
    }

    /**
     * Compare live jobs with the remaining pilots and clean up
     */
    Mono<CycleStatus> checkLive(BatchAdapter adapter, Map<String, Pilot> pilots, Map<String, GridJob> live,
                                TimeLimits limits, Instant now) {
        Set<String> resetPilots = new LinkedHashSet<>(pilots.keySet());
        resetPilots.removeAll(live.keySet());

        // an orphan must be seen in two consecutive cycles before it is removed
        Set<String> removeGridJobs = new LinkedHashSet<>();
        Set<String> removeOnce = new HashSet<>();
        for (String gid : live.keySet()) {
            if (pilots.containsKey(gid)) {
                continue;
            }
            if (gridRemoveOnce.contains(gid)) {
                removeGridJobs.add(gid);
            } else {
                removeOnce.add(gid);
            }
        }
        gridRemoveOnce = removeOnce;

        int idle = 0;
        Set<Path> protectedDirs = new HashSet<>();
        List<Mono<Void>> kills = new ArrayList<>();
        for (Map.Entry<String, GridJob> entry : live.entrySet()) {
            String gid = entry.getKey();
            Pilot pilot = pilots.get(gid);
            if (pilot == null) {
                continue;
            }
            GridJob job = entry.getValue();
            GridJobStatus status = job.getStatus() == null ? GridJobStatus.UNKNOWN : job.getStatus();
            Instant submitted = pilot.getSubmitInstant();

            if (submitted != null && Duration.between(submitted, now).compareTo(limits.of(status)) > 0) {
                log.info("pilot over time: {}", pilot.getPilotId());
                removeGridJobs.add(gid);
            } else if (status == GridJobStatus.ERROR) {
                log.info("job error. pilot_id: {}, grid_id: {}", pilot.getPilotId(), gid);
                removeGridJobs.add(gid);
                kills.add(reportKill(pilot, job));
            } else if (status == GridJobStatus.QUEUED) {
                idle++;
            }

            // batch systems object to deleting directories they still know about
            if (job.getSubmitDir() != null) {
                protectedDirs.add(SubmitDirectoryManager.normalize(job.getSubmitDir()));
            }
        }
        int processing = pilots.size() - resetPilots.size() - idle;
        int idleCount = idle;

        log.info("{} processing pilots", processing);
        log.info("{} queued pilots", idle);
        log.info("{} ->reset", resetPilots.size());
        log.info("{} ->grid remove", removeGridJobs.size());

        Set<String> resetPilotIds = new LinkedHashSet<>();
        for (String gid : resetPilots) {
            String pilotId = pilots.get(gid).getPilotId();
            if (pilotId != null) {
                resetPilotIds.add(pilotId);
            }
        }

        return Flux.fromIterable(kills)
            .flatMap(kill -> kill, properties.getQueue().getConcurrency())
            .then(Flux.fromIterable(resetPilotIds).concatMap(this::deletePilot).then())
            .then(Mono.defer(() -> {
                if (removeGridJobs.isEmpty()) {
                    return Mono.<Void>empty();
                }
                log.info("remove {}", removeGridJobs);
                return blocking(() -> {
                    adapter.remove(removeGridJobs);
                    return removeGridJobs.size();
                }).then();
            }))
            .then(blocking(() -> submitDirs.delete(submitDirs.findExpired(protectedDirs, now, limits.getAll()))))
            .map(cleaned -> {
                log.info("{} ->submit clean", cleaned);
                return CycleStatus.builder()
                    .processing(processing)
                    .idle(idleCount)
                    .pilotsDeleted(resetPilotIds.size())
                    .gridJobsRemoved(removeGridJobs.size())
                    .submitDirsCleaned(cleaned)
                    .build();
            });
    }

    private Mono<Void> reportKill(Pilot pilot, GridJob job) {
        String taskId = pilot.getFirstTask();
        if (taskId == null) {
            return Mono.empty();
        }
        Path submitDir = job.getSubmitDir() == null ? null : Path.of(job.getSubmitDir());
        return queueClient.getTask(taskId)
            .filter(task -> PROCESSING.equals(task.getStatus()))
            .flatMap(task -> outcomeReporter.kill(taskId, task.getDatasetId(), submitDir, job.getSite(), pilot.getPilotId()))
            .onErrorResume(e -> {
                log.warn("Cannot report kill of task {}: {}", taskId, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> deletePilot(String pilotId) {
        return queueClient.deletePilot(pilotId)
            .onErrorResume(e -> {
                log.info("delete pilot error for {}: {}", pilotId, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Orphan jobs waiting for a second sighting
     */
    Set<String> getGridRemoveOnce() {
        return Collections.unmodifiableSet(gridRemoveOnce);
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
