package com.whereq.pilot.service;

import com.whereq.pilot.dto.TaskErrorRequest;
import com.whereq.pilot.dto.TaskFinishRequest;
import com.whereq.pilot.executor.BatchAdapter;
import com.whereq.pilot.queue.TaskQueueClient;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports the outcome of a pilot's task to the queue service: finish, error or kill
 */
@Slf4j
@Service
public class TaskOutcomeReporter {

    @Autowired
    private TaskQueueClient queueClient;

    @Autowired
    private BatchAdapterFactory adapterFactory;

    @Autowired
    private FailureClassifier failureClassifier;

    @Autowired
    private QueueEnvelope envelope;

    /**
     * Reason and resources gathered from a submit directory
     */
    @Value
    static class Diagnosis {
        String reason;
        Map<String, Object> resources;
    }

    public Mono<Void> finish(String taskId, String datasetId, Path submitDir, String site) {
        BatchAdapter adapter = adapterFactory.getAdapter();
        return Mono.fromCallable(() -> readResources(submitDir, adapter.getOutputFileName()))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(resources -> {
                log.info("finished task {}", taskId);
                return queueClient.finishTask(taskId, TaskFinishRequest.builder()
                    .datasetId(datasetId)
                    .resources(resources)
                    .site(siteOrDefault(site))
                    .build());
            });
    }

    /**
     * Report a task error, classifying the reason from the logs when none is given
     *
     * @param failed the payload itself failed
     */
    public Mono<Void> error(String taskId, String datasetId, Path submitDir, String reason, String site, boolean failed) {
        return diagnose(submitDir, reason, failed)
            .flatMap(diagnosis -> {
                log.info("error in task {}: {}", taskId, diagnosis.getReason());
                return queueClient.errorTask(taskId, TaskErrorRequest.builder()
                    .datasetId(datasetId)
                    .reason(diagnosis.getReason())
                    .resources(diagnosis.getResources())
                    .site(siteOrDefault(site))
                    .failed(failed)
                    .build());
            });
    }

    /**
     * Report a task whose batch job had to be killed, with where it ran
     */
    public Mono<Void> kill(String taskId, String datasetId, Path submitDir, String site, String pilotId) {
        BatchAdapter adapter = adapterFactory.getAdapter();
        String reportedSite = siteOrDefault(site);
        return diagnose(submitDir, null, false)
            .flatMap(diagnosis -> Mono.fromCallable(() -> submitDir == null
                    ? "None"
                    : adapter.findExecutionHost(submitDir).orElse("None"))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(host -> {
                    String message = diagnosis.getReason()
                        + "\n\npilot_id: " + pilotId
                        + "\nhostname: " + host
                        + "\nsubmitter: " + envelope.getQueueHost()
                        + "\nsite: " + reportedSite;
                    log.info("killing task {}: {}", taskId, diagnosis.getReason());
                    return queueClient.killTask(taskId, TaskErrorRequest.builder()
                        .datasetId(datasetId)
                        .reason(diagnosis.getReason())
                        .resources(diagnosis.getResources())
                        .message(message)
                        .site(reportedSite)
                        .build());
                }));
    }

    Mono<Diagnosis> diagnose(Path submitDir, String reason, boolean failed) {
        BatchAdapter adapter = adapterFactory.getAdapter();
        return Mono.fromCallable(() -> {
                Map<String, Object> resources = readResources(submitDir, adapter.getOutputFileName());
                if (submitDir != null) {
                    resources.putAll(adapter.getGridResources(submitDir));
                }
                String found = reason;
                if (isBlank(found) && failed) {
                    found = "payload failure";
                }
                if (isBlank(found) && submitDir != null) {
                    LogCollector.CapturedLogs logs = LogCollector.CapturedLogs.read(submitDir);
                    found = failureClassifier.classifyTaskLog(logs.getStdlog())
                        .or(() -> failureClassifier.classifyTaskLog(logs.getStdout()))
                        .orElse(null);
                }
                if (isBlank(found) && submitDir != null) {
                    found = failureClassifier.classifyBatchLog(adapter, submitDir, resources).orElse(null);
                }
                if (isBlank(found)) {
                    found = "unknown failure";
                }
                return new Diagnosis(found, resources);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Resources listed after the "Resources:" line of the batch output file
     */
    static Map<String, Object> readResources(Path submitDir, String outputFileName) {
        Map<String, Object> resources = new LinkedHashMap<>();
        if (submitDir == null) {
            return resources;
        }
        Path file = submitDir.resolve(outputFileName);
        if (!Files.isRegularFile(file)) {
            return resources;
        }
        try {
            return parseResources(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.info("cannot read {}: {}", file, e.getMessage());
            return resources;
        }
    }

    static Map<String, Object> parseResources(List<String> lines) {
        Map<String, Object> resources = new LinkedHashMap<>();
        boolean inResources = false;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.equals("Resources:")) {
                inResources = true;
                continue;
            }
            if (!inResources) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                break;
            }
            String name = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            resources.put(name, parseValue(value));
        }
        return resources;
    }

    private static Object parseValue(String value) {
        try {
            if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
                return Long.parseLong(value);
            }
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private String siteOrDefault(String site) {
        return isBlank(site) ? envelope.getSite() : site;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
