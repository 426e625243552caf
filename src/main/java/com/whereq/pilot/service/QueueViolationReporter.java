package com.whereq.pilot.service;

import com.whereq.pilot.dto.TaskErrorRequest;
import com.whereq.pilot.model.ResourceUsage;
import com.whereq.pilot.queue.TaskQueueClient;
import com.whereq.pilot.resource.ClaimViolationHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Reports tasks evicted by the node ledger to the queue service as killed
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "pilot.ledger", name = "enabled", havingValue = "true")
public class QueueViolationReporter implements ClaimViolationHandler {

    private static final Duration REPORT_TIMEOUT = Duration.ofSeconds(60);

    @Autowired
    private TaskQueueClient queueClient;

    @Autowired
    private QueueEnvelope envelope;

    @Override
    public void onViolation(String taskId, String reason, ResourceUsage usage) {
        queueClient.getTask(taskId)
            .flatMap(task -> queueClient.killTask(taskId, TaskErrorRequest.builder()
                .datasetId(task.getDatasetId())
                .reason(reason)
                .resources(usage.toMap())
                .site(envelope.getSite())
                .message(reason + "\n\nsubmitter: " + envelope.getQueueHost())
                .build()))
            .doOnSuccess(v -> log.info("reported eviction of task {}", taskId))
            .block(REPORT_TIMEOUT);
    }
}
