package com.whereq.pilot.queue;

import com.whereq.pilot.dto.LogUpload;
import com.whereq.pilot.dto.TaskErrorRequest;
import com.whereq.pilot.dto.TaskFinishRequest;
import com.whereq.pilot.model.Pilot;
import com.whereq.pilot.model.TaskInfo;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Operations of the remote queue service used by the reconcile and queue cycle
 */
public interface TaskQueueClient {

    /**
     * Pilots owned by a queue host at a site
     *
     * @param keys fields to project, "|" separated
     */
    Flux<Pilot> getPilots(String queueHost, String site, String keys);

    /**
     * Create a pilot record
     *
     * @return Mono with the allocated pilot id
     */
    Mono<String> createPilot(Pilot pilot);

    Mono<Void> updatePilot(String pilotId, Map<String, Object> fields);

    /**
     * Delete a pilot record, returning its tasks to the queue
     *
     * @return Mono that completes empty when the pilot was already gone
     */
    Mono<Void> deletePilot(String pilotId);

    /**
     * Atomically move the highest priority task fitting the envelope to processing
     *
     * @param requirements capacity envelope of the pilot
     * @param queryParams extra task filters
     * @return Mono with the task, empty when no task is left
     */
    Mono<TaskInfo> claimTask(Map<String, Object> requirements, Map<String, Object> queryParams);

    Mono<TaskInfo> getTask(String taskId);

    Mono<Map<String, Object>> getJob(String jobId);

    Mono<Map<String, Object>> getDataset(String datasetId);

    Mono<Map<String, Object>> getConfig(String datasetId);

    Mono<Void> uploadLog(LogUpload log);

    Mono<Void> finishTask(String taskId, TaskFinishRequest request);

    /**
     * Report a task error, a payload failure marks the task failed instead of reset
     */
    Mono<Void> errorTask(String taskId, TaskErrorRequest request);

    /**
     * Report a task the batch system or the pilot had to kill
     */
    Mono<Void> killTask(String taskId, TaskErrorRequest request);

    /**
     * Issue a short-lived credential a pilot uses to call back
     *
     * @return Mono with the token
     */
    Mono<String> issueCredential(String pilotId, String taskId, Duration lifetime);
}
