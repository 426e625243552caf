package com.whereq.pilot.queue;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.dto.LogUpload;
import com.whereq.pilot.dto.TaskErrorRequest;
import com.whereq.pilot.dto.TaskFinishRequest;
import com.whereq.pilot.exception.QueueServiceException;
import com.whereq.pilot.model.Pilot;
import com.whereq.pilot.model.TaskInfo;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue service client over its REST API
 */
@Slf4j
@Component
public class RestTaskQueueClient implements TaskQueueClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
        new ParameterizedTypeReference<>() {
        };

    private static final ParameterizedTypeReference<Map<String, Pilot>> PILOT_MAP =
        new ParameterizedTypeReference<>() {
        };

    private static final String TASK_ACTION = "/tasks/{id}/task_actions/{action}";

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private PilotProperties properties;

    private WebClient webClient;

    private Duration timeout;

    @PostConstruct
    public void initialize() {
        WebClient.Builder builder = webClientBuilder.clone()
            .baseUrl(properties.getRest().getUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        String token = properties.getRest().getToken();
        if (token != null && !token.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        webClient = builder.build();
        timeout = Duration.ofSeconds(properties.getRest().getTimeoutSeconds());
        log.info("Queue service client initialized: {}", properties.getRest().getUrl());
    }

    @Override
    public Flux<Pilot> getPilots(String queueHost, String site, String keys) {
        return webClient.get()
            .uri(uri -> {
                uri.path("/pilots").queryParam("queue_host", queueHost);
                if (site != null) {
                    uri.queryParam("host", site);
                }
                if (keys != null) {
                    uri.queryParam("keys", keys);
                }
                return uri.build();
            })
            .retrieve()
            .bodyToMono(PILOT_MAP)
            .timeout(timeout)
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("get pilots", e))
            .flatMapIterable(pilots -> {
                pilots.forEach((id, pilot) -> {
                    if (pilot.getPilotId() == null) {
                        pilot.setPilotId(id);
                    }
                });
                return pilots.values();
            });
    }

    @Override
    public Mono<String> createPilot(Pilot pilot) {
        return webClient.post()
            .uri("/pilots")
            .bodyValue(pilot)
            .retrieve()
            .bodyToMono(JSON_OBJECT)
            .timeout(timeout)
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("create pilot", e))
            .map(body -> String.valueOf(body.get("result")))
            .doOnNext(id -> log.debug("Created pilot {}", id));
    }

    @Override
    public Mono<Void> updatePilot(String pilotId, Map<String, Object> fields) {
        return webClient.patch()
            .uri("/pilots/{id}", pilotId)
            .bodyValue(fields)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("update pilot " + pilotId, e))
            .then();
    }

    @Override
    public Mono<Void> deletePilot(String pilotId) {
        return webClient.delete()
            .uri("/pilots/{id}", pilotId)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .then()
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.debug("Pilot {} already deleted", pilotId);
                return Mono.empty();
            })
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("delete pilot " + pilotId, e));
    }

    @Override
    public Mono<TaskInfo> claimTask(Map<String, Object> requirements, Map<String, Object> queryParams) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requirements", requirements);
        body.put("query_params", queryParams);
        return webClient.post()
            .uri("/task_actions/process")
            .bodyValue(body)
            .retrieve()
            .bodyToMono(TaskInfo.class)
            .timeout(timeout)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.info("No more tasks to queue");
                return Mono.empty();
            })
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("claim task", e));
    }

    @Override
    public Mono<TaskInfo> getTask(String taskId) {
        return webClient.get()
            .uri("/tasks/{id}", taskId)
            .retrieve()
            .bodyToMono(TaskInfo.class)
            .timeout(timeout)
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("get task " + taskId, e));
    }

    @Override
    public Mono<Map<String, Object>> getJob(String jobId) {
        return getObject("/jobs/{id}", jobId);
    }

    @Override
    public Mono<Map<String, Object>> getDataset(String datasetId) {
        return getObject("/datasets/{id}", datasetId);
    }

    @Override
    public Mono<Map<String, Object>> getConfig(String datasetId) {
        return getObject("/config/{id}", datasetId);
    }

    @Override
    public Mono<Void> uploadLog(LogUpload upload) {
        return post(upload, "upload " + upload.getName() + " of task " + upload.getTaskId(), "/logs");
    }

    @Override
    public Mono<Void> finishTask(String taskId, TaskFinishRequest request) {
        return post(request, "finish task " + taskId, TASK_ACTION, taskId, "complete");
    }

    @Override
    public Mono<Void> errorTask(String taskId, TaskErrorRequest request) {
        String action = request.isFailed() ? "failed" : "reset";
        return post(request, action + " task " + taskId, TASK_ACTION, taskId, action);
    }

    @Override
    public Mono<Void> killTask(String taskId, TaskErrorRequest request) {
        return post(request, "kill task " + taskId, TASK_ACTION, taskId, "kill");
    }

    @Override
    public Mono<String> issueCredential(String pilotId, String taskId, Duration lifetime) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "pilot");
        body.put("pilot_id", pilotId);
        body.put("task_id", taskId);
        body.put("expiration", lifetime.getSeconds());
        return webClient.post()
            .uri("/tokens")
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JSON_OBJECT)
            .timeout(timeout)
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("issue credential", e))
            .flatMap(response -> {
                Object token = response.get("token");
                return token == null
                    ? Mono.error(new QueueServiceException("credential response without token", 200))
                    : Mono.just(token.toString());
            });
    }

    private Mono<Map<String, Object>> getObject(String path, String id) {
        return webClient.get()
            .uri(path, id)
            .retrieve()
            .bodyToMono(JSON_OBJECT)
            .timeout(timeout)
            .onErrorMap(WebClientResponseException.class, e -> toServiceException("get " + path.replace("{id}", id), e));
    }

    private Mono<Void> post(Object body, String action, String path, Object... uriVariables) {
        return webClient.post()
            .uri(path, uriVariables)
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .onErrorMap(WebClientResponseException.class, e -> toServiceException(action, e))
            .then();
    }

    private static QueueServiceException toServiceException(String action, WebClientResponseException e) {
        return new QueueServiceException(
            "Queue service failed to " + action + ": " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(),
            e.getStatusCode().value(), e);
    }
}
