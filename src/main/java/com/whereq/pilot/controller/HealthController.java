package com.whereq.pilot.controller;

import com.whereq.pilot.dto.CycleStatus;
import com.whereq.pilot.service.BatchAdapterFactory;
import com.whereq.pilot.service.GridCycleScheduler;
import com.whereq.pilot.service.QueueEnvelope;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller reporting the submitter identity and the last cycle.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private GridCycleScheduler cycleScheduler;

    @Autowired
    private BatchAdapterFactory adapterFactory;

    @Autowired
    private QueueEnvelope envelope;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service is up and how the last grid cycle went")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "whereq-pilot");
            health.put("version", envelope.getVersion());

            Map<String, Object> grid = new HashMap<>();
            grid.put("batchSystem", adapterFactory.getAdapter().getName());
            grid.put("site", envelope.getSite());
            grid.put("queueHost", envelope.getQueueHost());

            CycleStatus last = cycleScheduler.getLastStatus();
            if (last == null) {
                grid.put("status", "WAITING");
            } else {
                grid.put("status", last.getError() == null ? "OK" : "ERROR");
                grid.put("lastCycle", last);
            }
            health.put("grid", grid);
            return ResponseEntity.ok(health);
        });
    }
}
