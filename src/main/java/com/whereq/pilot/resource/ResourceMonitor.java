package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceType;
import com.whereq.pilot.model.ResourceUsage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Watches the claims of the node ledger and evicts the ones that overuse
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "pilot.ledger", name = "enabled", havingValue = "true")
public class ResourceMonitor {

    @Autowired
    private ResourceLedger ledger;

    @Autowired
    private ClaimViolationHandler violationHandler;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter violationCounter;

    @PostConstruct
    public void initialize() {
        // Register Prometheus gauges
        Gauge.builder("pilot.ledger.claims.active", () -> ledger.getClaimIds().size())
            .description("Number of active claims")
            .register(meterRegistry);

        Gauge.builder("pilot.ledger.cpu.available", () -> ledger.getAvailable().quantity(ResourceType.CPU))
            .description("Unclaimed cores")
            .register(meterRegistry);

        Gauge.builder("pilot.ledger.gpu.available", () -> ledger.getAvailable().quantity(ResourceType.GPU))
            .description("Unclaimed gpus")
            .register(meterRegistry);

        Gauge.builder("pilot.ledger.memory.available", () -> ledger.getAvailable().getMemory())
            .description("Unclaimed memory in GB")
            .register(meterRegistry);

        Gauge.builder("pilot.ledger.time.remaining", () -> ledger.getAvailable().getTime())
            .description("Hours left on this node")
            .register(meterRegistry);

        violationCounter = Counter.builder("pilot.ledger.violations")
            .description("Claims evicted for overusage")
            .register(meterRegistry);

        log.info("ResourceMonitor initialized: total={}", ledger.getTotal());
    }

    /**
     * Periodic overusage check, violators are killed, reported and released
     */
    @Scheduled(fixedDelayString = "${pilot.ledger.monitor-interval-millis:60000}")
    public void monitorClaims() {
        Map<String, String> violations = ledger.checkClaims(false);
        violations.forEach(this::evict);

        if (!violations.isEmpty()) {
            log.info("Evicted {} claims, available now {}", violations.size(), ledger.getAvailable());
        } else if (log.isDebugEnabled()) {
            log.debug("Active claims: {}", ledger.getClaimIds());
        }
    }

    private void evict(String taskId, String reason) {
        log.warn("Killing task {}: {}", taskId, reason);
        ResourceUsage peak = ledger.getPeak(taskId).orElseGet(ResourceUsage::new);

        ledger.getProcessId(taskId).ifPresent(this::terminate);
        try {
            violationHandler.onViolation(taskId, reason, peak);
        } catch (RuntimeException e) {
            log.error("Failed to report violation of task {}: {}", taskId, e.getMessage(), e);
        } finally {
            ledger.release(taskId);
            violationCounter.increment();
        }
    }

    /**
     * Kill a process and all of its descendants
     */
    void terminate(long pid) {
        ProcessHandle.of(pid).ifPresent(root -> {
            root.descendants().forEach(ProcessHandle::destroyForcibly);
            root.destroyForcibly();
        });
    }
}
