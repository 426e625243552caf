package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.dto.CycleStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background loop running one reconcile and queue cycle after another
 */
@Slf4j
@Service
public class GridCycleScheduler {

    @Autowired
    private PilotReconciler reconciler;

    @Autowired
    private PilotSubmitter submitter;

    @Autowired
    private PilotProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    private Clock clock = Clock.systemUTC();

    private final AtomicReference<CycleStatus> lastStatus = new AtomicReference<>();

    private Counter queuedCounter;
    private Counter failureCounter;
    private Counter cycleErrorCounter;
    private Timer cycleTimer;

    @PostConstruct
    public void initialize() {
        // Register metrics
        Gauge.builder("pilot.grid.processing", () -> current().getProcessing())
            .description("Pilots running in the batch system")
            .register(meterRegistry);

        Gauge.builder("pilot.grid.idle", () -> current().getIdle())
            .description("Pilots queued in the batch system")
            .register(meterRegistry);

        queuedCounter = Counter.builder("pilot.tasks.queued")
            .description("Pilots submitted")
            .register(meterRegistry);

        failureCounter = Counter.builder("pilot.tasks.queue.failures")
            .description("Claimed tasks that could not be submitted")
            .register(meterRegistry);

        cycleErrorCounter = Counter.builder("pilot.cycles.failed")
            .description("Cycles aborted by an error")
            .register(meterRegistry);

        cycleTimer = Timer.builder("pilot.cycle.time")
            .description("Duration of a reconcile and queue cycle")
            .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${pilot.cycle.interval-millis:300000}")
    public void scheduledCycle() {
        if (!properties.getCycle().isEnabled()) {
            log.debug("grid cycle disabled");
            return;
        }
        runCycle();
    }

    /**
     * Run one cycle to completion, a failing cycle is logged and the next one runs as usual
     */
    public CycleStatus runCycle() {
        Instant start = clock.instant();
        log.info("starting grid cycle");

        CycleStatus status = reconciler.reconcile()
            .flatMap(submitter::queue)
            .onErrorResume(e -> {
                log.error("grid cycle failed: {}", e.getMessage(), e);
                cycleErrorCounter.increment();
                return Mono.just(CycleStatus.builder().error(e.getMessage()).build());
            })
            .block();
        if (status == null) {
            status = CycleStatus.builder().build();
        }

        Instant end = clock.instant();
        status = status.toBuilder().startedAt(start).finishedAt(end).build();
        cycleTimer.record(Duration.between(start, end));
        queuedCounter.increment(status.getPilotsQueued());
        failureCounter.increment(status.getQueueFailures());
        lastStatus.set(status);

        log.info("grid cycle done in {}ms: {}", Duration.between(start, end).toMillis(), status);
        return status;
    }

    /**
     * Status of the last finished cycle, null before the first one
     */
    public CycleStatus getLastStatus() {
        return lastStatus.get();
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    private CycleStatus current() {
        CycleStatus status = lastStatus.get();
        return status == null ? CycleStatus.builder().build() : status;
    }
}
