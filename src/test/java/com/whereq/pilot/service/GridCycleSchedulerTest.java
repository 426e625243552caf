package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.dto.CycleStatus;
import com.whereq.pilot.exception.QueueServiceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GridCycleSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T00:00:00Z");

    @Mock
    private PilotReconciler reconciler;

    @Mock
    private PilotSubmitter submitter;

    private PilotProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private GridCycleScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new PilotProperties();
        meterRegistry = new SimpleMeterRegistry();

        scheduler = new GridCycleScheduler();
        ReflectionTestUtils.setField(scheduler, "reconciler", reconciler);
        ReflectionTestUtils.setField(scheduler, "submitter", submitter);
        ReflectionTestUtils.setField(scheduler, "properties", properties);
        ReflectionTestUtils.setField(scheduler, "meterRegistry", meterRegistry);
        scheduler.setClock(Clock.fixed(NOW, ZoneOffset.UTC));
        scheduler.initialize();
    }

    @Test
    void testRunCycle() {
        // Given
        CycleStatus reconciled = CycleStatus.builder().processing(4).idle(2).pilotsDeleted(1).build();
        when(reconciler.reconcile()).thenReturn(Mono.just(reconciled));
        when(submitter.queue(reconciled))
            .thenReturn(Mono.just(reconciled.toBuilder().pilotsQueued(3).queueFailures(1).build()));

        // When
        CycleStatus status = scheduler.runCycle();

        // Then
        assertNull(status.getError());
        assertEquals(NOW, status.getStartedAt());
        assertEquals(NOW, status.getFinishedAt());
        assertEquals(3, status.getPilotsQueued());
        assertSame(status, scheduler.getLastStatus());
        assertEquals(3.0, meterRegistry.get("pilot.tasks.queued").counter().count());
        assertEquals(1.0, meterRegistry.get("pilot.tasks.queue.failures").counter().count());
        assertEquals(4.0, meterRegistry.get("pilot.grid.processing").gauge().value());
        assertEquals(2.0, meterRegistry.get("pilot.grid.idle").gauge().value());
        assertEquals(1, meterRegistry.get("pilot.cycle.time").timer().count());
    }

    @Test
    void testFailedCycleIsRecorded() {
        when(reconciler.reconcile()).thenReturn(Mono.error(new IllegalStateException("condor_q failed")));

        CycleStatus status = scheduler.runCycle();

        assertEquals("condor_q failed", status.getError());
        assertEquals(1.0, meterRegistry.get("pilot.cycles.failed").counter().count());
        verify(submitter, never()).queue(any());
    }

    @Test
    void testUnreachableQueueServiceFailsCycle() {
        // Given
        CycleStatus reconciled = CycleStatus.builder().processing(1).build();
        when(reconciler.reconcile()).thenReturn(Mono.just(reconciled));
        when(submitter.queue(reconciled)).thenReturn(Mono.error(new QueueServiceException("unavailable", 503)));

        // When
        CycleStatus status = scheduler.runCycle();

        // Then
        assertEquals("unavailable", status.getError());
        assertEquals(0, status.getPilotsQueued());
        assertEquals(1.0, meterRegistry.get("pilot.cycles.failed").counter().count());
    }

    @Test
    void testNextCycleRunsAfterFailure() {
        CycleStatus reconciled = CycleStatus.builder().build();
        when(reconciler.reconcile())
            .thenReturn(Mono.error(new IllegalStateException("condor_q failed")))
            .thenReturn(Mono.just(reconciled));
        when(submitter.queue(reconciled)).thenReturn(Mono.just(reconciled));

        scheduler.runCycle();
        CycleStatus status = scheduler.runCycle();

        assertNull(status.getError());
    }

    @Test
    void testDisabledCycleDoesNothing() {
        properties.getCycle().setEnabled(false);

        scheduler.scheduledCycle();

        verify(reconciler, never()).reconcile();
        assertNull(scheduler.getLastStatus());
        assertEquals(0.0, meterRegistry.get("pilot.grid.processing").gauge().value());
    }
}
