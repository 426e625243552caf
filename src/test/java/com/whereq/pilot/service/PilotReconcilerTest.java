package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.dto.CycleStatus;
import com.whereq.pilot.executor.BatchAdapter;
import com.whereq.pilot.model.GridCompletion;
import com.whereq.pilot.model.GridJob;
import com.whereq.pilot.model.GridJobStatus;
import com.whereq.pilot.model.Pilot;
import com.whereq.pilot.model.TaskInfo;
import com.whereq.pilot.queue.TaskQueueClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PilotReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T00:00:00Z");

    @Mock
    private TaskQueueClient queueClient;

    @Mock
    private BatchAdapterFactory adapterFactory;

    @Mock
    private BatchAdapter adapter;

    @Mock
    private LogCollector logCollector;

    @Mock
    private TaskOutcomeReporter outcomeReporter;

    @Mock
    private SubmitDirectoryManager submitDirs;

    @Mock
    private QueueEnvelope envelope;

    private PilotReconciler reconciler;

    @BeforeEach
    void setUp() throws Exception {
        reconciler = new PilotReconciler();
        ReflectionTestUtils.setField(reconciler, "queueClient", queueClient);
        ReflectionTestUtils.setField(reconciler, "adapterFactory", adapterFactory);
        ReflectionTestUtils.setField(reconciler, "logCollector", logCollector);
        ReflectionTestUtils.setField(reconciler, "outcomeReporter", outcomeReporter);
        ReflectionTestUtils.setField(reconciler, "submitDirs", submitDirs);
        ReflectionTestUtils.setField(reconciler, "envelope", envelope);
        ReflectionTestUtils.setField(reconciler, "properties", new PilotProperties());
        reconciler.setClock(Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(adapterFactory.getAdapter()).thenReturn(adapter);
        lenient().when(envelope.getQueueHost()).thenReturn("submit01");
        lenient().when(envelope.getSite()).thenReturn("NPX");
        lenient().when(adapter.getCompletions()).thenReturn(Map.of());
        lenient().when(submitDirs.findExpired(any(), any(), any())).thenReturn(List.of());
        lenient().when(queueClient.getPilots(anyString(), anyString(), anyString())).thenReturn(Flux.empty());
    }

    @Test
    void testOrphanRemovedOnSecondSighting() {
        // Given
        when(adapter.getLiveStatus()).thenReturn(Map.of("99.0", job("99.0", GridJobStatus.QUEUED)));

        // When
        StepVerifier.create(reconciler.reconcile())
            .assertNext(status -> assertEquals(0, status.getGridJobsRemoved()))
            .verifyComplete();

        // Then
        verify(adapter, never()).remove(any());
        assertEquals(Set.of("99.0"), reconciler.getGridRemoveOnce());

        StepVerifier.create(reconciler.reconcile())
            .assertNext(status -> assertEquals(1, status.getGridJobsRemoved()))
            .verifyComplete();
        verify(adapter).remove(Set.of("99.0"));
        assertTrue(reconciler.getGridRemoveOnce().isEmpty());
    }

    @Test
    void testOrphanGoneBeforeSecondCycleIsForgotten() {
        when(adapter.getLiveStatus())
            .thenReturn(Map.of("99.0", job("99.0", GridJobStatus.QUEUED)))
            .thenReturn(Map.of());

        reconciler.reconcile().block();
        reconciler.reconcile().block();

        verify(adapter, never()).remove(any());
        assertTrue(reconciler.getGridRemoveOnce().isEmpty());
    }

    @Test
    void testPilotsOfOtherQueueHostsAreOrphans() {
        // Given
        Pilot foreign = pilot("p9", "5.0", NOW.minus(Duration.ofHours(1)));
        foreign.setQueueHost("submit02");
        when(queueClient.getPilots(anyString(), anyString(), anyString())).thenReturn(Flux.just(foreign));
        when(adapter.getLiveStatus()).thenReturn(Map.of("5.0", job("5.0", GridJobStatus.PROCESSING)));

        // When
        CycleStatus status = reconciler.reconcile().block();

        // Then
        assertNotNull(status);
        assertEquals(0, status.getProcessing());
        assertEquals(Set.of("5.0"), reconciler.getGridRemoveOnce());
        verify(queueClient, never()).deletePilot(anyString());
    }

    @Test
    void testProcessingPilotOverTimeIsRemoved() {
        // Given
        when(queueClient.getPilots(anyString(), anyString(), anyString())).thenReturn(Flux.just(
            pilot("p1", "1.0", NOW.minus(Duration.ofDays(5))),
            pilot("p2", "2.0", NOW.minus(Duration.ofDays(1))),
            pilot("p3", "3.0", NOW.minus(Duration.ofDays(3)))));
        when(adapter.getLiveStatus()).thenReturn(Map.of(
            "1.0", job("1.0", GridJobStatus.PROCESSING),
            "2.0", job("2.0", GridJobStatus.PROCESSING),
            "3.0", job("3.0", GridJobStatus.QUEUED)));

        // When
        CycleStatus status = reconciler.reconcile().block();

        // Then
        assertNotNull(status);
        verify(adapter).remove(Set.of("1.0", "3.0"));
        assertEquals(2, status.getGridJobsRemoved());
        assertEquals(0, status.getIdle());
        assertEquals(3, status.getProcessing());
        assertEquals(0, status.getPilotsDeleted());
    }

    @Test
    void testPilotWithoutSubmitDateIsNeverOverTime() {
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", null)));
        when(adapter.getLiveStatus()).thenReturn(Map.of("1.0", job("1.0", GridJobStatus.QUEUED)));

        CycleStatus status = reconciler.reconcile().block();

        assertNotNull(status);
        assertEquals(1, status.getIdle());
        assertEquals(0, status.getProcessing());
        verify(adapter, never()).remove(any());
    }

    @Test
    void testCompletedPilotIsFinished() {
        // Given
        Path dir = Path.of("/scratch/submit/d1_t1_abc");
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", NOW.minus(Duration.ofHours(2)))));
        when(adapter.getLiveStatus()).thenReturn(Map.of());
        when(adapter.getCompletions()).thenReturn(Map.of("1.0", GridCompletion.builder()
            .gridQueueId("1.0").outcome(GridCompletion.Outcome.OK).submitDir(dir.toString()).site("SiteA").build()));
        when(queueClient.getTask("t1")).thenReturn(Mono.just(processingTask()));
        when(logCollector.uploadLogs("t1", "d1", dir, null)).thenReturn(Mono.just(false));
        when(outcomeReporter.finish("t1", "d1", dir, "SiteA")).thenReturn(Mono.empty());
        when(queueClient.deletePilot("p1")).thenReturn(Mono.empty());

        // When
        CycleStatus status = reconciler.reconcile().block();

        // Then
        assertNotNull(status);
        verify(outcomeReporter).finish("t1", "d1", dir, "SiteA");
        verify(outcomeReporter, never()).error(anyString(), anyString(), any(), any(), any(), anyBoolean());
        verify(queueClient).deletePilot("p1");
        assertEquals(1, status.getPilotsDeleted());
        assertEquals(0, status.getProcessing());
    }

    @Test
    void testFailedCompletionReportsPayloadFailure() {
        Path dir = Path.of("/scratch/submit/d1_t1_abc");
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", NOW.minus(Duration.ofHours(2)))));
        when(adapter.getLiveStatus()).thenReturn(Map.of());
        when(adapter.getCompletions()).thenReturn(Map.of("1.0", GridCompletion.builder()
            .gridQueueId("1.0").outcome(GridCompletion.Outcome.ERROR).submitDir(dir.toString()).build()));
        when(queueClient.getTask("t1")).thenReturn(Mono.just(processingTask()));
        when(logCollector.uploadLogs("t1", "d1", dir, null)).thenReturn(Mono.just(true));
        when(outcomeReporter.error("t1", "d1", dir, null, null, true)).thenReturn(Mono.empty());
        when(queueClient.deletePilot("p1")).thenReturn(Mono.empty());

        reconciler.reconcile().block();

        verify(outcomeReporter).error("t1", "d1", dir, null, null, true);
        verify(queueClient).deletePilot("p1");
    }

    @Test
    void testPostProcessingFailureIsReported() {
        // Given
        Path dir = Path.of("/scratch/submit/d1_t1_abc");
        String reason = "failed post-processing task\nqueue service down";
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", NOW.minus(Duration.ofHours(2)))));
        when(adapter.getLiveStatus()).thenReturn(Map.of());
        when(adapter.getCompletions()).thenReturn(Map.of("1.0", GridCompletion.builder()
            .gridQueueId("1.0").outcome(GridCompletion.Outcome.OK).submitDir(dir.toString()).build()));
        when(queueClient.getTask("t1")).thenReturn(Mono.just(processingTask()));
        when(logCollector.uploadLogs("t1", "d1", dir, null)).thenReturn(Mono.just(false));
        when(outcomeReporter.finish("t1", "d1", dir, null))
            .thenReturn(Mono.error(new IllegalStateException("queue service down")));
        when(logCollector.uploadLogs("t1", "d1", dir, reason)).thenReturn(Mono.just(false));
        when(outcomeReporter.error("t1", "d1", dir, reason, null, false)).thenReturn(Mono.empty());
        when(queueClient.deletePilot("p1")).thenReturn(Mono.empty());

        // When
        reconciler.reconcile().block();

        // Then
        verify(outcomeReporter).error("t1", "d1", dir, reason, null, false);
        verify(queueClient).deletePilot("p1");
    }

    @Test
    void testCompletionOfTaskNoLongerProcessingIsSkipped() {
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", NOW.minus(Duration.ofHours(2)))));
        when(adapter.getLiveStatus()).thenReturn(Map.of());
        when(adapter.getCompletions()).thenReturn(Map.of("1.0", GridCompletion.builder()
            .gridQueueId("1.0").outcome(GridCompletion.Outcome.OK).build()));
        TaskInfo task = processingTask();
        task.setStatus("complete");
        when(queueClient.getTask("t1")).thenReturn(Mono.just(task));
        when(queueClient.deletePilot("p1")).thenReturn(Mono.empty());

        reconciler.reconcile().block();

        verify(logCollector, never()).uploadLogs(anyString(), anyString(), any(), any());
        verify(queueClient).deletePilot("p1");
    }

    @Test
    void testVanishedPilotIsDeleted() {
        // Given
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", NOW.minus(Duration.ofHours(2)))));
        when(adapter.getLiveStatus()).thenReturn(Map.of());
        when(queueClient.deletePilot("p1")).thenReturn(Mono.error(new IllegalStateException("boom")));

        // When
        CycleStatus status = reconciler.reconcile().block();

        // Then
        assertNotNull(status);
        verify(queueClient).deletePilot("p1");
        assertEquals(1, status.getPilotsDeleted());
        assertEquals(0, status.getProcessing());
    }

    @Test
    void testErrorJobIsRemovedAndKilled() {
        // Given
        Path dir = Path.of("/scratch/submit/d1_t1_abc");
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", NOW.minus(Duration.ofHours(2)))));
        GridJob held = job("1.0", GridJobStatus.ERROR);
        held.setSubmitDir(dir.toString());
        held.setSite("SiteA");
        when(adapter.getLiveStatus()).thenReturn(Map.of("1.0", held));
        when(queueClient.getTask("t1")).thenReturn(Mono.just(processingTask()));
        when(outcomeReporter.kill("t1", "d1", dir, "SiteA", "p1")).thenReturn(Mono.empty());

        // When
        CycleStatus status = reconciler.reconcile().block();

        // Then
        assertNotNull(status);
        verify(outcomeReporter).kill("t1", "d1", dir, "SiteA", "p1");
        verify(adapter).remove(Set.of("1.0"));
        assertEquals(1, status.getGridJobsRemoved());
    }

    @Test
    void testSubmitDirsOfLiveJobsAreProtected() throws Exception {
        // Given
        Path dir = Path.of("/scratch/submit/d1_t1_abc");
        when(queueClient.getPilots(anyString(), anyString(), anyString()))
            .thenReturn(Flux.just(pilot("p1", "1.0", NOW.minus(Duration.ofHours(2)))));
        GridJob running = job("1.0", GridJobStatus.PROCESSING);
        running.setSubmitDir(dir.toString());
        when(adapter.getLiveStatus()).thenReturn(Map.of("1.0", running));
        Path expired = Path.of("/scratch/submit/d1_t0_old");
        when(submitDirs.findExpired(any(), eq(NOW), eq(Duration.ofDays(5)))).thenReturn(List.of(expired));
        when(submitDirs.delete(List.of(expired))).thenReturn(1);

        // When
        CycleStatus status = reconciler.reconcile().block();

        // Then
        assertNotNull(status);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Set<Path>> captor = ArgumentCaptor.forClass(Set.class);
        verify(submitDirs).findExpired(captor.capture(), eq(NOW), eq(Duration.ofDays(5)));
        assertEquals(Set.of(dir.toAbsolutePath().normalize()), captor.getValue());
        assertEquals(1, status.getSubmitDirsCleaned());
    }

    @Test
    void testRemoveFailureFailsTheCycle() {
        when(adapter.getLiveStatus()).thenReturn(Map.of("99.0", job("99.0", GridJobStatus.QUEUED)));
        reconciler.reconcile().block();
        doThrow(new IllegalStateException("condor_rm failed")).when(adapter).remove(any());

        StepVerifier.create(reconciler.reconcile())
            .expectErrorMessage("condor_rm failed")
            .verify();
    }

    @Test
    void testMultiJobPilotMapsEveryId() {
        Pilot pilot = pilot("p1", "1.0,1.1", NOW.minus(Duration.ofHours(2)));
        when(queueClient.getPilots(anyString(), anyString(), anyString())).thenReturn(Flux.just(pilot));
        when(adapter.getLiveStatus()).thenReturn(Map.of(
            "1.0", job("1.0", GridJobStatus.PROCESSING),
            "1.1", job("1.1", GridJobStatus.PROCESSING)));

        CycleStatus status = reconciler.reconcile().block();

        assertNotNull(status);
        assertEquals(2, status.getProcessing());
        assertTrue(reconciler.getGridRemoveOnce().isEmpty());
        verify(queueClient, never()).deletePilot(anyString());
    }

    private static Pilot pilot(String pilotId, String gridQueueId, Instant submitted) {
        List<String> tasks = new ArrayList<>();
        tasks.add("t1");
        return Pilot.builder()
            .pilotId(pilotId)
            .queueHost("submit01")
            .gridQueueId(gridQueueId)
            .submitDate(submitted == null ? null
                : LocalDateTime.ofInstant(submitted, ZoneOffset.UTC).toString())
            .tasks(tasks)
            .build();
    }

    private static GridJob job(String gridQueueId, GridJobStatus status) {
        return GridJob.builder().gridQueueId(gridQueueId).status(status).build();
    }

    private static TaskInfo processingTask() {
        return TaskInfo.builder().taskId("t1").datasetId("d1").status("processing").build();
    }
}
