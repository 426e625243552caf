package com.whereq.pilot.resource;

import com.whereq.pilot.exception.BadResourceTypeException;
import com.whereq.pilot.exception.InsufficientResourceException;
import com.whereq.pilot.exception.ResourceException;
import com.whereq.pilot.model.ResourceType;
import com.whereq.pilot.model.ResourceUsage;
import com.whereq.pilot.model.ResourceVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceLedgerTest {

    private static final long PID = 4242L;

    @Mock
    private ProcessProbe processProbe;

    @Mock
    private GpuProbe gpuProbe;

    @TempDir
    Path workDir;

    private ResourceLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = ResourceLedger.builder()
            .total(ResourceVector.builder().cpu(4).memory(8).disk(100).time(10).build())
            .clock(Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC))
            .processProbe(processProbe)
            .gpuProbe(gpuProbe)
            .build();
    }

    @Test
    void testClaimAndRelease() {
        // Given - a node with 4 cores, 8 GB memory, 100 GB disk and 10 hours

        // When
        ResourceVector granted = ledger.claim("t1", Map.of("cpu", 2, "memory", 4));

        // Then
        assertEquals(2, granted.getCpu());
        assertEquals(4.0, granted.getMemory(), 1e-9);
        ResourceVector available = ledger.getAvailable();
        assertEquals(2, available.getCpu());
        assertEquals(4.0, available.getMemory(), 1e-9);
        assertEquals(100.0, available.getDisk(), 1e-9);
        assertEquals(10.0, available.getTime(), 1e-9);

        assertThrows(InsufficientResourceException.class, () -> ledger.claim("t2", Map.of("cpu", 3)));
        assertFalse(ledger.getClaimIds().contains("t2"), "Failed claim must not be recorded");

        ledger.release("t1");
        ResourceVector restored = ledger.getAvailable();
        ResourceVector total = ledger.getTotal();
        assertEquals(total.getCpu(), restored.getCpu());
        assertEquals(total.getMemory(), restored.getMemory(), 1e-9);
        assertEquals(total.getDisk(), restored.getDisk(), 1e-9);
        assertTrue(ledger.getClaimIds().isEmpty());
    }

    @Test
    void testFailedClaimLeavesAvailableUntouched() {
        // When
        assertThrows(InsufficientResourceException.class,
            () -> ledger.claim("t1", Map.of("cpu", 1, "memory", 9)));

        // Then
        assertEquals(4, ledger.getAvailable().getCpu(), "cpu of a rejected claim must not be taken");
        assertEquals(8.0, ledger.getAvailable().getMemory(), 1e-9);
    }

    @Test
    void testDuplicateClaimRejected() {
        ledger.claim("t1", Map.of("cpu", 1));

        assertThrows(IllegalStateException.class, () -> ledger.claim("t1", Map.of("cpu", 1)));
        assertEquals(3, ledger.getAvailable().getCpu());
    }

    @Test
    void testUnknownDimensionRejected() {
        assertThrows(BadResourceTypeException.class, () -> ledger.claim("t1", Map.of("ram", 1)));
        assertThrows(BadResourceTypeException.class, () -> ledger.claim("t1", Map.of("cpu", "lots")));
    }

    @Test
    void testEmptyRequestClaimsEverything() {
        // When
        ResourceVector granted = ledger.claim("t1", new HashMap<>());

        // Then
        assertEquals(4, granted.getCpu());
        assertEquals(8.0, granted.getMemory(), 1e-9);
        assertEquals(10.0, granted.getTime(), 1e-9);
        assertEquals(0, ledger.getAvailable().getCpu());
        assertThrows(InsufficientResourceException.class, () -> ledger.claim("t2", Map.of("cpu", 1)));
    }

    @Test
    void testTimeClaim() {
        ResourceVector granted = ledger.claim("t1", Map.of("time", 2));

        assertEquals(2.0, granted.getTime(), 1e-9);
        assertEquals(10.0, ledger.getAvailable().getTime(), 1e-9, "time is not consumed by claims");
        assertEquals(2.0, ledger.getClaimed().getTime(), 1e-9);
        assertThrows(InsufficientResourceException.class, () -> ledger.claim("t2", Map.of("time", 11)));
    }

    @Test
    void testGpuClaimTakesDevices() {
        // Given
        ResourceLedger gpuLedger = ResourceLedger.builder()
            .total(ResourceVector.builder().cpu(2).gpu(List.of("CUDA0", "CUDA1")).memory(4).disk(10).time(1).build())
            .processProbe(processProbe)
            .gpuProbe(gpuProbe)
            .build();

        // When
        ResourceVector granted = gpuLedger.claim("t1", Map.of("gpu", 1));

        // Then
        assertEquals(List.of("CUDA0"), granted.getGpu());
        assertEquals(List.of("CUDA1"), gpuLedger.getAvailable().getGpu());
        assertEquals("0", ResourceLedger.environmentFor(granted).get("CUDA_VISIBLE_DEVICES"));
        assertEquals("9999", ResourceLedger.environmentFor(ResourceVector.empty()).get("CUDA_VISIBLE_DEVICES"));

        gpuLedger.release("t1");
        assertEquals(2, gpuLedger.getAvailable().getGpu().size());
    }

    @Test
    void testUsageRequiresRegisteredProcess() {
        ledger.claim("t1", Map.of("cpu", 1));

        assertThrows(ResourceException.class, () -> ledger.getUsage("t1", true));
        assertThrows(ResourceException.class, () -> ledger.getUsage("unknown", true));
    }

    @Test
    void testCheckClaimsFlagsMemoryOverusage() {
        // Given - a task claiming 1 GB that uses 20 GB
        ledger.claim("t1", Map.of("cpu", 1, "memory", 1));
        ledger.registerProcess("t1", PID, workDir);
        when(processProbe.startTime(PID)).thenReturn(Optional.empty());
        when(processProbe.descendants(PID)).thenReturn(List.of());
        when(processProbe.sample(PID)).thenReturn(Optional.of(new ProcessProbe.Sample(0.5, 20_000_000_000L)));

        // When
        Map<String, String> violations = ledger.checkClaims(true);

        // Then
        assertEquals(Map.of("t1", "Resource overusage for memory: 20.0"), violations);
        ResourceUsage peak = ledger.getPeak("t1").orElseThrow();
        assertEquals(20.0, peak.get(ResourceType.MEMORY), 1e-9);
    }

    @Test
    void testCheckClaimsWithinLimits() {
        // Given
        ledger.claim("t1", Map.of("cpu", 2, "memory", 2));
        ledger.registerProcess("t1", PID, workDir);
        when(processProbe.startTime(PID)).thenReturn(Optional.empty());
        when(processProbe.descendants(PID)).thenReturn(List.of());
        when(processProbe.sample(PID)).thenReturn(Optional.of(new ProcessProbe.Sample(1.5, 1_000_000_000L)));

        // When
        Map<String, String> violations = ledger.checkClaims(true);

        // Then
        assertTrue(violations.isEmpty());
        ResourceUsage last = ledger.getFinal("t1").orElseThrow();
        assertEquals(1.5, last.get(ResourceType.CPU), 1e-9);
        assertEquals(1.0, last.get(ResourceType.MEMORY), 1e-9);
    }

    @Test
    void testCheckClaimsSkipsUnmeasurableClaims() {
        ledger.claim("t1", Map.of("cpu", 1));

        assertTrue(ledger.checkClaims(true).isEmpty());
        assertTrue(ledger.getPeak("t1").isEmpty());
    }

    @Test
    void testClaimsAndAvailableAlwaysAddUpToTotal() {
        // Given
        ResourceLedger gpuLedger = ResourceLedger.builder()
            .total(ResourceVector.builder().cpu(8).gpu(List.of("CUDA0", "CUDA1", "CUDA2", "CUDA3"))
                .memory(16).disk(100).time(10).build())
            .clock(Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC))
            .processProbe(processProbe)
            .gpuProbe(gpuProbe)
            .build();

        // When
        ResourceVector first = gpuLedger.claim("t1", Map.of("cpu", 2, "gpu", 2, "memory", 4));
        ResourceVector second = gpuLedger.claim("t2", Map.of("gpu", 1, "memory", 2, "disk", 30));

        // Then
        assertConserved(gpuLedger);
        assertTrue(Collections.disjoint(first.getGpu(), second.getGpu()));

        assertThrows(InsufficientResourceException.class, () -> gpuLedger.claim("t3", Map.of("gpu", 2)));
        assertConserved(gpuLedger);

        gpuLedger.release("t1");
        assertConserved(gpuLedger);

        ResourceVector third = gpuLedger.claim("t3", Map.of("gpu", 2, "cpu", 6));
        assertTrue(Collections.disjoint(second.getGpu(), third.getGpu()));
        assertConserved(gpuLedger);

        gpuLedger.release("t2");
        gpuLedger.release("t3");
        assertConserved(gpuLedger);
        assertEquals(4, gpuLedger.getAvailable().getGpu().size());
        assertEquals(8, gpuLedger.getAvailable().getCpu());
    }

    @Test
    void testVanishedChildrenAreForgotten() {
        // Given - a child that exits between two lookups
        ledger.claim("t1", Map.of("cpu", 1));
        ledger.registerProcess("t1", PID, workDir);
        when(processProbe.startTime(PID)).thenReturn(Optional.empty());
        when(processProbe.descendants(PID)).thenReturn(List.of(101L, 102L)).thenReturn(List.of(101L));
        when(processProbe.sample(anyLong())).thenReturn(Optional.of(new ProcessProbe.Sample(0.1, 1_000L)));

        // When
        ledger.getUsage("t1", true);
        ledger.getUsage("t1", true);

        // Then
        verify(processProbe).forget(List.of(102L));

        ledger.release("t1");
        verify(processProbe).forget(List.of(PID, 101L));
    }

    private static void assertConserved(ResourceLedger ledger) {
        ResourceVector total = ledger.getTotal();
        ResourceVector available = ledger.getAvailable();
        ResourceVector claimed = ledger.getClaimed();
        assertEquals(total.getCpu(), available.getCpu() + claimed.getCpu());
        assertEquals(total.getMemory(), available.getMemory() + claimed.getMemory(), 1e-9);
        assertEquals(total.getDisk(), available.getDisk() + claimed.getDisk(), 1e-9);

        List<String> gpus = new ArrayList<>(available.getGpu());
        gpus.addAll(claimed.getGpu());
        assertEquals(gpus.size(), new HashSet<>(gpus).size(), "a gpu is held twice");
        assertEquals(new HashSet<>(total.getGpu()), new HashSet<>(gpus));
    }
}
