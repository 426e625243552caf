package com.whereq.pilot.executor;

import com.whereq.pilot.model.ResourceType;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FailureSignatureTest {

    @Test
    void testAllMarkersMustMatch() {
        FailureSignature signature = FailureSignature.builder()
            .marker("policy violation").marker("memory limit")
            .ignoreCase(true)
            .reasonTemplate("memory")
            .build();

        assertTrue(signature.matches("Job removed: Policy Violation, Memory Limit reached"));
        assertFalse(signature.matches("Job removed: policy violation"));
    }

    @Test
    void testCaseSensitiveByDefault() {
        FailureSignature signature = FailureSignature.builder().marker("Exception").reasonTemplate("{line}").build();

        assertTrue(signature.matches("ValueError Exception: bad"));
        assertFalse(signature.matches("exception: bad"));
    }

    @Test
    void testReasonTemplates() {
        FailureSignature line = FailureSignature.builder().marker("x").reasonTemplate("{line}").build();
        FailureSignature tail = FailureSignature.builder().marker("x").reasonTemplate("return code {tail}").build();

        assertEquals("x: boom", line.reason("x: boom", null));
        assertEquals("return code 3", tail.reason("task error: return code: 3", null));
    }

    @Test
    void testOverusageReason() {
        FailureSignature memory = FailureSignature.overusage(ResourceType.MEMORY).marker("oom").build();
        FailureSignature cpu = FailureSignature.overusage(ResourceType.CPU).marker("cpu").integralValue(true).build();

        assertEquals("Resource overusage for memory: 2.5", memory.reason("oom", 2.5));
        assertEquals("Resource overusage for memory: ", memory.reason("oom", null));
        assertEquals("Resource overusage for cpu: 4", cpu.reason("cpu", 4.0));
    }

    @Test
    void testExtractorSeesFoldedLine() {
        FailureSignature signature = FailureSignature.overusage(ResourceType.MEMORY)
            .marker("memory limit")
            .extractor((line, descriptor) -> FailureSignature.numberBetween(line, "used", "mb"))
            .build();

        assertEquals(Optional.of(2048.0), signature.extractValue("Memory limit: used 2048 MB", Map.of()));
        assertEquals(Optional.empty(), FailureSignature.builder().marker("m").build().extractValue("m", Map.of()));
    }

    @Test
    void testNumberBetween() {
        assertEquals(Optional.of(3.5), FailureSignature.numberBetween("used 1 cores, then used 3.5 cores", "used", "cores"));
        assertEquals(Optional.empty(), FailureSignature.numberBetween("nothing here", "used", "cores"));
        assertEquals(Optional.empty(), FailureSignature.numberBetween("used lots cores", "used", "cores"));
    }

    @Test
    void testDescriptorValue() {
        Map<String, String> descriptor = Map.of("mem", "4000m", "request_disk", "10000000");

        assertEquals(Optional.of(4.0), FailureSignature.descriptorValue(descriptor, "mem", 1000.0));
        assertEquals(Optional.of(10.0), FailureSignature.descriptorValue(descriptor, "request_disk", 1_000_000.0));
        assertEquals(Optional.empty(), FailureSignature.descriptorValue(descriptor, "time", 60.0));
    }
}
