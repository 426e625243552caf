package com.whereq.pilot.service;

import com.whereq.pilot.executor.BatchAdapter;
import com.whereq.pilot.executor.FailureSignature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns captured pilot and batch system logs into a task error reason
 */
@Slf4j
@Component
public class FailureClassifier {

    /**
     * Markers the pilot writes to its own log, scanned over every line
     */
    static final List<FailureSignature> TASK_LOG_SIGNATURES = List.of(
        FailureSignature.builder()
            .marker("failed to download")
            .reasonTemplate("failed to download input file(s)")
            .overriding(true)
            .build(),
        FailureSignature.builder()
            .marker("failed to upload")
            .reasonTemplate("failed to upload output file(s)")
            .overriding(true)
            .build(),
        FailureSignature.builder()
            .marker("Exception")
            .reasonTemplate("{line}")
            .build(),
        FailureSignature.builder()
            .marker("return code:")
            .reasonTemplate("task error: return code {tail}")
            .build()
    );

    /**
     * Scan a pilot log.
     *
     * Overriding markers replace an earlier reason, the others only apply while none is found.
     */
    public Optional<String> classifyTaskLog(String text) {
        String reason = null;
        for (String raw : text.split("\n")) {
            String line = raw.trim();
            for (FailureSignature signature : TASK_LOG_SIGNATURES) {
                if ((signature.isOverriding() || reason == null) && signature.matches(line)) {
                    reason = signature.reason(line, null);
                }
            }
        }
        return Optional.ofNullable(reason);
    }

    /**
     * Scan the batch system job log of a submit directory with the adapter's signatures
     *
     * @param resources reported resources, updated with usage found in the log
     */
    public Optional<String> classifyBatchLog(BatchAdapter adapter, Path submitDir, Map<String, Object> resources) {
        Path logFile = submitDir.resolve(adapter.getJobLogFileName());
        if (!Files.isRegularFile(logFile)) {
            return Optional.empty();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.info("cannot read {}: {}", logFile, e.getMessage());
            return Optional.empty();
        }
        return classifyBatchLog(adapter.getFailureSignatures(), lines, adapter.readSubmitSettings(submitDir), resources);
    }

    /**
     * First line matching any signature decides the reason
     */
    Optional<String> classifyBatchLog(List<FailureSignature> signatures, List<String> lines,
                                      Map<String, String> descriptor, Map<String, Object> resources) {
        for (String raw : lines) {
            String line = raw.trim();
            for (FailureSignature signature : signatures) {
                if (!signature.matches(line)) {
                    continue;
                }
                Optional<Double> value = signature.extractValue(line, descriptor);
                Object shown = value.orElse(null);
                if (signature.isRecordsUsage() && signature.getDimension() != null) {
                    String key = signature.getDimension().getKey();
                    value.filter(v -> v != 0).ifPresent(v -> resources.put(key, v));
                    shown = resources.get(key);
                }
                return Optional.of(signature.reason(line, shown));
            }
        }
        return Optional.empty();
    }
}
