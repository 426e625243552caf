package com.whereq.pilot.service;

import com.whereq.pilot.dto.LogUpload;
import com.whereq.pilot.model.PilotFiles;
import com.whereq.pilot.queue.TaskQueueClient;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Uploads the captured pilot logs of a submit directory to the queue service
 */
@Slf4j
@Service
public class LogCollector {

    /**
     * Longer logs keep only their tail
     */
    static final int MAX_LOG_CHARS = 100_000_000;

    /**
     * Exit code of an illegal instruction, a node problem rather than a payload one
     */
    private static final int SIGILL_EXIT = 132;

    private static final List<String> NODE_FAILURE_MARKERS = List.of(
        "No such file or directory",
        "No space left on device",
        "Illegal instruction",
        "Input/output error",
        "OpenCL ERROR: clGetPlatformIDs"
    );

    private static final List<String> ENV_SHELL_FAILURE_MARKERS = List.of(
        "Killed",
        "python: command not found"
    );

    @Autowired
    private TaskQueueClient queueClient;

    /**
     * Logs captured in a submit directory
     */
    @Value
    public static class CapturedLogs {
        String stdlog;
        String stderr;
        String stdout;

        public static CapturedLogs read(Path submitDir) {
            if (submitDir == null) {
                return new CapturedLogs("", "", "");
            }
            return new CapturedLogs(
                readLog(submitDir.resolve(PilotFiles.STDLOG)),
                readLog(submitDir.resolve(PilotFiles.STDERR)),
                readLog(submitDir.resolve(PilotFiles.STDOUT)));
        }
    }

    /**
     * Upload stdlog, stderr and stdout of a pilot
     *
     * @param reason text uploaded as stdlog when the pilot left none, may be null
     * @return Mono with true when the payload itself failed
     */
    public Mono<Boolean> uploadLogs(String taskId, String datasetId, Path submitDir, String reason) {
        return Mono.fromCallable(() -> CapturedLogs.read(submitDir))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(logs -> {
                boolean payloadFailure = isPayloadFailure(logs.getStdlog(), logs.getStderr());
                String stdlog = logs.getStdlog().isEmpty() && reason != null ? reason : logs.getStdlog();
                return upload("stdlog", taskId, datasetId, stdlog)
                    .then(upload("stderr", taskId, datasetId, logs.getStderr()))
                    .then(upload("stdout", taskId, datasetId, logs.getStdout()))
                    .thenReturn(payloadFailure);
            });
    }

    private Mono<Void> upload(String name, String taskId, String datasetId, String data) {
        log.debug("Uploading {} for task {}", name, taskId);
        return queueClient.uploadLog(LogUpload.builder()
            .name(name)
            .taskId(taskId)
            .datasetId(datasetId)
            .data(data)
            .build());
    }

    /**
     * A task executable exited with a real error, and stderr does not point at the node
     */
    static boolean isPayloadFailure(String stdlog, String stderr) {
        boolean failed = false;
        for (String line : stdlog.split("\n")) {
            if (line.contains("task exe") && line.contains("return code")) {
                try {
                    int code = Integer.parseInt(line.substring(line.lastIndexOf(':') + 1).trim());
                    if (code != 0 && code != SIGILL_EXIT) {
                        failed = true;
                        break;
                    }
                } catch (NumberFormatException e) {
                    log.debug("unreadable return code line: {}", line);
                }
            }
        }
        if (!failed) {
            return false;
        }
        for (String line : stderr.split("\n")) {
            if (isNodeFailure(line)) {
                log.info("Node failure in stderr: {}", line);
                return false;
            }
        }
        return true;
    }

    private static boolean isNodeFailure(String line) {
        for (String marker : NODE_FAILURE_MARKERS) {
            if (line.contains(marker)) {
                return true;
            }
        }
        if (line.contains("env-shell.sh")) {
            for (String marker : ENV_SHELL_FAILURE_MARKERS) {
                if (line.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Read a log file, or its gzipped variant, keeping the tail of very long logs.
     *
     * Undecodable bytes are replaced. A truncated gzip stream yields what could
     * be decompressed.
     */
    public static String readLog(Path file) {
        StringBuilder data = new StringBuilder();
        try {
            if (Files.isRegularFile(file)) {
                data.append(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            } else {
                Path gz = file.resolveSibling(PilotFiles.gzipped(file.getFileName().toString()));
                if (Files.isRegularFile(gz)) {
                    readGzip(gz, data);
                }
            }
        } catch (IOException e) {
            log.info("error reading log {}: {}", file, e.getMessage());
        }
        if (data.length() > MAX_LOG_CHARS) {
            log.warn("logfile {} has length {} and will be trimmed", file, data.length());
            return data.substring(data.length() - MAX_LOG_CHARS);
        }
        return data.toString();
    }

    private static void readGzip(Path gz, StringBuilder data) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(gz));
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            char[] buffer = new char[8192];
            int n;
            while ((n = reader.read(buffer)) != -1) {
                data.append(buffer, 0, n);
            }
        } catch (EOFException e) {
            log.info("truncated gzip log {}, keeping {} chars", gz, data.length());
        }
    }
}
