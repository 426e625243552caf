package com.whereq.pilot.executor;

import com.whereq.pilot.exception.AdapterException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands as local processes with a clean library path and a timeout
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    private final Duration timeout;

    public ProcessCommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public String run(List<String> command, Path workDir) {
        log.info("Executing command: {}", String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        processBuilder.environment().remove("LD_LIBRARY_PATH");
        if (workDir != null) {
            processBuilder.directory(workDir.toFile());
        }

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new AdapterException("cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        // drain output while waiting so a chatty command cannot fill the pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process));
        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new AdapterException(command.get(0) + " timed out after " + timeout.toSeconds() + " seconds");
            }
            String out = output.get(10, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new AdapterException("command failed, return code " + exitCode + ": "
                    + String.join(" ", command) + "\n" + out);
            }
            log.debug("{} output: {}", command.get(0), out);
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new AdapterException("interrupted while running " + command.get(0), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new AdapterException("cannot read output of " + command.get(0), e);
        }
    }

    private static String readOutput(Process process) {
        try (InputStream in = process.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
