package com.whereq.pilot.resource;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * GPU utilization from {@code nvidia-smi -q}
 */
@Slf4j
public class NvidiaSmiGpuProbe implements GpuProbe {

    private static final long TIMEOUT_SECONDS = 10;

    @Override
    public int utilization(String deviceId) {
        List<String> command = List.of("nvidia-smi", "-q", "-i", deviceId, "-d", "UTILIZATION,POWER");
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            List<String> lines = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lines.add(line);
                }
            }
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.info("nvidia-smi timed out for gpu {}", deviceId);
                return -1;
            }
            return parseUtilization(lines);
        } catch (IOException e) {
            log.info("nvidia-smi failed for gpu {}: {}", deviceId, e.getMessage());
            return -1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
    }

    /**
     * Find the "Gpu : NN %" line of the utilization section
     */
    static int parseUtilization(List<String> lines) {
        for (String raw : lines) {
            String line = raw.trim();
            int colon = line.lastIndexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            if ("Gpu".equals(key)) {
                String value = line.substring(colon + 1).replace("%", "").trim();
                try {
                    return Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    log.debug("unreadable gpu utilization: {}", value);
                    return -1;
                }
            }
        }
        return -1;
    }
}
