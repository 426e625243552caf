package com.whereq.pilot.executor;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs batch system commands
 */
public interface CommandRunner {

    /**
     * Run a command and wait for it
     *
     * @param command program and arguments
     * @param workDir working directory, or null for the current one
     * @return stdout and stderr merged
     * @throws com.whereq.pilot.exception.AdapterException on a non-zero exit, a timeout or an I/O failure
     */
    String run(List<String> command, Path workDir);

    default String run(List<String> command) {
        return run(command, null);
    }
}
