package com.whereq.pilot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.model.PilotFiles;
import com.whereq.pilot.model.TaskInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates and cleans the per-pilot submit directories.
 *
 * A submit directory is named {@code <datasetId>_<taskId>_<random>} under the
 * configured root and holds the loader script, the serialized dataset config,
 * the pilot credential and later the captured logs.
 */
@Slf4j
@Service
public class SubmitDirectoryManager {

    @Autowired
    private PilotProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    public Path getRoot() {
        return Path.of(properties.getQueue().getSubmitDir());
    }

    /**
     * Create the submit directory of a task, owner access only
     */
    public Path create(TaskInfo task) throws IOException {
        Path root = getRoot();
        Files.createDirectories(root);
        // temp directories are created rwx------ on posix file systems
        Path dir = Files.createTempDirectory(root, task.getDatasetId() + "_" + task.getTaskId() + "_");
        log.info("Created submit dir {} for task {}", dir, task.getTaskId());

        copyLoader(dir.resolve(PilotFiles.LOADER));

        Map<String, Object> config = task.getConfig() == null ? new LinkedHashMap<>() : task.getConfig();
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(PilotFiles.CONFIG).toFile(), config);
        return dir;
    }

    /**
     * Store the pilot credential, readable by the owner only
     */
    public Path writeCredential(Path dir, String token) throws IOException {
        Path file = dir.resolve(PilotFiles.CREDENTIAL);
        Files.writeString(file, token, StandardCharsets.UTF_8);
        setPermissions(file, "rw-------");
        return file;
    }

    /**
     * Files of a submit directory the batch system must transfer to the job
     */
    public List<String> inputFiles(Path dir) {
        List<String> files = new ArrayList<>();
        files.add(PilotFiles.CONFIG);
        if (Files.exists(dir.resolve(PilotFiles.CREDENTIAL))) {
            files.add(PilotFiles.CREDENTIAL);
        }
        return files;
    }

    /**
     * Submit directories older than the retention that no live job uses
     *
     * @param protectedDirs submit dirs of live jobs
     */
    public List<Path> findExpired(Set<Path> protectedDirs, Instant now, Duration retention) throws IOException {
        List<Path> expired = new ArrayList<>();
        Path root = getRoot();
        if (!Files.isDirectory(root)) {
            return expired;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
            for (Path dir : stream) {
                Path normalized = dir.toAbsolutePath().normalize();
                if (protectedDirs.contains(normalized)
                        || !Files.isDirectory(dir)
                        || !dir.getFileName().toString().contains("_")) {
                    continue;
                }
                // the mtime is the submit time, so the whole lifetime must have passed
                Instant modified = Files.getLastModifiedTime(dir).toInstant();
                if (Duration.between(modified, now).compareTo(retention) < 0) {
                    continue;
                }
                expired.add(dir);
            }
        }
        return expired;
    }

    /**
     * Delete submit directories, failures are logged and skipped
     *
     * @return number of directories deleted
     */
    public int delete(Collection<Path> dirs) {
        int deleted = 0;
        for (Path dir : dirs) {
            try {
                if (FileSystemUtils.deleteRecursively(dir)) {
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Cannot delete submit dir {}: {}", dir, e.getMessage());
            }
        }
        if (deleted > 0) {
            log.info("Deleted {} submit dirs", deleted);
        }
        return deleted;
    }

    private void copyLoader(Path target) throws IOException {
        String loaderScript = properties.getQueue().getLoaderScript();
        if (loaderScript != null && !loaderScript.isBlank()) {
            Files.copy(Path.of(loaderScript), target);
        } else {
            try (InputStream in = new ClassPathResource(PilotFiles.LOADER).getInputStream()) {
                Files.copy(in, target);
            }
        }
        setPermissions(target, "rwx------");
    }

    private static void setPermissions(Path file, String permissions) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString(permissions));
        } catch (UnsupportedOperationException e) {
            log.debug("posix permissions not supported for {}", file);
        }
    }

    /**
     * Normalized form used to compare submit dirs reported by the batch system
     */
    public static Path normalize(String dir) {
        return Path.of(dir).toAbsolutePath().normalize();
    }
}
