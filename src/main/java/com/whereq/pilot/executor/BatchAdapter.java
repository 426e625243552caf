package com.whereq.pilot.executor;

import com.whereq.pilot.model.GridCompletion;
import com.whereq.pilot.model.GridJob;
import com.whereq.pilot.model.TaskInfo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for batch system adapters.
 *
 * Calls block on batch system commands; callers move them off the event loop.
 */
public interface BatchAdapter {

    /**
     * Lowercase batch system name, matched against "batchsys" config keys
     */
    String getName();

    /**
     * Site name used for pilots and reports of this adapter
     */
    String getSite();

    /**
     * Name of the rendered submit descriptor inside the submit directory
     */
    String getSubmitFileName();

    /**
     * Batch system stdout of the job, holds the pilot's resource summary
     */
    String getOutputFileName();

    /**
     * Batch system event log, scanned for failure signatures
     */
    String getJobLogFileName();

    /**
     * Write the submit descriptor into the task's submit directory
     *
     * @param task enriched task with submit dir, requirement and config
     * @param credentialFile credential file name in the submit dir, or null
     * @param inputFiles extra files to transfer with the job
     * @return path of the descriptor
     * @throws IOException if the descriptor cannot be written
     */
    Path renderSubmitDescriptor(TaskInfo task, String credentialFile, List<String> inputFiles) throws IOException;

    /**
     * Submit the descriptor in a submit directory
     *
     * @return batch job id, comma-joined when the submission created several jobs
     */
    String submit(Path submitDir);

    /**
     * Jobs of this submitter currently known to the batch system, by batch job id
     */
    Map<String, GridJob> getLiveStatus();

    /**
     * Jobs of this submitter that left the batch system within the completion window
     */
    Map<String, GridCompletion> getCompletions();

    void remove(Collection<String> gridQueueIds);

    /**
     * Signatures scanned over the job log, first matching line wins
     */
    List<FailureSignature> getFailureSignatures();

    /**
     * Usage the batch system accounted for a job, keyed by dimension name
     */
    default Map<String, Object> getGridResources(Path submitDir) {
        return new LinkedHashMap<>();
    }

    /**
     * Host the job last ran on, read from the job log
     */
    default Optional<String> findExecutionHost(Path submitDir) {
        return Optional.empty();
    }

    /**
     * Read back the rendered descriptor as lowercase "key = value" settings
     */
    Map<String, String> readSubmitSettings(Path submitDir);
}
