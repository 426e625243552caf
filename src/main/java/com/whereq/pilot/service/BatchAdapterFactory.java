package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.executor.BatchAdapter;
import com.whereq.pilot.executor.CommandRunner;
import com.whereq.pilot.executor.CondorAdapter;
import com.whereq.pilot.executor.ProcessCommandRunner;
import com.whereq.pilot.executor.SlurmAdapter;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Factory for the batch adapter configured for this queue host
 */
@Slf4j
@Service
public class BatchAdapterFactory {

    @Autowired
    private PilotProperties properties;

    private BatchAdapter adapter;

    @PostConstruct
    public void initialize() {
        CommandRunner runner = new ProcessCommandRunner(
            Duration.ofSeconds(properties.getQueue().getCommandTimeoutSeconds()));
        adapter = createAdapter(properties.getQueue().getType(), runner);
        log.info("Using {} batch adapter for site {}", adapter.getName(), adapter.getSite());
    }

    /**
     * The adapter selected by pilot.queue.type
     */
    public BatchAdapter getAdapter() {
        if (adapter == null) {
            throw new IllegalStateException("Batch adapter is not initialized");
        }
        return adapter;
    }

    BatchAdapter createAdapter(PilotProperties.BatchSystem type, CommandRunner runner) {
        return switch (type) {
            case CONDOR -> new CondorAdapter(properties, runner);
            case SLURM -> new SlurmAdapter(properties, runner);
        };
    }
}
