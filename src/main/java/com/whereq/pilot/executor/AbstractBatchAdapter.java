package com.whereq.pilot.executor;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.model.PilotFiles;
import com.whereq.pilot.model.TaskInfo;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared plumbing of the command line batch adapters: batch option layering,
 * pilot arguments and descriptor read-back.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public abstract class AbstractBatchAdapter implements BatchAdapter {

    private static final String SBATCH_PREFIX = "#sbatch --";

    protected final PilotProperties properties;

    protected final CommandRunner commandRunner;

    protected final Clock clock;

    /**
     * Local account owning the batch jobs
     */
    protected final String user;

    protected AbstractBatchAdapter(PilotProperties properties, CommandRunner commandRunner, Clock clock) {
        this.properties = properties;
        this.commandRunner = commandRunner;
        this.clock = clock;
        this.user = System.getProperty("user.name");
    }

    /**
     * Site reported for jobs of this adapter when the batch system does not name one
     */
    protected abstract String getDefaultSite();

    @Override
    public String getSite() {
        String site = properties.getQueue().getSite();
        return site == null || site.isBlank() ? getDefaultSite() : site;
    }

    /**
     * Batch options after layering global, dataset steering and task settings
     */
    @Getter
    protected static class BatchOptions {
        private final List<String> requirements = new ArrayList<>();
        private final Map<String, String> options = new LinkedHashMap<>();
        private final List<String> inputFiles = new ArrayList<>();
        private final List<String> outputFiles = new ArrayList<>();
        private final List<String> outputRemaps = new ArrayList<>();
    }

    protected BatchOptions mergeBatchOptions(TaskInfo task, List<String> inputFiles) {
        BatchOptions batchOptions = new BatchOptions();
        if (inputFiles != null) {
            batchOptions.inputFiles.addAll(inputFiles);
        }

        applyLayer(batchOptions, properties.getQueue().getBatchopts(), false);

        Map<String, Object> steering = asMap(task.getConfig() == null ? null : task.getConfig().get("steering"));
        applyMatching(batchOptions, asMap(steering.get("batchsys")), false, task.getTaskId());

        Map<String, Object> taskConfig = task.getTaskConfig();
        if (taskConfig != null) {
            applyMatching(batchOptions, asMap(taskConfig.get("batchsys")), true, task.getTaskId());
        }
        return batchOptions;
    }

    private void applyMatching(BatchOptions batchOptions, Map<String, Object> batchsys, boolean taskLayer, String taskId) {
        for (Map.Entry<String, Object> entry : batchsys.entrySet()) {
            if (getName().startsWith(entry.getKey().toLowerCase(Locale.ROOT))) {
                log.info("{} {} batchsys options: {}", taskId, taskLayer ? "task" : "steering", entry.getValue());
                applyLayer(batchOptions, asMap(entry.getValue()), taskLayer);
            }
        }
    }

    private static void applyLayer(BatchOptions batchOptions, Map<String, ?> layer, boolean taskLayer) {
        if (layer == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : layer.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            String value = String.valueOf(entry.getValue());
            if (key.equals("requirements")) {
                batchOptions.requirements.add(value);
            } else if (taskLayer && key.equals("transfer_input_files")) {
                batchOptions.inputFiles.addAll(splitList(value));
            } else if (taskLayer && key.equals("transfer_output_files")) {
                batchOptions.outputFiles.addAll(splitList(value));
            } else if (taskLayer && key.equals("transfer_output_remaps")) {
                batchOptions.outputRemaps.addAll(splitList(value));
            } else {
                batchOptions.options.put(entry.getKey(), value);
            }
        }
    }

    /**
     * Arguments passed to the loader script
     */
    protected List<String> submitArguments(TaskInfo task, String credentialFile) {
        List<String> args = new ArrayList<>();
        args.add("--url");
        args.add(properties.getRest().getUrl());
        args.add("--dataset-id");
        args.add(task.getDatasetId());
        args.add("--task-id");
        args.add(task.getTaskId());
        if (task.getPilot() != null && task.getPilot().getPilotId() != null) {
            args.add("--pilot-id");
            args.add(task.getPilot().getPilotId());
        }
        args.add("--config");
        args.add(PilotFiles.CONFIG);
        if (credentialFile != null) {
            args.add("--credential-file");
            args.add(credentialFile);
        }
        if (task.isDebug()) {
            args.add("--debug");
        }
        return args;
    }

    @Override
    public Map<String, String> readSubmitSettings(Path submitDir) {
        Map<String, String> settings = new LinkedHashMap<>();
        Path file = submitDir.resolve(getSubmitFileName());
        if (!Files.isRegularFile(file)) {
            return settings;
        }
        try {
            for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String line = raw.trim().toLowerCase(Locale.ROOT);
                if (line.startsWith(SBATCH_PREFIX)) {
                    line = line.substring(SBATCH_PREFIX.length());
                }
                int eq = line.indexOf('=');
                if (eq > 0) {
                    settings.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
                }
            }
        } catch (IOException e) {
            log.info("cannot read submit settings from {}: {}", file, e.getMessage());
        }
        return settings;
    }

    /**
     * Directory of the loader a batch job executes
     */
    protected static String submitDirOf(String command) {
        Path parent = Path.of(command.trim().split("\\s+")[0]).getParent();
        return parent == null ? null : parent.toString();
    }

    protected static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : Arrays.asList(value.split(","))) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    protected static Map<String, Object> asMap(Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((key, item) -> map.put(String.valueOf(key), item));
        }
        return map;
    }
}
