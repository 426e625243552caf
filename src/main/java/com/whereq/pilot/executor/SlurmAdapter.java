package com.whereq.pilot.executor;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.exception.AdapterException;
import com.whereq.pilot.model.GridCompletion;
import com.whereq.pilot.model.GridJob;
import com.whereq.pilot.model.GridJobStatus;
import com.whereq.pilot.model.PilotFiles;
import com.whereq.pilot.model.ResourceRequirement;
import com.whereq.pilot.model.ResourceType;
import com.whereq.pilot.model.TaskInfo;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SLURM adapter submitting pilots with sbatch
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class SlurmAdapter extends AbstractBatchAdapter {

    public static final String SUBMIT_FILE = "submit.sh";

    static final String JOB_PREFIX = "pilot_";

    private static final Set<String> UNFINISHED = Set.of("PENDING", "RESIZING", "REQUEUED", "RUNNING");

    private static final List<FailureSignature> SIGNATURES = List.of(
        FailureSignature.overusage(ResourceType.MEMORY)
            .marker("oom-kill")
            .extractor((line, descriptor) -> FailureSignature.descriptorValue(descriptor, "mem", 1000.0))
            .build(),
        FailureSignature.overusage(ResourceType.MEMORY)
            .marker("exceeded job memory limit")
            .extractor((line, descriptor) -> FailureSignature.descriptorValue(descriptor, "mem", 1000.0))
            .build(),
        FailureSignature.overusage(ResourceType.TIME)
            .marker("due to time limit")
            .extractor((line, descriptor) -> FailureSignature.descriptorValue(descriptor, "time", 60.0))
            .build()
    );

    public SlurmAdapter(PilotProperties properties, CommandRunner commandRunner) {
        this(properties, commandRunner, Clock.systemUTC());
    }

    public SlurmAdapter(PilotProperties properties, CommandRunner commandRunner, Clock clock) {
        super(properties, commandRunner, clock);
    }

    @Override
    public String getName() {
        return "slurm";
    }

    @Override
    protected String getDefaultSite() {
        return "Slurm";
    }

    @Override
    public String getSubmitFileName() {
        return SUBMIT_FILE;
    }

    @Override
    public String getOutputFileName() {
        return "slurm.out";
    }

    @Override
    public String getJobLogFileName() {
        return "slurm.err";
    }

    @Override
    public List<FailureSignature> getFailureSignatures() {
        return SIGNATURES;
    }

    @Override
    public Path renderSubmitDescriptor(TaskInfo task, String credentialFile, List<String> inputFiles) throws IOException {
        Path submitDir = Path.of(task.getSubmitDir());
        List<String> args = submitArguments(task, credentialFile);
        args.add("--offline");
        BatchOptions batchOptions = mergeBatchOptions(task, inputFiles);
        ResourceRequirement req = task.getRequirement() == null ? new ResourceRequirement() : task.getRequirement();

        Path file = submitDir.resolve(SUBMIT_FILE);
        try (PrintWriter p = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            p.println("#!/bin/bash");
            p.println("#SBATCH --output=" + submitDir.resolve(getOutputFileName()));
            p.println("#SBATCH --error=" + submitDir.resolve(getJobLogFileName()));
            p.println("#SBATCH --chdir=" + submitDir);
            p.println("#SBATCH --ntasks=1");
            p.println("#SBATCH --export=NONE");
            p.println("#SBATCH --mail-type=NONE");
            p.println("#SBATCH --job-name=" + JOB_PREFIX + submitDir.getFileName());

            if (positive(req.getCpu())) {
                p.println("#SBATCH --cpus-per-task=" + req.getCpu());
            }
            if (positive(req.getGpu())) {
                p.println("#SBATCH --gres=gpu:" + req.getGpu());
            }
            if (positive(req.getMemory())) {
                p.println("#SBATCH --mem=" + (long) (req.getMemory() * 1000) + "M");
            }
            if (positive(req.getDisk())) {
                p.println("#SBATCH --tmp=" + (long) (req.getDisk() * 1000) + "M");
            }
            if (positive(req.getTime())) {
                p.println("#SBATCH --time=" + (long) (req.getTime() * 60));
            }
            batchOptions.getOptions().forEach((key, value) -> p.println("#SBATCH --" + key + "=" + value));

            // the loader reads its allocation from the environment
            for (ResourceType type : ResourceType.values()) {
                Double value = req.get(type);
                if (positive(value)) {
                    Object rendered = type.isIntegral() ? (Object) value.longValue() : (Object) value;
                    p.println("export " + environmentName(type) + "=" + rendered);
                }
            }

            p.println(submitDir.resolve(PilotFiles.LOADER) + " " + String.join(" ", args));
        }
        makeExecutable(file);
        return file;
    }

    @Override
    public String submit(Path submitDir) {
        String out = commandRunner.run(List.of("sbatch", SUBMIT_FILE), submitDir);
        for (String line : out.split("\n")) {
            if (line.contains("Submitted batch job")) {
                String trimmed = line.trim();
                return trimmed.substring(trimmed.lastIndexOf(' ') + 1);
            }
        }
        throw new AdapterException("did not get a grid queue id from sbatch: " + out);
    }

    @Override
    public Map<String, GridJob> getLiveStatus() {
        String out = commandRunner.run(List.of("squeue", "-u", user, "-h", "-o", "%A %t %j %o"));
        Map<String, GridJob> jobs = new LinkedHashMap<>();
        for (String line : out.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.trim().split("\\s+");
            if (fields.length < 4) {
                log.warn("bad squeue line: {}", line);
                continue;
            }
            if (!fields[2].startsWith(JOB_PREFIX)) {
                continue;
            }
            jobs.put(fields[0], GridJob.builder()
                .gridQueueId(fields[0])
                .status(translateStatus(fields[1]))
                .submitDir(submitDirOf(fields[3]))
                .site(getSite())
                .build());
        }
        return jobs;
    }

    static GridJobStatus translateStatus(String code) {
        return switch (code) {
            case "PD" -> GridJobStatus.QUEUED;
            case "R" -> GridJobStatus.PROCESSING;
            case "CD" -> GridJobStatus.COMPLETED;
            default -> GridJobStatus.ERROR;
        };
    }

    @Override
    public Map<String, GridCompletion> getCompletions() {
        String since = LocalDateTime.now(clock)
            .minusDays(properties.getQueue().getCompletionWindowDays())
            .truncatedTo(ChronoUnit.SECONDS)
            .format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        String out = commandRunner.run(List.of("sacct", "-u", user, "-n", "-P", "-S", since,
            "-o", "JobIDRaw,State,JobName,ExitCode,Workdir"));
        Map<String, GridCompletion> completions = new LinkedHashMap<>();
        for (String line : out.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.trim().split("\\|", -1);
            if (fields.length != 5) {
                log.warn("bad sacct line: {}", line);
                continue;
            }
            String state = fields[1];
            if (UNFINISHED.contains(state) || !fields[2].startsWith(JOB_PREFIX)) {
                continue;
            }
            boolean ok = state.equals("COMPLETED") && fields[3].equals("0:0");
            completions.put(fields[0], GridCompletion.builder()
                .gridQueueId(fields[0])
                .outcome(ok ? GridCompletion.Outcome.OK : GridCompletion.Outcome.ERROR)
                .submitDir(fields[4])
                .site(getSite())
                .build());
        }
        return completions;
    }

    @Override
    public void remove(Collection<String> gridQueueIds) {
        if (gridQueueIds == null || gridQueueIds.isEmpty()) {
            return;
        }
        List<String> cmd = new ArrayList<>();
        cmd.add("scancel");
        cmd.addAll(gridQueueIds);
        commandRunner.run(cmd);
    }

    /**
     * Variable the resource detector reads a dimension from
     */
    static String environmentName(ResourceType type) {
        return switch (type) {
            case CPU -> "NUM_CPUS";
            case GPU -> "NUM_GPUS";
            default -> "NUM_" + type.name();
        };
    }

    private static boolean positive(Number value) {
        return value != null && value.doubleValue() > 0;
    }

    private static void makeExecutable(Path file) throws IOException {
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(file);
            permissions.add(PosixFilePermission.OWNER_EXECUTE);
            Files.setPosixFilePermissions(file, permissions);
        } catch (UnsupportedOperationException e) {
            log.debug("cannot set posix permissions on {}", file);
            if (!file.toFile().setExecutable(true)) {
                throw new IOException("cannot make " + file + " executable", e);
            }
        }
    }
}
