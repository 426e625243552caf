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
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTCondor adapter submitting pilots directly with condor_submit
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class CondorAdapter extends AbstractBatchAdapter {

    public static final String SUBMIT_FILE = "condor.submit";

    private static final String IMAGE_ROOT = "/cvmfs/singularity.opensciencegrid.org/opensciencegrid/";

    private static final Map<String, String> IMAGES = Map.of(
        "RHEL_6_x86_64", "osgvo-el6:latest",
        "RHEL_7_x86_64", "osgvo-el7:latest",
        "RHEL_8_x86_64", "osgvo-el8:latest"
    );

    private static final String POLICY = "policy violation";

    private static final List<FailureSignature> SIGNATURES = List.of(
        FailureSignature.overusage(ResourceType.MEMORY)
            .marker(POLICY).marker("memory limit")
            .recordsUsage(true)
            .extractor((line, descriptor) -> FailureSignature.numberBetween(line, "used", "mb")
                .or(() -> FailureSignature.numberBetween(line, ":", "mb"))
                .map(mb -> mb / 1024.0))
            .build(),
        FailureSignature.overusage(ResourceType.MEMORY)
            .marker(POLICY).marker("memory usage exceeded")
            .recordsUsage(true)
            .build(),
        FailureSignature.overusage(ResourceType.CPU)
            .marker(POLICY).marker("cpu limit")
            .recordsUsage(true)
            .extractor(CondorAdapter::usedCores)
            .build(),
        FailureSignature.overusage(ResourceType.CPU)
            .marker(POLICY).marker("cpu consumption limit")
            .recordsUsage(true)
            .extractor(CondorAdapter::usedCores)
            .build(),
        FailureSignature.overusage(ResourceType.CPU)
            .marker(POLICY).marker("cpu usage exceeded")
            .recordsUsage(true)
            .build(),
        FailureSignature.overusage(ResourceType.TIME)
            .marker(POLICY).marker("execution time limit")
            .recordsUsage(true)
            .extractor((line, descriptor) -> FailureSignature.numberBetween(line, "used", ".")
                .map(seconds -> seconds / 3600.0))
            .build(),
        FailureSignature.overusage(ResourceType.DISK)
            .marker(POLICY).marker("local storage limit")
            .recordsUsage(true)
            .extractor((line, descriptor) -> FailureSignature.numberBetween(line, "used", "mb")
                .map(mb -> mb / 1024.0)
                .or(() -> FailureSignature.numberBetween(line, "used", "gb")))
            .build(),
        FailureSignature.overusage(ResourceType.DISK)
            .marker(POLICY).marker("disk usage exceeded")
            .recordsUsage(true)
            .build(),
        FailureSignature.overusage(ResourceType.CPU)
            .marker("cpu usage exceeded request_cpus")
            .integralValue(true)
            .extractor((line, descriptor) -> FailureSignature.descriptorValue(descriptor, "request_cpus", 1.0))
            .build(),
        FailureSignature.overusage(ResourceType.MEMORY)
            .marker("memory usage exceeded request_memory")
            .extractor((line, descriptor) -> FailureSignature.descriptorValue(descriptor, "request_memory", 1000.0))
            .build(),
        FailureSignature.overusage(ResourceType.DISK)
            .marker("disk usage exceeded request_disk")
            .extractor((line, descriptor) -> FailureSignature.descriptorValue(descriptor, "request_disk", 1_000_000.0))
            .build(),
        FailureSignature.overusage(ResourceType.TIME)
            .marker("runtime exceeded maximum")
            .extractor(CondorAdapter::runtimeLimit)
            .build(),
        FailureSignature.builder()
            .marker("transfer output files failure").ignoreCase(true)
            .reasonTemplate("Failed to transfer output files")
            .build(),
        FailureSignature.builder()
            .marker("transfer input files failure").ignoreCase(true)
            .reasonTemplate("Failed to transfer input files")
            .build(),
        FailureSignature.builder()
            .marker("failed due to remote transfer hook error").marker("failed to send file").ignoreCase(true)
            .reasonTemplate("Failed to transfer output files")
            .build(),
        FailureSignature.builder()
            .marker("failed due to remote transfer hook error").marker("failed to receive file").ignoreCase(true)
            .reasonTemplate("Failed to transfer input files")
            .build(),
        FailureSignature.builder()
            .marker("failed due to remote transfer hook error").ignoreCase(true)
            .reasonTemplate("Failed to transfer files")
            .build()
    );

    public CondorAdapter(PilotProperties properties, CommandRunner commandRunner) {
        this(properties, commandRunner, Clock.systemUTC());
    }

    public CondorAdapter(PilotProperties properties, CommandRunner commandRunner, Clock clock) {
        super(properties, commandRunner, clock);
    }

    @Override
    public String getName() {
        return "condor";
    }

    @Override
    protected String getDefaultSite() {
        return "CondorDirect";
    }

    @Override
    public String getSubmitFileName() {
        return SUBMIT_FILE;
    }

    @Override
    public String getOutputFileName() {
        return "condor.out";
    }

    @Override
    public String getJobLogFileName() {
        return "condor.log";
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
        args.add("--gzip-logs");

        BatchOptions batchOptions = mergeBatchOptions(task, inputFiles);
        List<String> requirements = batchOptions.getRequirements();

        Path file = submitDir.resolve(SUBMIT_FILE);
        try (PrintWriter p = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            p.println("universe = vanilla");
            p.println("executable = " + submitDir.resolve(PilotFiles.LOADER));
            p.println("log = " + getJobLogFileName());
            p.println("output = " + getOutputFileName());
            p.println("error = condor.err");
            p.println("notification = never");
            p.println("+IsPilotJob = True");
            p.println("want_graceful_removal = True");
            if (!batchOptions.getInputFiles().isEmpty()) {
                p.println("transfer_input_files = " + String.join(",", batchOptions.getInputFiles()));
            }
            p.println("skip_filechecks = True");
            p.println("should_transfer_files = always");
            p.println("when_to_transfer_output = ON_EXIT_OR_EVICT");
            p.println("+SpoolOnEvict = False");
            List<String> outputs = new ArrayList<>(batchOptions.getOutputFiles());
            outputs.add(PilotFiles.gzipped(PilotFiles.STDLOG));
            outputs.add(PilotFiles.gzipped(PilotFiles.STDOUT));
            outputs.add(PilotFiles.gzipped(PilotFiles.STDERR));
            p.println("transfer_output_files = " + String.join(",", outputs));
            if (!batchOptions.getOutputRemaps().isEmpty()) {
                p.println("transfer_output_remaps = \"" + String.join(";", batchOptions.getOutputRemaps()) + "\"");
            }

            // identity tags, also used to find our jobs again
            p.println("+PilotDatasetId = \"" + task.getDatasetId() + "\"");
            p.println("+PilotDataset = " + classAdNumber(task.getDataset()));
            p.println("+PilotJobId = \"" + task.getJobId() + "\"");
            p.println("+PilotJobIndex = " + classAdNumber(task.getJobIndex()));
            p.println("+PilotTaskId = \"" + task.getTaskId() + "\"");
            p.println("+PilotTaskIndex = " + classAdNumber(task.getTaskIndex()));
            p.println("+PilotTaskName = \"" + task.getName() + "\"");
            p.println("+PilotSiteId = \"" + properties.getSiteId() + "\"");

            p.println("+JobIsRunning = (JobStatus =!= 1) && (JobStatus =!= 5)");
            ResourceRequirement req = task.getRequirement() == null ? new ResourceRequirement() : task.getRequirement();
            if (req.getCpu() != null && req.getCpu() > 0) {
                p.println("request_cpus = " + req.getCpu());
            }
            if (req.getGpu() != null && req.getGpu() > 0) {
                p.println("request_gpus = " + req.getGpu());
            } else {
                requirements.add("(!isUndefined(Target.GPUs) ? Target.GPUs == 0 : True)");
            }
            if (req.getMemory() != null && req.getMemory() > 0) {
                p.println("request_memory = " + (long) (req.getMemory() * 1000));
            }
            if (req.getDisk() != null && req.getDisk() > 0) {
                p.println("request_disk = " + (long) (req.getDisk() * 1_000_000));
            }
            if (req.getTime() != null && req.getTime() > 0) {
                p.println("+OriginalTime = " + (long) (req.getTime() * 3600));
                p.println("+TargetTime = (!isUndefined(Target.PYGLIDEIN_TIME_TO_LIVE) ? Target.PYGLIDEIN_TIME_TO_LIVE : Target.TimeToLive)");
                p.println("Rank = Rank + (TargetTime - OriginalTime)/86400");
                requirements.add("TargetTime > OriginalTime");
            }
            String os = req.getPrimaryOs();
            if (os != null) {
                if (!properties.getQueue().isSingularity()) {
                    requirements.add(osRequirement(os));
                } else {
                    String image = IMAGES.get(os);
                    if (image == null) {
                        throw new IllegalArgumentException("bad OS selection: " + os);
                    }
                    p.println("+SingularityImage=\"" + IMAGE_ROOT + image + "\"");
                }
            }

            batchOptions.getOptions().forEach((key, value) -> p.println(key + "=" + value));
            if (!requirements.isEmpty()) {
                p.println("requirements = (" + String.join(")&&(", requirements) + ")");
            }

            p.println("arguments = " + String.join(" ", args));
            p.println("queue");
        }
        return file;
    }

    @Override
    public String submit(Path submitDir) {
        String out = commandRunner.run(List.of("condor_submit", "-terse", SUBMIT_FILE), submitDir);
        List<String> ids = parseTerseIds(out);
        if (ids.isEmpty()) {
            throw new AdapterException("did not get a grid queue id from condor_submit: " + out);
        }
        return String.join(",", ids);
    }

    /**
     * Expand "major.first - major.last" lines of condor_submit -terse
     */
    static List<String> parseTerseIds(String out) {
        List<String> ids = new ArrayList<>();
        for (String line : out.split("\n")) {
            String[] parts = line.split("-");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                continue;
            }
            String[] first = parts[0].trim().split("\\.");
            String[] last = parts[1].trim().split("\\.");
            if (first.length < 2 || last.length < 2) {
                continue;
            }
            try {
                int from = Integer.parseInt(first[1]);
                int to = Integer.parseInt(last[1]);
                for (int i = from; i <= to; i++) {
                    ids.add(first[0] + "." + i);
                }
            } catch (NumberFormatException e) {
                log.warn("bad condor_submit line: {}", line);
            }
        }
        return ids;
    }

    @Override
    public Map<String, GridJob> getLiveStatus() {
        String out = commandRunner.run(List.of("condor_q", "-constraint", ownerConstraint(),
            "-af:j,", "jobstatus", "MATCH_EXP_JOBGLIDEIN_ResourceName", "cmd"));
        Map<String, GridJob> jobs = new LinkedHashMap<>();
        for (String line : out.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = splitList(line);
            if (fields.size() != 4) {
                log.warn("bad condor_q line: {}", line);
                continue;
            }
            String cmd = fields.get(3);
            if (!cmd.contains(PilotFiles.LOADER)) {
                continue;
            }
            String gid = fields.get(0);
            jobs.put(gid, GridJob.builder()
                .gridQueueId(gid)
                .status(translateStatus(fields.get(1)))
                .submitDir(submitDirOf(cmd))
                .site(siteOf(fields.get(2)))
                .build());
        }
        return jobs;
    }

    static GridJobStatus translateStatus(String code) {
        return switch (code) {
            case "0", "1" -> GridJobStatus.QUEUED;
            case "2", "3", "6", "7" -> GridJobStatus.PROCESSING;
            case "4" -> GridJobStatus.COMPLETED;
            case "5" -> GridJobStatus.ERROR;
            default -> GridJobStatus.UNKNOWN;
        };
    }

    @Override
    public Map<String, GridCompletion> getCompletions() {
        String out = commandRunner.run(List.of("condor_history", "-constraint", ownerConstraint(),
            "-match", "50000", "-af:j,", "jobstatus", "exitcode", "exitbysignal",
            "MATCH_EXP_JOBGLIDEIN_ResourceName", "cmd"));
        Map<String, GridCompletion> completions = new LinkedHashMap<>();
        for (String line : out.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = splitList(line);
            if (fields.size() != 6) {
                log.warn("bad condor_history line: {}", line);
                continue;
            }
            String cmd = fields.get(5);
            if (!cmd.contains(PilotFiles.LOADER)) {
                continue;
            }
            boolean ok = fields.get(1).equals("4") && fields.get(2).equals("0") && fields.get(3).equals("false");
            String gid = fields.get(0);
            completions.put(gid, GridCompletion.builder()
                .gridQueueId(gid)
                .outcome(ok ? GridCompletion.Outcome.OK : GridCompletion.Outcome.ERROR)
                .submitDir(submitDirOf(cmd))
                .site(siteOf(fields.get(4)))
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
        cmd.add("condor_rm");
        cmd.addAll(gridQueueIds);
        commandRunner.run(cmd);
    }

    /**
     * Usage accounted by HTCondor for the job named in condor.out
     */
    @Override
    public Map<String, Object> getGridResources(Path submitDir) {
        Map<String, Object> resources = new LinkedHashMap<>();
        Optional<String> jobId = findBatchJobId(submitDir.resolve(getOutputFileName()));
        if (jobId.isEmpty()) {
            return resources;
        }
        String out;
        try {
            out = commandRunner.run(List.of("condor_q", jobId.get(), "-af:,",
                "CpusUsage", "GPUsUsage", "ResidentSetSize_RAW", "DiskUsage_RAW", "LastRemoteWallClockTime"));
        } catch (AdapterException e) {
            log.info("cannot get grid resources for {}: {}", jobId.get(), e.getMessage());
            return resources;
        }
        String[] values = out.trim().split(",");
        if (values.length != 5) {
            log.info("unexpected condor_q resources for {}: {}", jobId.get(), out);
            return resources;
        }
        putDefined(resources, ResourceType.CPU, values[0], 1.0);
        putDefined(resources, ResourceType.GPU, values[1], 1.0);
        putDefined(resources, ResourceType.MEMORY, values[2], 1024.0 * 1024.0);
        putDefined(resources, ResourceType.DISK, values[3], 1024.0 * 1024.0);
        putDefined(resources, ResourceType.TIME, values[4], 3600.0);
        return resources;
    }

    @Override
    public Optional<String> findExecutionHost(Path submitDir) {
        Path logFile = submitDir.resolve(getJobLogFileName());
        if (!Files.isRegularFile(logFile)) {
            return Optional.empty();
        }
        String host = null;
        try {
            for (String raw : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
                String line = raw.trim();
                if (line.contains("Job executing on host")) {
                    String tail = line.substring(line.lastIndexOf('<') + 1);
                    host = tail.contains(":") ? tail.substring(0, tail.indexOf(':')) : tail;
                }
                if (line.contains("Error from")) {
                    String[] words = line.split("\\s+");
                    if (words.length > 2) {
                        host = words[2].replace(":", "");
                    }
                }
            }
        } catch (IOException e) {
            log.info("cannot read {}: {}", logFile, e.getMessage());
        }
        return Optional.ofNullable(host);
    }

    private Optional<String> findBatchJobId(Path outputFile) {
        if (!Files.isRegularFile(outputFile)) {
            return Optional.empty();
        }
        try {
            for (String line : Files.readAllLines(outputFile, StandardCharsets.UTF_8)) {
                if (line.contains("Job submitted from host") && line.contains("(")) {
                    String[] parts = line.substring(line.indexOf('(') + 1).split("\\.");
                    if (parts.length >= 2) {
                        return Optional.of(parts[0] + "." + parts[1]);
                    }
                }
            }
        } catch (IOException e) {
            log.info("cannot read {}: {}", outputFile, e.getMessage());
        }
        return Optional.empty();
    }

    private String ownerConstraint() {
        return "Owner == \"" + user + "\" && PilotSiteId == \"" + properties.getSiteId() + "\"";
    }

    /**
     * HTCondor OS requirement for an OS_ARCH string such as RHEL_7_x86_64
     */
    static String osRequirement(String osArch) {
        String base = osArch;
        for (int i = 0; i < 2 && base.contains("_"); i++) {
            base = base.substring(0, base.lastIndexOf('_'));
        }
        if (base.contains(".")) {
            base = base.substring(0, base.lastIndexOf('.'));
        }
        return "(OpSysAndVer =?= \"" + base.replace("RHEL", "CentOS").replace("_", "") + "\""
            + " || OpSysAndVer =?= \"" + base.replace("RHEL", "SL").replace("_", "") + "\""
            + " || OSGVO_OS_STRING =?= \"" + base.replace("_", " ") + "\")";
    }

    private static Optional<Double> usedCores(String line, Map<String, String> descriptor) {
        return FailureSignature.numberBetween(line, "used", "cores")
            .or(() -> FailureSignature.numberBetween(line, "used", "usr"));
    }

    private static Optional<Double> runtimeLimit(String line, Map<String, String> descriptor) {
        String[] words = line.trim().split("\\s+");
        if (words.length < 2) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(words[words.length - 2].replace("(", "")) / 3600.0);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String siteOf(String raw) {
        return raw == null || raw.equals("undefined") ? null : raw;
    }

    private static Object classAdNumber(Integer value) {
        return value == null ? "undefined" : value;
    }

    private static void putDefined(Map<String, Object> resources, ResourceType type, String raw, double divisor) {
        String value = raw.trim();
        if (value.equals("undefined") || value.isEmpty()) {
            return;
        }
        try {
            resources.put(type.getKey(), Double.parseDouble(value) / divisor);
        } catch (NumberFormatException e) {
            log.debug("unreadable {} usage: {}", type.getKey(), value);
        }
    }
}
