package com.whereq.pilot.resource;

import lombok.extern.slf4j.Slf4j;
import oshi.SystemInfo;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process metrics through OSHI.
 *
 * CPU load is measured between two consecutive samples of the same pid, the
 * first sample of a pid reports its load since it started.
 */
@Slf4j
public class OshiProcessProbe implements ProcessProbe {

    private final OperatingSystem os;

    private final Map<Long, OSProcess> previous = new ConcurrentHashMap<>();

    public OshiProcessProbe() {
        this(new SystemInfo().getOperatingSystem());
    }

    public OshiProcessProbe(OperatingSystem os) {
        this.os = os;
    }

    @Override
    public List<Long> descendants(long pid) {
        return os.getDescendantProcesses((int) pid,
                OperatingSystem.ProcessFiltering.ALL_PROCESSES,
                OperatingSystem.ProcessSorting.NO_SORTING, 0)
            .stream()
            .map(p -> (long) p.getProcessID())
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Sample> sample(long pid) {
        OSProcess process = os.getProcess((int) pid);
        if (process == null) {
            previous.remove(pid);
            return Optional.empty();
        }
        OSProcess prior = previous.put(pid, process);
        double cpu = prior != null
            ? process.getProcessCpuLoadBetweenTicks(prior)
            : process.getProcessCpuLoadCumulative();
        return Optional.of(new Sample(cpu, process.getResidentSetSize()));
    }

    @Override
    public Optional<Instant> startTime(long pid) {
        OSProcess process = os.getProcess((int) pid);
        if (process == null || process.getStartTime() <= 0) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochMilli(process.getStartTime()));
    }

    @Override
    public void forget(Collection<Long> pids) {
        previous.keySet().removeAll(pids);
    }

    int tracked() {
        return previous.size();
    }
}
