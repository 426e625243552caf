package com.whereq.pilot.executor;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.exception.AdapterException;
import com.whereq.pilot.model.GridCompletion;
import com.whereq.pilot.model.GridJob;
import com.whereq.pilot.model.GridJobStatus;
import com.whereq.pilot.model.ResourceRequirement;
import com.whereq.pilot.model.TaskInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlurmAdapterTest {

    @Mock
    private CommandRunner commandRunner;

    @TempDir
    Path submitDir;

    private PilotProperties properties;

    private SlurmAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new PilotProperties();
        properties.getQueue().setType(PilotProperties.BatchSystem.SLURM);
        properties.getRest().setUrl("https://queue.example.org");
        adapter = new SlurmAdapter(properties, commandRunner,
            Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private TaskInfo task() {
        return TaskInfo.builder()
            .taskId("t1")
            .datasetId("d1")
            .name("generate")
            .taskConfig(Map.of("name", "generate", "batchsys", Map.of("slurm", Map.of("partition", "gpu"))))
            .requirement(ResourceRequirement.builder().cpu(2).gpu(1).memory(4.0).disk(10.0).time(2.0).build())
            .submitDir(submitDir.toString())
            .debug(true)
            .build();
    }

    @Test
    void testRenderSubmitScript() throws Exception {
        // When
        Path file = adapter.renderSubmitDescriptor(task(), "pilot.token", List.of("config.json", "pilot.token"));

        // Then
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals("#!/bin/bash", lines.get(0));
        assertTrue(lines.contains("#SBATCH --job-name=pilot_" + submitDir.getFileName()));
        assertTrue(lines.contains("#SBATCH --cpus-per-task=2"));
        assertTrue(lines.contains("#SBATCH --gres=gpu:1"));
        assertTrue(lines.contains("#SBATCH --mem=4000M"));
        assertTrue(lines.contains("#SBATCH --tmp=10000M"));
        assertTrue(lines.contains("#SBATCH --time=120"));
        assertTrue(lines.contains("#SBATCH --partition=gpu"));
        assertTrue(lines.contains("export NUM_CPUS=2"));
        assertTrue(lines.contains("export NUM_MEMORY=4.0"));
        assertTrue(lines.contains("export NUM_GPUS=1"));
        assertEquals(submitDir.resolve("loader.sh") + " --url https://queue.example.org --dataset-id d1 --task-id t1"
            + " --config config.json --credential-file pilot.token --debug --offline", lines.get(lines.size() - 1));
        assertTrue(Files.isExecutable(file));
    }

    @Test
    void testReadSubmitSettings() throws Exception {
        adapter.renderSubmitDescriptor(task(), null, List.of());

        Map<String, String> settings = adapter.readSubmitSettings(submitDir);

        assertEquals("4000m", settings.get("mem"));
        assertEquals("120", settings.get("time"));
    }

    @Test
    void testSubmit() {
        when(commandRunner.run(List.of("sbatch", SlurmAdapter.SUBMIT_FILE), submitDir))
            .thenReturn("Submitted batch job 4567\n");

        assertEquals("4567", adapter.submit(submitDir));
    }

    @Test
    void testSubmitWithoutId() {
        when(commandRunner.run(List.of("sbatch", SlurmAdapter.SUBMIT_FILE), submitDir))
            .thenReturn("sbatch: error: invalid partition\n");

        assertThrows(AdapterException.class, () -> adapter.submit(submitDir));
    }

    @Test
    void testLiveStatus() {
        when(commandRunner.run(anyList())).thenReturn(String.join("\n",
            "100 PD pilot_d1_t1_abc /scratch/submit/d1_t1_abc/submit.sh",
            "101 R other_job /home/user/run.sh",
            "102 R pilot_d2_t2_def /scratch/submit/d2_t2_def/submit.sh",
            "103 F pilot_d3_t3_ghi /scratch/submit/d3_t3_ghi/submit.sh"));

        Map<String, GridJob> jobs = adapter.getLiveStatus();

        assertEquals(3, jobs.size());
        assertEquals(GridJobStatus.QUEUED, jobs.get("100").getStatus());
        assertEquals("/scratch/submit/d1_t1_abc", jobs.get("100").getSubmitDir());
        assertEquals(GridJobStatus.PROCESSING, jobs.get("102").getStatus());
        assertEquals(GridJobStatus.ERROR, jobs.get("103").getStatus());
        assertEquals("Slurm", jobs.get("100").getSite());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCompletions() {
        // Given
        when(commandRunner.run(anyList())).thenReturn(String.join("\n",
            "100|COMPLETED|pilot_a|0:0|/scratch/submit/a",
            "100.batch|COMPLETED|batch|0:0|/scratch/submit/a",
            "101|FAILED|pilot_b|1:0|/scratch/submit/b",
            "102|RUNNING|pilot_c|0:0|/scratch/submit/c",
            "103|COMPLETED|someone_else|0:0|/home/x"));

        // When
        Map<String, GridCompletion> completions = adapter.getCompletions();

        // Then
        assertEquals(2, completions.size());
        assertTrue(completions.get("100").isOk());
        assertEquals("/scratch/submit/a", completions.get("100").getSubmitDir());
        assertFalse(completions.get("101").isOk());

        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(commandRunner).run(command.capture());
        int since = command.getValue().indexOf("-S");
        assertEquals("2024-04-27T12:00:00", command.getValue().get(since + 1));
    }

    @Test
    void testTranslateStatus() {
        assertEquals(GridJobStatus.QUEUED, SlurmAdapter.translateStatus("PD"));
        assertEquals(GridJobStatus.PROCESSING, SlurmAdapter.translateStatus("R"));
        assertEquals(GridJobStatus.COMPLETED, SlurmAdapter.translateStatus("CD"));
        assertEquals(GridJobStatus.ERROR, SlurmAdapter.translateStatus("CA"));
    }

    @Test
    void testRemove() {
        adapter.remove(List.of("100", "101"));

        verify(commandRunner).run(List.of("scancel", "100", "101"));
    }
}
