package com.mediai.mediai_agents.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediai.mediai_agents.model.crew.CrewContext;
import com.mediai.mediai_agents.model.domain.RunStatus;
import com.mediai.mediai_agents.model.domain.WorkflowRun;
import com.mediai.mediai_agents.service.WorkflowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentCommandLineRunnerTest {

    @Mock
    private WorkflowService workflowService;

    @TempDir
    Path tempDir;

    private AgentCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new AgentCommandLineRunner(workflowService, new ObjectMapper());
    }

    @Test
    void shouldPassIngestOptionsToIngestionTask() throws Exception {
        when(workflowService.runDataPipeline(any(CrewContext.class), eq("CLI"))).thenReturn(run(RunStatus.SUCCESS));

        runner.run(new DefaultApplicationArguments("ingest", "--source-file=icustays.csv",
                "--target-table=raw.icustays", "--batch-size=500", "--checkpoint-file=cp.json"));

        ArgumentCaptor<CrewContext> captor = ArgumentCaptor.forClass(CrewContext.class);
        verify(workflowService).runDataPipeline(captor.capture(), eq("CLI"));
        Map<String, Object> input = captor.getValue().task("ingestion").orElseThrow();
        assertEquals("icustays.csv", input.get("source_file"));
        assertEquals("500", input.get("batch_size"));
        assertEquals("cp.json", input.get("checkpoint_file"));
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void shouldExitNonZeroWhenRequiredOptionsAreMissing() throws Exception {
        runner.run(new DefaultApplicationArguments("ingest", "--source-file=icustays.csv"));

        assertEquals(1, runner.getExitCode());
        verifyNoInteractions(workflowService);
    }

    @Test
    void shouldExitNonZeroForUnknownWorkflow() throws Exception {
        runner.run(new DefaultApplicationArguments("train-everything"));

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void shouldSplitTransformModels() throws Exception {
        when(workflowService.runDataPipeline(any(CrewContext.class), eq("CLI"))).thenReturn(run(RunStatus.SUCCESS));

        runner.run(new DefaultApplicationArguments("transform", "--models=staging.*, marts.*"));

        ArgumentCaptor<CrewContext> captor = ArgumentCaptor.forClass(CrewContext.class);
        verify(workflowService).runDataPipeline(captor.capture(), eq("CLI"));
        assertEquals(List.of("staging.*", "marts.*"), captor.getValue().task("transformation").orElseThrow().get("models"));
    }

    @Test
    void shouldRunWorkflowFromContextFile() throws Exception {
        Path contextFile = tempDir.resolve("workflow.json");
        Files.writeString(contextFile, "{\"deployment\": {\"deployment\": {\"model_name\": \"m\", \"version\": \"1\"}}}");
        when(workflowService.runWorkflow(any(), eq("CLI"))).thenReturn(run(RunStatus.PARTIAL_SUCCESS));

        runner.run(new DefaultApplicationArguments("workflow", "--context-file=" + contextFile));

        assertEquals(1, runner.getExitCode(), "only full success exits 0");
    }

    @Test
    void shouldDefaultFullPipelineDataDir() throws Exception {
        when(workflowService.ingestSampleData(Path.of("data/sample"), "CLI")).thenReturn(run(RunStatus.SUCCESS));

        runner.run(new DefaultApplicationArguments("full-pipeline"));

        assertEquals(0, runner.getExitCode());
    }

    private static WorkflowRun run(RunStatus status) {
        WorkflowRun run = new WorkflowRun();
        run.setId(UUID.randomUUID());
        run.setStatus(status);
        run.setReportSnapshot(Map.of("status", status.name().toLowerCase()));
        return run;
    }
}
