package com.mediai.mediai_agents.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediai.mediai_agents.agent.impl.DataIngestionAgent;
import com.mediai.mediai_agents.agent.impl.DataTransformationAgent;
import com.mediai.mediai_agents.model.crew.CrewContext;
import com.mediai.mediai_agents.model.crew.WorkflowContext;
import com.mediai.mediai_agents.model.domain.RunStatus;
import com.mediai.mediai_agents.model.domain.WorkflowRun;
import com.mediai.mediai_agents.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one workflow from the command line and exits.
 *
 * Usage (with --mediai.cli.enabled=true):
 *   ingest        --source-file=FILE --target-table=schema.table [--batch-size=N] [--checkpoint-file=FILE]
 *   transform     [--models=staging.*,marts.*]
 *   quality       --target-table=schema.table
 *   full-pipeline [--data-dir=data/sample]
 *   workflow      --context-file=FILE
 *
 * Exit code 0 when the run succeeded, 1 otherwise (bad arguments included).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mediai.cli.enabled", havingValue = "true")
public class AgentCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String TRIGGERED_BY = "CLI";
    static final String DEFAULT_DATA_DIR = "data/sample";

    private final WorkflowService workflowService;
    private final ObjectMapper    objectMapper;

    private int exitCode = 1;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.error("No workflow given. Expected one of: ingest, transform, quality, full-pipeline, workflow");
            return;
        }

        String workflow = positional.get(0);
        WorkflowRun run = switch (workflow) {
            case "ingest"        -> ingest(args);
            case "transform"     -> transform(args);
            case "quality"       -> quality(args);
            case "full-pipeline" -> workflowService.ingestSampleData(
                    Path.of(option(args, "data-dir", DEFAULT_DATA_DIR)), TRIGGERED_BY);
            case "workflow"      -> workflow(args);
            default -> {
                log.error("Unknown workflow: {}", workflow);
                yield null;
            }
        };
        if (run == null) {
            return;
        }

        log.info("Run {} finished with status {}:\n{}", run.getId(), run.getStatus(), prettyPrint(run.getReportSnapshot()));
        exitCode = run.getStatus() == RunStatus.SUCCESS ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private WorkflowRun ingest(ApplicationArguments args) {
        String sourceFile = option(args, "source-file", null);
        String targetTable = option(args, "target-table", null);
        if (sourceFile == null || targetTable == null) {
            log.error("--source-file and --target-table required for ingestion");
            return null;
        }

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("source_file", sourceFile);
        input.put("target_table", targetTable);
        String batchSize = option(args, "batch-size", null);
        if (batchSize != null) input.put("batch_size", batchSize);
        String checkpointFile = option(args, "checkpoint-file", null);
        if (checkpointFile != null) input.put("checkpoint_file", checkpointFile);

        return workflowService.runDataPipeline(CrewContext.of(DataIngestionAgent.TASK, input), TRIGGERED_BY);
    }

    private WorkflowRun transform(ApplicationArguments args) {
        List<String> models = Arrays.stream(option(args, "models", "staging.*").split(","))
                .map(String::trim)
                .filter(m -> !m.isEmpty())
                .toList();
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("command", "run");
        input.put("models", models);
        return workflowService.runDataPipeline(CrewContext.of(DataTransformationAgent.TASK, input), TRIGGERED_BY);
    }

    private WorkflowRun quality(ApplicationArguments args) {
        String targetTable = option(args, "target-table", null);
        if (targetTable == null) {
            log.error("--target-table required for quality check");
            return null;
        }
        return workflowService.runDataPipeline(null, targetTable, false, true, TRIGGERED_BY);
    }

    @SuppressWarnings("unchecked")
    private WorkflowRun workflow(ApplicationArguments args) throws Exception {
        String contextFile = option(args, "context-file", null);
        if (contextFile == null || !Files.exists(Path.of(contextFile))) {
            log.error("--context-file must point to a JSON workflow context, got: {}", contextFile);
            return null;
        }
        Map<String, Object> raw = objectMapper.readValue(new File(contextFile), Map.class);
        return workflowService.runWorkflow(WorkflowContext.from(raw), TRIGGERED_BY);
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return fallback;
        }
        return values.get(0).trim();
    }

    private String prettyPrint(Object value) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
