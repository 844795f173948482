package com.mediai.mediai_agents.service;

import com.mediai.mediai_agents.agent.impl.DataIngestionAgent;
import com.mediai.mediai_agents.agent.impl.DataQualityAgent;
import com.mediai.mediai_agents.agent.impl.DataTransformationAgent;
import com.mediai.mediai_agents.crew.DataPipelineCrew;
import com.mediai.mediai_agents.engine.WorkflowOrchestrator;
import com.mediai.mediai_agents.model.crew.CrewContext;
import com.mediai.mediai_agents.model.crew.CrewReport;
import com.mediai.mediai_agents.model.crew.OrchestratorReport;
import com.mediai.mediai_agents.model.crew.WorkflowContext;
import com.mediai.mediai_agents.model.domain.RunStatus;
import com.mediai.mediai_agents.model.domain.WorkflowRun;
import com.mediai.mediai_agents.repository.WorkflowRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Entry point for running workflows. Every run is recorded as a {@link WorkflowRun}:
 * saved as RUNNING first, then updated with the final status and the report snapshot.
 * Runs are synchronous; the caller gets the finished row back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowService {

    public static final String WORKFLOW         = "workflow";
    public static final String DATA_PIPELINE    = "data_pipeline";
    public static final String INGEST_SAMPLE    = "ingest_sample_data";

    // file -> destination loaded by ingestSampleData
    static final List<Map.Entry<String, String>> SAMPLE_TABLES = List.of(
            Map.entry("patients.csv",    "raw.patients"),
            Map.entry("icustays.csv",    "raw.icustays"),
            Map.entry("chartevents.csv", "raw.chartevents"));

    private final WorkflowOrchestrator  orchestrator;
    private final DataPipelineCrew      dataPipelineCrew;
    private final WorkflowRunRepository workflowRunRepository;

    /** Full crew sequence with decision gates. */
    public WorkflowRun runWorkflow(WorkflowContext context, String triggeredBy) {
        return record(WORKFLOW, triggeredBy, () -> {
            OrchestratorReport report = orchestrator.run(context);
            return new RunOutcome(RunStatus.of(report.getWorkflowStatus()), report.toMap());
        });
    }

    /**
     * Data pipeline crew only. Ingestion runs when both source and table are given,
     * quality when a table is given.
     */
    public WorkflowRun runDataPipeline(String sourceFile, String targetTable,
                                       boolean runTransformation, boolean runQualityCheck,
                                       String triggeredBy) {
        return runDataPipeline(dataPipelineContext(sourceFile, targetTable, runTransformation, runQualityCheck),
                triggeredBy);
    }

    public WorkflowRun runDataPipeline(CrewContext context, String triggeredBy) {
        return record(DATA_PIPELINE, triggeredBy, () -> {
            CrewReport report = dataPipelineCrew.kickoff(context);
            log.info("Data pipeline result: {}", report.getStatus().value().toUpperCase());
            return new RunOutcome(RunStatus.of(report.getStatus()), report.toMap());
        });
    }

    /**
     * Loads the sample extracts found in {@code dataDir} into the raw schema, one ingestion
     * crew run per file. Missing files are skipped; a missing directory fails the run.
     */
    public WorkflowRun ingestSampleData(Path dataDir, String triggeredBy) {
        return record(INGEST_SAMPLE, triggeredBy, () -> {
            if (!Files.isDirectory(dataDir)) {
                log.error("Sample data directory not found: {}", dataDir);
                return new RunOutcome(RunStatus.FAILED, Map.of("error", "Sample data not found: " + dataDir));
            }

            Map<String, Object> results = new LinkedHashMap<>();
            boolean allSucceeded = true;
            for (Map.Entry<String, String> sample : SAMPLE_TABLES) {
                Path sourceFile = dataDir.resolve(sample.getKey());
                if (!Files.exists(sourceFile)) {
                    log.warn("File not found, skipping: {}", sourceFile);
                    continue;
                }
                log.info("Ingesting {} -> {}", sample.getKey(), sample.getValue());
                CrewReport report = dataPipelineCrew.runIngestionOnly(sourceFile.toString(), sample.getValue());
                results.put(sample.getValue(), report.toMap());
                allSucceeded &= report.isSuccess();
            }

            RunStatus status = allSucceeded ? RunStatus.SUCCESS : RunStatus.FAILED;
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("status", status.name().toLowerCase());
            snapshot.put("tables_ingested", results.size());
            snapshot.put("results", results);
            return new RunOutcome(status, snapshot);
        });
    }

    public static CrewContext dataPipelineContext(String sourceFile, String targetTable,
                                                  boolean runTransformation, boolean runQualityCheck) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (sourceFile != null && targetTable != null) {
            context.put(DataIngestionAgent.TASK, Map.of(
                    "source_file", sourceFile,
                    "target_table", targetTable));
        }
        if (runTransformation) {
            context.put(DataTransformationAgent.TASK, Map.of(
                    "command", "run",
                    "models", List.of("staging.*")));
        }
        if (runQualityCheck && targetTable != null) {
            context.put(DataQualityAgent.TASK, Map.of(
                    "table_name", targetTable,
                    "checks", List.of(DataQualityAgent.COMPLETENESS, DataQualityAgent.UNIQUENESS)));
        }
        return CrewContext.from(context);
    }

    private WorkflowRun record(String workflow, String triggeredBy, Callable<RunOutcome> body) {
        WorkflowRun run = new WorkflowRun();
        run.setWorkflow(workflow);
        run.setTriggeredBy(triggeredBy);
        run = workflowRunRepository.save(run);

        log.info("Run {} ({}) started by {}", run.getId(), workflow, triggeredBy);
        try {
            RunOutcome outcome = body.call();
            run.setStatus(outcome.status());
            run.setReportSnapshot(outcome.snapshot());
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Run {} ({}) failed: {}", run.getId(), workflow, msg, ex);
            run.setStatus(RunStatus.FAILED);
            run.setReportSnapshot(Map.of("error", msg));
        }
        run.setCompletedAt(Instant.now());
        return workflowRunRepository.save(run);
    }

    private record RunOutcome(RunStatus status, Map<String, Object> snapshot) {}
}
