package com.mediai.mediai_agents.engine;

import com.mediai.mediai_agents.model.crew.CrewReport;
import com.mediai.mediai_agents.model.crew.GateDecision;
import com.mediai.mediai_agents.model.crew.OrchestratorReport;
import com.mediai.mediai_agents.model.crew.WorkflowContext;
import com.mediai.mediai_agents.model.crew.WorkflowStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Runs crews end-to-end.
 *
 * How it works:
 *   1. Kick off the next crew with its slice of the workflow context
 *   2. Crew FAILED                  -> stop, workflow FAILED
 *   3. Crew SUCCESS, gate not met   -> stop, workflow PARTIAL_SUCCESS (policy stop, not an error)
 *   4. Crew SUCCESS, gate met/none  -> next stage
 *   5. All stages done              -> workflow SUCCESS
 *
 * Crews after the stopping point are never kicked off and are listed as skipped.
 * The orchestrator holds no per-run state, so one instance serves any number of runs.
 */
@Slf4j
public class WorkflowOrchestrator {

    private final List<WorkflowStage> stages;

    public WorkflowOrchestrator(List<WorkflowStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public List<WorkflowStage> stages() {
        return stages;
    }

    public OrchestratorReport run(WorkflowContext context) {
        long startedNanos = System.nanoTime();
        log.info("Workflow starting: {} stage(s)", stages.size());

        OrchestratorReport.OrchestratorReportBuilder report = OrchestratorReport.builder();
        WorkflowStatus status = WorkflowStatus.SUCCESS;

        int index = 0;
        for (; index < stages.size(); index++) {
            WorkflowStage stage = stages.get(index);
            String crewName = stage.crew().name();
            log.info("Stage {}/{}: crew {}", index + 1, stages.size(), crewName);

            CrewReport crewReport = kickoff(stage, context);
            report.crewReport(crewReport);

            if (!crewReport.isSuccess()) {
                log.error("Crew {} failed at {}: {}", crewName, crewReport.getFailedAt(), crewReport.getError());
                status = WorkflowStatus.FAILED;
                index++;
                break;
            }

            if (stage.gate() != null) {
                GateDecision decision = stage.gate().evaluate(crewReport);
                report.gateDecision(decision);
                if (!decision.passed()) {
                    log.warn("Gate {} closed after {}: {} < {}; skipping downstream crews",
                            decision.field(), crewName, decision.observed(), decision.threshold());
                    status = WorkflowStatus.PARTIAL_SUCCESS;
                    index++;
                    break;
                }
                log.info("Gate {} passed: {} >= {}", decision.field(), decision.observed(), decision.threshold());
            }
        }

        for (int skipped = index; skipped < stages.size(); skipped++) {
            report.skippedCrew(stages.get(skipped).crew().name());
        }

        double totalSeconds = (System.nanoTime() - startedNanos) / 1_000_000_000.0;
        OrchestratorReport result = report
                .workflowStatus(status)
                .totalExecutionTimeSeconds(totalSeconds)
                .build();

        log.info("Workflow {}: {} crew(s) executed, {} succeeded, {} failed in {}s",
                status.value(), result.getCrewsExecuted(), result.getCrewsSucceeded(),
                result.getCrewsFailed(), String.format("%.2f", totalSeconds));
        return result;
    }

    private CrewReport kickoff(WorkflowStage stage, WorkflowContext context) {
        long startedNanos = System.nanoTime();
        String crewName = stage.crew().name();
        try {
            return stage.crew().kickoff(context.forCrew(crewName));
        } catch (RuntimeException ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Crew {} threw: {}", crewName, msg, ex);
            return CrewReport.failed(crewName, Map.of(), crewName, msg,
                    (System.nanoTime() - startedNanos) / 1_000_000_000.0);
        }
    }
}
