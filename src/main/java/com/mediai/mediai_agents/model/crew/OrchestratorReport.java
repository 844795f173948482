package com.mediai.mediai_agents.model.crew;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consolidated result of a workflow run. Only executed crews appear in {@code crewReports};
 * crews after a failure or a closed gate are listed in {@code skippedCrews}.
 */
@Value
@Builder
public class OrchestratorReport {

    WorkflowStatus workflowStatus;
    @Singular List<CrewReport> crewReports;
    @Singular List<String> skippedCrews;
    @Singular List<GateDecision> gateDecisions;
    double totalExecutionTimeSeconds;
    @Builder.Default Instant timestamp = Instant.now();

    public int getCrewsExecuted() {
        return crewReports.size();
    }

    public long getCrewsSucceeded() {
        return crewReports.stream().filter(CrewReport::isSuccess).count();
    }

    public long getCrewsFailed() {
        return crewReports.size() - getCrewsSucceeded();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("workflow_status", workflowStatus.value());
        map.put("total_execution_time_seconds", totalExecutionTimeSeconds);
        map.put("crews_executed",  getCrewsExecuted());
        map.put("crews_succeeded", getCrewsSucceeded());
        map.put("crews_failed",    getCrewsFailed());
        map.put("crew_results",    crewReports.stream().map(CrewReport::toMap).toList());
        map.put("skipped_crews",   skippedCrews);
        map.put("gate_decisions",  gateDecisions.stream().map(GateDecision::toMap).toList());
        map.put("timestamp",       timestamp.toString());
        return map;
    }
}
