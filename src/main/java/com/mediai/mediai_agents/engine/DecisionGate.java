package com.mediai.mediai_agents.engine;

import com.mediai.mediai_agents.agent.ContextValues;
import com.mediai.mediai_agents.model.crew.CrewReport;
import com.mediai.mediai_agents.model.crew.GateDecision;

/**
 * Threshold on one numeric output field of a successful crew, e.g. {@code quality.overall_score >= 0.90}.
 * A field that is missing or not numeric reads as 0 and therefore closes the gate.
 */
public record DecisionGate(String taskName, String outputKey, double threshold) {

    public GateDecision evaluate(CrewReport report) {
        double observed = report.outputValue(taskName, outputKey)
                .flatMap(ContextValues::toNumber)
                .orElse(0.0);
        return new GateDecision(report.getCrewName(), field(), threshold, observed, observed >= threshold);
    }

    public String field() {
        return taskName + "." + outputKey;
    }
}
