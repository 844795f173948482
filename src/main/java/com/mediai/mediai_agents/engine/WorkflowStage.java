package com.mediai.mediai_agents.engine;

import com.mediai.mediai_agents.crew.Crew;

/**
 * @param gate checked after the crew succeeds; null for the last stage
 */
public record WorkflowStage(Crew crew, DecisionGate gate) {

    public static WorkflowStage gated(Crew crew, DecisionGate gate) {
        return new WorkflowStage(crew, gate);
    }

    public static WorkflowStage ungated(Crew crew) {
        return new WorkflowStage(crew, null);
    }
}
