package com.mediai.mediai_agents.crew;

import com.mediai.mediai_agents.agent.Agent;
import com.mediai.mediai_agents.model.result.ExecutionResult;

import java.util.Optional;

/**
 * A named slot in a crew, bound to the agent that runs it.
 */
public record CrewTask(String name, Agent agent, PostCondition postCondition) {

    public CrewTask {
        if (name == null || agent == null) {
            throw new IllegalArgumentException("A crew task needs a name and an agent");
        }
        if (postCondition == null) postCondition = PostCondition.NONE;
    }

    public static CrewTask of(String name, Agent agent) {
        return new CrewTask(name, agent, PostCondition.NONE);
    }

    /**
     * Extra acceptance check applied to a successful result.
     * Returns the reason the result is not acceptable, or empty when it is.
     */
    @FunctionalInterface
    public interface PostCondition {

        PostCondition NONE = result -> Optional.empty();

        Optional<String> check(ExecutionResult result);
    }
}
