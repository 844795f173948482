package com.mediai.mediai_agents.crew;

import com.mediai.mediai_agents.agent.impl.ModelDeploymentAgent;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DeploymentCrew extends SequentialCrew {

    public static final String NAME = "deployment";

    public DeploymentCrew(ModelDeploymentAgent deploymentAgent) {
        super(NAME, List.of(CrewTask.of(ModelDeploymentAgent.TASK, deploymentAgent)));
    }
}
