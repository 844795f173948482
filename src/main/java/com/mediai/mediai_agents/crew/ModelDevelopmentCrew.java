package com.mediai.mediai_agents.crew;

import com.mediai.mediai_agents.agent.impl.ModelEvaluationAgent;
import com.mediai.mediai_agents.agent.impl.ModelTrainingAgent;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * training -> evaluation.
 */
@Component
public class ModelDevelopmentCrew extends SequentialCrew {

    public static final String NAME = "model_development";

    public ModelDevelopmentCrew(ModelTrainingAgent trainingAgent, ModelEvaluationAgent evaluationAgent) {
        super(NAME, List.of(
                CrewTask.of(ModelTrainingAgent.TASK, trainingAgent),
                CrewTask.of(ModelEvaluationAgent.TASK, evaluationAgent)));
    }
}
