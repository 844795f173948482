package com.mediai.mediai_agents.crew;

import com.mediai.mediai_agents.agent.ContextValues;
import com.mediai.mediai_agents.agent.impl.DataIngestionAgent;
import com.mediai.mediai_agents.agent.impl.DataQualityAgent;
import com.mediai.mediai_agents.agent.impl.DataTransformationAgent;
import com.mediai.mediai_agents.model.crew.CrewContext;
import com.mediai.mediai_agents.model.crew.CrewReport;
import com.mediai.mediai_agents.model.result.ExecutionResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ingestion -> transformation -> quality.
 *
 * The quality task must also reach {@code mediai.quality.threshold} on its overall score;
 * a lower score fails the crew at {@code quality} even though the check itself ran fine.
 */
@Component
public class DataPipelineCrew extends SequentialCrew {

    public static final String NAME = "data_pipeline";

    public DataPipelineCrew(DataIngestionAgent ingestionAgent,
                            DataTransformationAgent transformationAgent,
                            DataQualityAgent qualityAgent,
                            @Value("${mediai.quality.threshold:0.90}") double qualityThreshold) {
        super(NAME, List.of(
                CrewTask.of(DataIngestionAgent.TASK, ingestionAgent),
                CrewTask.of(DataTransformationAgent.TASK, transformationAgent),
                new CrewTask(DataQualityAgent.TASK, qualityAgent, minimumQuality(qualityThreshold))));
    }

    static CrewTask.PostCondition minimumQuality(double threshold) {
        return (ExecutionResult result) -> {
            double score = ContextValues.number(result.getOutput(), DataQualityAgent.OVERALL_SCORE).orElse(0.0);
            if (score >= threshold) {
                return Optional.empty();
            }
            return Optional.of(String.format("Quality score %.4f is below threshold %.2f", score, threshold));
        };
    }

    public CrewReport runIngestionOnly(String sourceFile, String targetTable) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("source_file", sourceFile);
        input.put("target_table", targetTable);
        return kickoff(CrewContext.of(DataIngestionAgent.TASK, input));
    }

    public CrewReport runTransformationOnly(List<String> models) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("command", "run");
        input.put("models", models != null ? models : List.of());
        return kickoff(CrewContext.of(DataTransformationAgent.TASK, input));
    }

    public CrewReport runQualityCheckOnly(String tableName) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("table_name", tableName);
        input.put("checks", List.of(DataQualityAgent.COMPLETENESS, DataQualityAgent.UNIQUENESS));
        return kickoff(CrewContext.of(DataQualityAgent.TASK, input));
    }
}
