package com.mediai.mediai_agents.config;

import com.mediai.mediai_agents.crew.DataPipelineCrew;
import com.mediai.mediai_agents.crew.DeploymentCrew;
import com.mediai.mediai_agents.crew.ModelDevelopmentCrew;
import com.mediai.mediai_agents.agent.impl.DataQualityAgent;
import com.mediai.mediai_agents.agent.impl.ModelEvaluationAgent;
import com.mediai.mediai_agents.engine.BackoffSleeper;
import com.mediai.mediai_agents.engine.CheckpointedBatchIngestor;
import com.mediai.mediai_agents.engine.DecisionGate;
import com.mediai.mediai_agents.engine.WorkflowOrchestrator;
import com.mediai.mediai_agents.engine.WorkflowStage;
import com.mediai.mediai_agents.model.ingest.RetryConfig;
import com.mediai.mediai_agents.storage.CheckpointStore;
import com.mediai.mediai_agents.storage.DestinationStore;
import com.mediai.mediai_agents.storage.TabularSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Slf4j
@Configuration
public class AgentConfig {

    @Value("${mediai.ingestion.retry.max-retries:3}")
    private int maxRetries;

    @Value("${mediai.ingestion.retry.backoff-ms:1000}")
    private long backoffMs;

    @Value("${mediai.ingestion.retry.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    @Value("${mediai.gates.data-quality:0.90}")
    private double dataQualityGate;

    @Value("${mediai.gates.model-performance:0.80}")
    private double modelPerformanceGate;

    @Bean
    public RetryConfig defaultRetryConfig() {
        return new RetryConfig(maxRetries, backoffMs, backoffMultiplier).bounded();
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.THREAD_SLEEP;
    }

    @Bean
    public CheckpointedBatchIngestor checkpointedBatchIngestor(TabularSource tabularSource,
                                                               DestinationStore destinationStore,
                                                               CheckpointStore checkpointStore,
                                                               BackoffSleeper backoffSleeper) {
        return new CheckpointedBatchIngestor(tabularSource, destinationStore, checkpointStore, backoffSleeper);
    }

    // data_pipeline --(quality.overall_score)--> model_development --(evaluation.auroc)--> deployment
    @Bean
    public WorkflowOrchestrator workflowOrchestrator(DataPipelineCrew dataPipelineCrew,
                                                     ModelDevelopmentCrew modelDevelopmentCrew,
                                                     DeploymentCrew deploymentCrew) {
        log.info("Decision gates: data quality >= {}, model performance >= {}", dataQualityGate, modelPerformanceGate);
        return new WorkflowOrchestrator(List.of(
                WorkflowStage.gated(dataPipelineCrew,
                        new DecisionGate(DataQualityAgent.TASK, DataQualityAgent.OVERALL_SCORE, dataQualityGate)),
                WorkflowStage.gated(modelDevelopmentCrew,
                        new DecisionGate(ModelEvaluationAgent.TASK, ModelEvaluationAgent.AUROC, modelPerformanceGate)),
                WorkflowStage.ungated(deploymentCrew)));
    }
}
