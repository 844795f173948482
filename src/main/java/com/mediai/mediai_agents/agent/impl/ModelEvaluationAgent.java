package com.mediai.mediai_agents.agent.impl;

import com.mediai.mediai_agents.agent.Agent;
import com.mediai.mediai_agents.agent.ContextValues;
import com.mediai.mediai_agents.model.result.CoreOutcome;
import com.mediai.mediai_agents.model.result.ValidationOutcome;
import com.mediai.mediai_agents.storage.FileAccess;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the metrics report written by training.
 *
 * Context shape:
 * {
 *   "metrics_file": "models/mortality_metrics.json"
 * }
 *
 * The report must hold {@code model_name} and a numeric {@code auroc}; every other numeric
 * field (sensitivity, specificity, ...) is copied to the output as well.
 */
@Slf4j
@Component
public class ModelEvaluationAgent extends Agent {

    public static final String TASK = "evaluation";
    public static final String AUROC = "auroc";

    private final FileAccess fileAccess;

    public ModelEvaluationAgent(FileAccess fileAccess,
                                @Value("${mediai.agent.history-limit:100}") int historyLimit) {
        super("ModelEvaluationAgent", "Evaluates a trained model from its metrics report", historyLimit);
        this.fileAccess = fileAccess;
    }

    @Override
    public ValidationOutcome validateInputs(Map<String, Object> context) {
        String metricsFile = ContextValues.string(context, "metrics_file");
        if (metricsFile == null) {
            return ValidationOutcome.failure("metrics_file is required");
        }
        if (!fileAccess.exists(Path.of(metricsFile))) {
            return ValidationOutcome.failure("Metrics file not found: " + metricsFile);
        }
        return ValidationOutcome.success();
    }

    @Override
    protected CoreOutcome runCore(Map<String, Object> context) throws Exception {
        Map<String, Object> report = fileAccess.readJson(Path.of(ContextValues.string(context, "metrics_file")));

        String modelName = ContextValues.string(report, "model_name");
        if (modelName == null) {
            return CoreOutcome.failure("Metrics report has no model_name");
        }
        if (ContextValues.number(report, AUROC).isEmpty()) {
            return CoreOutcome.failure("Metrics report has no numeric auroc");
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("model_name", modelName);
        report.forEach((key, value) -> {
            if (value instanceof Number number) {
                output.put(key, number.doubleValue());
            }
        });
        // version is an identifier, never a metric
        output.put("version", versionOf(report));

        log.info("Model {} evaluated: auroc={}", modelName, output.get(AUROC));
        return CoreOutcome.ok(output);
    }

    private static String versionOf(Map<String, Object> report) {
        Object version = report.get("version");
        if (version instanceof Number number) {
            long whole = number.longValue();
            return whole == number.doubleValue() ? Long.toString(whole) : number.toString();
        }
        return ContextValues.string(report, "version", "1");
    }
}
