package com.mediai.mediai_agents.agent.impl;

import com.mediai.mediai_agents.agent.Agent;
import com.mediai.mediai_agents.agent.ContextValues;
import com.mediai.mediai_agents.model.ingest.TableRef;
import com.mediai.mediai_agents.model.result.CoreOutcome;
import com.mediai.mediai_agents.model.result.ValidationOutcome;
import com.mediai.mediai_agents.storage.FileAccess;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registers a model version as deployed by writing
 * {@code <registry-dir>/<model_name>.json}.
 *
 * Context shape:
 * {
 *   "model_name":  "mortality_xgb",
 *   "version":     "3",
 *   "environment": "production"   // optional
 * }
 */
@Slf4j
@Component
public class ModelDeploymentAgent extends Agent {

    public static final String TASK = "deployment";

    private final FileAccess fileAccess;
    private final Path       registryDir;

    public ModelDeploymentAgent(FileAccess fileAccess,
                                @Value("${mediai.deployment.registry-dir:./model_registry}") String registryDir,
                                @Value("${mediai.agent.history-limit:100}") int historyLimit) {
        super("ModelDeploymentAgent", "Records model deployments in the model registry", historyLimit);
        this.fileAccess = fileAccess;
        this.registryDir = Path.of(registryDir);
    }

    @Override
    public ValidationOutcome validateInputs(Map<String, Object> context) {
        List<String> errors = new ArrayList<>();
        String modelName = ContextValues.string(context, "model_name");
        if (modelName == null) {
            errors.add("model_name is required");
        } else if (!TableRef.isIdentifier(modelName)) {
            // becomes a file name in the registry
            errors.add("model_name may only contain letters, digits and underscores: " + modelName);
        }
        if (ContextValues.string(context, "version") == null) {
            errors.add("version is required");
        }
        return ValidationOutcome.of(errors);
    }

    @Override
    protected CoreOutcome runCore(Map<String, Object> context) throws Exception {
        String modelName = ContextValues.string(context, "model_name");

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("model_name",  modelName);
        record.put("version",     ContextValues.string(context, "version"));
        record.put("deployed_to", ContextValues.string(context, "environment", "production"));
        record.put("deployed_at", Instant.now().toString());

        Path target = registryDir.resolve(modelName + ".json");
        fileAccess.writeJson(target, record);
        log.info("Deployed {} v{} -> {}", modelName, record.get("version"), target);

        Map<String, Object> output = new LinkedHashMap<>(record);
        output.put("registry_file", target.toString());
        output.put("monitoring_enabled", true);
        return CoreOutcome.ok(output);
    }
}
