package com.mediai.mediai_agents.agent.impl;

import com.mediai.mediai_agents.agent.Agent;
import com.mediai.mediai_agents.agent.ContextValues;
import com.mediai.mediai_agents.engine.ProcessInvoker;
import com.mediai.mediai_agents.engine.ProcessInvoker.ProcessResult;
import com.mediai.mediai_agents.model.result.CoreOutcome;
import com.mediai.mediai_agents.model.result.ValidationOutcome;
import com.mediai.mediai_agents.storage.FileAccess;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an external training script.
 *
 * Context shape:
 * {
 *   "command":     ["python", "scripts/train_model.py", "--target", "mortality"],
 *   "working_dir": "."    // optional
 * }
 */
@Slf4j
@Component
public class ModelTrainingAgent extends Agent {

    public static final String TASK = "training";

    private final ProcessInvoker processInvoker;
    private final FileAccess     fileAccess;

    public ModelTrainingAgent(ProcessInvoker processInvoker,
                              FileAccess fileAccess,
                              @Value("${mediai.agent.history-limit:100}") int historyLimit) {
        super("ModelTrainingAgent", "Trains a model with an external training command", historyLimit);
        this.processInvoker = processInvoker;
        this.fileAccess = fileAccess;
    }

    @Override
    public ValidationOutcome validateInputs(Map<String, Object> context) {
        List<String> errors = new ArrayList<>();
        if (!(context.get("command") instanceof List<?>) || ContextValues.stringList(context, "command").isEmpty()) {
            errors.add("command must be a non-empty list of arguments");
        }
        String workingDir = ContextValues.string(context, "working_dir");
        if (workingDir != null && !fileAccess.exists(Path.of(workingDir))) {
            errors.add("working_dir not found: " + workingDir);
        }
        return ValidationOutcome.of(errors);
    }

    @Override
    protected CoreOutcome runCore(Map<String, Object> context) {
        List<String> command = ContextValues.stringList(context, "command");
        String workingDir = ContextValues.string(context, "working_dir");

        ProcessResult result = processInvoker.invoke(command, workingDir != null ? Path.of(workingDir) : null);
        if (!result.success()) {
            log.error("Training command failed with exit code {}: {}", result.exitCode(), result.stderr());
            return CoreOutcome.failure("Training command failed (exit " + result.exitCode() + "): " + result.stderr());
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("command",     result.commandLine());
        output.put("return_code", result.exitCode());
        output.put("stdout",      result.stdout());
        return CoreOutcome.ok(output);
    }
}
