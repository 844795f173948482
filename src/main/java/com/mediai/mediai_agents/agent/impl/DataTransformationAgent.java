package com.mediai.mediai_agents.agent.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Runs dbt against the configured project directory.
 *
 * Context shape:
 * {
 *   "command": "run",              // optional: run | test | build | "docs generate" ...
 *   "models":  ["staging.*"],      // optional
 *   "vars":    { "key": "value" }  // optional, passed as --vars JSON
 * }
 *
 * A non-zero exit code fails the task with dbt's stderr.
 */
@Slf4j
@Component
public class DataTransformationAgent extends Agent {

    public static final String TASK = "transformation";

    private final ProcessInvoker processInvoker;
    private final FileAccess     fileAccess;
    private final ObjectMapper   objectMapper;
    private final Path           projectDir;
    private final String         executable;

    public DataTransformationAgent(ProcessInvoker processInvoker,
                                   FileAccess fileAccess,
                                   ObjectMapper objectMapper,
                                   @Value("${mediai.transformation.project-dir:./dbt_project}") String projectDir,
                                   @Value("${mediai.transformation.executable:dbt}") String executable,
                                   @Value("${mediai.agent.history-limit:100}") int historyLimit) {
        super("DataTransformationAgent", "Runs dbt transformations", historyLimit);
        this.processInvoker = processInvoker;
        this.fileAccess = fileAccess;
        this.objectMapper = objectMapper;
        this.projectDir = Path.of(projectDir);
        this.executable = executable;
    }

    @Override
    public ValidationOutcome validateInputs(Map<String, Object> context) {
        List<String> errors = new ArrayList<>();
        if (!fileAccess.exists(projectDir)) {
            errors.add("dbt project directory not found: " + projectDir);
        }
        if (!ContextValues.isListOrAbsent(context, "models")) {
            errors.add("models must be a list of selectors");
        }
        if (!ContextValues.isMapOrAbsent(context, "vars")) {
            errors.add("vars must be an object");
        }
        return ValidationOutcome.of(errors);
    }

    @Override
    protected CoreOutcome runCore(Map<String, Object> context) throws Exception {
        List<String> command = buildCommand(context);
        ProcessResult result = processInvoker.invoke(command, projectDir);

        if (!result.success()) {
            log.error("dbt failed: {}", result.stderr());
            return CoreOutcome.failure("dbt command failed: " + result.stderr());
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("command",     result.commandLine());
        output.put("success",     true);
        output.put("stdout",      result.stdout());
        output.put("stderr",      result.stderr());
        output.put("return_code", result.exitCode());
        return CoreOutcome.ok(output);
    }

    List<String> buildCommand(Map<String, Object> context) throws Exception {
        List<String> command = new ArrayList<>();
        command.add(executable);
        // "docs generate" is two arguments to dbt
        for (String part : ContextValues.string(context, "command", "run").split("\\s+")) {
            command.add(part);
        }

        List<String> models = ContextValues.stringList(context, "models");
        if (!models.isEmpty()) {
            command.add("--models");
            command.addAll(models);
        }

        Map<String, Object> vars = ContextValues.map(context, "vars");
        if (!vars.isEmpty()) {
            command.add("--vars");
            command.add(objectMapper.writeValueAsString(vars));
        }
        return command;
    }
}
