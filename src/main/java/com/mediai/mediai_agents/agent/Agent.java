package com.mediai.mediai_agents.agent;

import com.mediai.mediai_agents.model.result.AgentStatus;
import com.mediai.mediai_agents.model.result.CoreOutcome;
import com.mediai.mediai_agents.model.result.ExecutionResult;
import com.mediai.mediai_agents.model.result.ValidationOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for every unit of work.
 *
 * Lifecycle: IDLE -> RUNNING -> SUCCESS | FAILED. {@link #execute} validates first and
 * only then runs the subclass core logic. Whatever happens, exactly one
 * {@link ExecutionResult} is appended to the history per call and no exception leaves
 * {@code execute}.
 *
 * History is a ring buffer of {@code historyLimit} entries; once full the oldest entry
 * is evicted. Instances are not thread-safe: one invocation at a time.
 */
@Slf4j
public abstract class Agent {

    public static final int DEFAULT_HISTORY_LIMIT = 100;

    @Getter
    private final String name;

    @Getter
    private final String description;

    private final int historyLimit;
    private final Deque<ExecutionResult> executionHistory = new ArrayDeque<>();

    @Getter
    private AgentStatus status = AgentStatus.IDLE;

    protected Agent(String name, String description, int historyLimit) {
        this.name = name;
        this.description = description;
        this.historyLimit = Math.max(1, historyLimit);
        log.info("Initialized agent: {}", name);
    }

    protected Agent(String name, String description) {
        this(name, description, DEFAULT_HISTORY_LIMIT);
    }

    public final ExecutionResult execute(Map<String, Object> context) {
        Map<String, Object> input = context != null ? context : Map.of();
        log.info("[{}] Starting execution", name);
        status = AgentStatus.RUNNING;
        long startedNanos = System.nanoTime();

        ExecutionResult result;
        try {
            ValidationOutcome validation = validateInputs(input);
            if (!validation.valid()) {
                log.error("[{}] Input validation failed: {}", name, validation.errors());
                result = ExecutionResult.failure(validation.errors(), metrics(startedNanos));
            } else {
                log.info("[{}] Executing core logic", name);
                CoreOutcome outcome = runCore(input);
                if (outcome.success()) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("agent_name", name);
                    metadata.put("context", new LinkedHashMap<>(input));
                    result = ExecutionResult.success(outcome.output(), metrics(startedNanos), metadata);
                    log.info("[{}] Execution completed successfully", name);
                } else {
                    log.error("[{}] Execution failed: {}", name, outcome.errors());
                    result = ExecutionResult.failure(outcome.errors(), metrics(startedNanos));
                }
            }
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("[{}] Execution failed: {}", name, msg, ex);
            result = ExecutionResult.failure(List.of(msg), metrics(startedNanos));
        }

        status = result.getStatus();
        record(result);
        return result;
    }

    /** Checks the context; must not have side effects. */
    public abstract ValidationOutcome validateInputs(Map<String, Object> context);

    /** Core work, only called with a context that passed {@link #validateInputs}. */
    protected abstract CoreOutcome runCore(Map<String, Object> context) throws Exception;

    /** Oldest first. */
    public List<ExecutionResult> getExecutionHistory() {
        return List.copyOf(executionHistory);
    }

    public void reset() {
        status = AgentStatus.IDLE;
        executionHistory.clear();
        log.info("[{}] Reset to initial state", name);
    }

    private void record(ExecutionResult result) {
        if (executionHistory.size() >= historyLimit) {
            executionHistory.removeFirst();
        }
        executionHistory.addLast(result);
    }

    private static Map<String, Object> metrics(long startedNanos) {
        return Map.of("duration_ms", (System.nanoTime() - startedNanos) / 1_000_000L);
    }
}
