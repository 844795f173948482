package com.mediai.mediai_agents.model.result;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one agent invocation.
 *
 * <p>Only the two factories create instances: {@link #success} requires an output,
 * {@link #failure} requires at least one error. So {@code status == SUCCESS} holds
 * exactly when the error list is empty and the output came from the agent's core logic.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionResult {

    AgentStatus status;
    Map<String, Object> output;
    List<String> errors;
    Map<String, Object> metrics;
    Map<String, Object> metadata;
    Instant timestamp;

    public static ExecutionResult success(Map<String, Object> output,
                                          Map<String, Object> metrics,
                                          Map<String, Object> metadata) {
        if (output == null) {
            throw new IllegalArgumentException("A successful result needs an output");
        }
        return new ExecutionResult(AgentStatus.SUCCESS,
                freeze(output), List.of(), freeze(metrics), freeze(metadata), Instant.now());
    }

    public static ExecutionResult failure(List<String> errors, Map<String, Object> metrics) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("A failed result needs at least one error");
        }
        return new ExecutionResult(AgentStatus.FAILED,
                null, List.copyOf(errors), freeze(metrics), Map.of(), Instant.now());
    }

    public boolean isSuccess() {
        return status == AgentStatus.SUCCESS;
    }

    /** Map form used in crew reports and persisted snapshots. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status",    status.value());
        map.put("output",    output);
        map.put("metrics",   metrics);
        map.put("errors",    errors);
        map.put("metadata",  metadata);
        map.put("timestamp", timestamp.toString());
        return map;
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        // LinkedHashMap keeps key order for readable reports; Map.copyOf would not and rejects nulls
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
