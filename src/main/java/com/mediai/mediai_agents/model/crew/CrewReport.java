package com.mediai.mediai_agents.model.crew;

import com.mediai.mediai_agents.model.result.ExecutionResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one crew kickoff: the result of every task that ran, in run order.
 * {@code failedAt} is set only when the status is FAILED. A crew that threw outside its
 * agents is reported as failed at the crew itself.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CrewReport {

    String crewName;
    CrewStatus status;
    Map<String, ExecutionResult> taskResults;
    String failedAt;
    String error;
    double executionTimeSeconds;

    public static CrewReport success(String crewName, Map<String, ExecutionResult> taskResults, double seconds) {
        return new CrewReport(crewName, CrewStatus.SUCCESS, freeze(taskResults), null, null, seconds);
    }

    public static CrewReport failed(String crewName, Map<String, ExecutionResult> taskResults,
                                    String failedAt, String error, double seconds) {
        return new CrewReport(crewName, CrewStatus.FAILED, freeze(taskResults), failedAt, error, seconds);
    }

    public boolean isSuccess() {
        return status == CrewStatus.SUCCESS;
    }

    /** A field of a task's output, empty when the task did not run or did not produce it. */
    public Optional<Object> outputValue(String task, String key) {
        ExecutionResult result = taskResults.get(task);
        if (result == null || result.getOutput() == null) return Optional.empty();
        return Optional.ofNullable(result.getOutput().get(key));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> results = new LinkedHashMap<>();
        taskResults.forEach((task, result) -> results.put(task, result.toMap()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("crew_name", crewName);
        map.put("status",    status.value());
        map.put("results",   results);
        if (status == CrewStatus.FAILED) {
            if (failedAt != null) map.put("failed_at", failedAt);
            if (error != null) map.put("error", error);
        }
        map.put("execution_time_seconds", executionTimeSeconds);
        return map;
    }

    private static Map<String, ExecutionResult> freeze(Map<String, ExecutionResult> results) {
        return results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }
}
