package com.mediai.mediai_agents.model.result;

import java.util.List;
import java.util.Map;

/**
 * What an agent's core logic hands back to the execution contract:
 * either an output payload or a non-empty list of errors, never both.
 */
public record CoreOutcome(boolean success, Map<String, Object> output, List<String> errors) {

    public static CoreOutcome ok(Map<String, Object> output) {
        return new CoreOutcome(true, output != null ? output : Map.of(), List.of());
    }

    public static CoreOutcome failure(String... errors) {
        if (errors.length == 0) {
            throw new IllegalArgumentException("A failed outcome needs at least one error");
        }
        return new CoreOutcome(false, null, List.of(errors));
    }
}
