package com.mediai.mediai_agents.model.result;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionResultTest {

    @Test
    void shouldRequireOutputForSuccess() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionResult.success(null, Map.of(), Map.of()));
    }

    @Test
    void shouldRequireErrorsForFailure() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionResult.failure(List.of(), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> ExecutionResult.failure(null, Map.of()));
    }

    @Test
    void shouldBeImmutableOnceCreated() {
        HashMap<String, Object> output = new HashMap<>(Map.of("rows", 3));
        ExecutionResult result = ExecutionResult.success(output, Map.of(), Map.of());

        output.put("rows", 99);

        assertEquals(3, result.getOutput().get("rows"));
        assertThrows(UnsupportedOperationException.class, () -> result.getOutput().put("x", 1));
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.isSuccess());
    }

    @Test
    void shouldSerialiseToMapWithLowercaseStatus() {
        ExecutionResult result = ExecutionResult.failure(List.of("boom"), Map.of("duration_ms", 5L));

        Map<String, Object> map = result.toMap();

        assertEquals(List.of("status", "output", "metrics", "errors", "metadata", "timestamp"),
                List.copyOf(map.keySet()));
        assertEquals("failed", map.get("status"));
        assertNull(map.get("output"));
        assertEquals(List.of("boom"), map.get("errors"));
        assertEquals(5L, ((Map<?, ?>) map.get("metrics")).get("duration_ms"));
        assertEquals(result.getTimestamp().toString(), map.get("timestamp"));
    }

    @Test
    void shouldRejectValidOutcomeWithErrors() {
        assertThrows(IllegalArgumentException.class, () -> new ValidationOutcome(true, List.of("bad")));
        assertTrue(ValidationOutcome.of(List.of()).valid());
        assertFalse(ValidationOutcome.of(List.of("bad")).valid());
    }
}
