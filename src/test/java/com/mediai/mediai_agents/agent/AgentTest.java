package com.mediai.mediai_agents.agent;

import com.mediai.mediai_agents.model.result.AgentStatus;
import com.mediai.mediai_agents.model.result.CoreOutcome;
import com.mediai.mediai_agents.model.result.ExecutionResult;
import com.mediai.mediai_agents.model.result.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentTest {

    /** Valid when "value" is present; throws when "explode" is present; fails when "fail" is present. */
    static class CountingAgent extends Agent {

        int coreCalls;

        CountingAgent(int historyLimit) {
            super("CountingAgent", "test agent", historyLimit);
        }

        @Override
        public ValidationOutcome validateInputs(Map<String, Object> context) {
            return context.containsKey("value")
                    ? ValidationOutcome.success()
                    : ValidationOutcome.failure("value is required");
        }

        @Override
        protected CoreOutcome runCore(Map<String, Object> context) {
            coreCalls++;
            if (context.containsKey("explode")) {
                throw new IllegalStateException("exploded");
            }
            if (context.containsKey("fail")) {
                return CoreOutcome.failure("soft failure");
            }
            return CoreOutcome.ok(Map.of("echo", context.get("value")));
        }
    }

    @Test
    void shouldNotRunCoreWhenValidationFails() {
        CountingAgent agent = new CountingAgent(10);

        ExecutionResult result = agent.execute(Map.of("other", 1));

        assertEquals(AgentStatus.FAILED, result.getStatus());
        assertEquals(List.of("value is required"), result.getErrors());
        assertNull(result.getOutput());
        assertEquals(0, agent.coreCalls);
        assertEquals(AgentStatus.FAILED, agent.getStatus());
    }

    @Test
    void shouldReturnOutputAndMetadataOnSuccess() {
        CountingAgent agent = new CountingAgent(10);

        ExecutionResult result = agent.execute(Map.of("value", "x"));

        assertTrue(result.isSuccess());
        assertEquals("x", result.getOutput().get("echo"));
        assertEquals("CountingAgent", result.getMetadata().get("agent_name"));
        assertEquals(Map.of("value", "x"), result.getMetadata().get("context"));
        assertTrue(result.getMetrics().containsKey("duration_ms"));
        assertEquals(AgentStatus.SUCCESS, agent.getStatus());
    }

    @Test
    void shouldConvertExceptionIntoFailedResult() {
        CountingAgent agent = new CountingAgent(10);

        ExecutionResult result = assertDoesNotThrow(() -> agent.execute(Map.of("value", 1, "explode", true)));

        assertEquals(AgentStatus.FAILED, result.getStatus());
        assertEquals(List.of("exploded"), result.getErrors());
        assertEquals(1, agent.coreCalls);
    }

    @Test
    void shouldTreatNullContextAsEmpty() {
        CountingAgent agent = new CountingAgent(10);

        ExecutionResult result = agent.execute(null);

        assertFalse(result.isSuccess());
        assertEquals(0, agent.coreCalls);
    }

    @Test
    void shouldRecordExactlyOneResultPerCall() {
        CountingAgent agent = new CountingAgent(10);

        agent.execute(Map.of());
        assertEquals(1, agent.getExecutionHistory().size());
        agent.execute(Map.of("value", 1));
        assertEquals(2, agent.getExecutionHistory().size());
        agent.execute(Map.of("value", 1, "explode", true));
        assertEquals(3, agent.getExecutionHistory().size());
        ExecutionResult last = agent.execute(Map.of("value", 1, "fail", true));
        assertEquals(4, agent.getExecutionHistory().size());

        assertSame(last, agent.getExecutionHistory().get(3));
        assertEquals(List.of("soft failure"), last.getErrors());
    }

    @Test
    void shouldEvictOldestEntryWhenHistoryIsFull() {
        CountingAgent agent = new CountingAgent(2);

        ExecutionResult first = agent.execute(Map.of("value", 1));
        ExecutionResult second = agent.execute(Map.of("value", 2));
        ExecutionResult third = agent.execute(Map.of("value", 3));

        List<ExecutionResult> history = agent.getExecutionHistory();
        assertEquals(List.of(second, third), history);
        assertFalse(history.contains(first));
    }

    @Test
    void shouldClearStatusAndHistoryOnReset() {
        CountingAgent agent = new CountingAgent(10);
        agent.execute(Map.of("value", 1));

        agent.reset();

        assertEquals(AgentStatus.IDLE, agent.getStatus());
        assertTrue(agent.getExecutionHistory().isEmpty());
    }
}
