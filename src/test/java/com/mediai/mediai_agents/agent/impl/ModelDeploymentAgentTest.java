package com.mediai.mediai_agents.agent.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediai.mediai_agents.model.result.ExecutionResult;
import com.mediai.mediai_agents.storage.JsonFileAccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelDeploymentAgentTest {

    @TempDir
    Path tempDir;

    private JsonFileAccess fileAccess;
    private ModelDeploymentAgent agent;

    @BeforeEach
    void setUp() {
        fileAccess = new JsonFileAccess(new ObjectMapper());
        agent = new ModelDeploymentAgent(fileAccess, tempDir.resolve("registry").toString(), 100);
    }

    @Test
    void shouldWriteDeploymentRecord() throws IOException {
        ExecutionResult result = agent.execute(Map.of("model_name", "mortality_xgb", "version", 3));

        assertTrue(result.isSuccess());
        assertEquals(true, result.getOutput().get("monitoring_enabled"));

        Map<String, Object> record = fileAccess.readJson(tempDir.resolve("registry/mortality_xgb.json"));
        assertEquals("mortality_xgb", record.get("model_name"));
        assertEquals("3", record.get("version"));
        assertEquals("production", record.get("deployed_to"));
        assertNotNull(record.get("deployed_at"));
    }

    @Test
    void shouldRejectMissingFieldsAndPathLikeNames() {
        assertEquals(List.of("model_name is required", "version is required"), agent.execute(Map.of()).getErrors());

        ExecutionResult result = agent.execute(Map.of("model_name", "../etc/passwd", "version", "1"));
        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().get(0).startsWith("model_name may only contain"));
    }
}
