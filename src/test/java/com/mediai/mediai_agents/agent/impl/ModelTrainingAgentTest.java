package com.mediai.mediai_agents.agent.impl;

import com.mediai.mediai_agents.engine.ProcessInvoker;
import com.mediai.mediai_agents.engine.ProcessInvoker.ProcessResult;
import com.mediai.mediai_agents.model.result.ExecutionResult;
import com.mediai.mediai_agents.storage.FileAccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelTrainingAgentTest {

    private static final List<String> COMMAND = List.of("python", "scripts/train_model.py");

    @Mock
    private ProcessInvoker processInvoker;

    @Mock
    private FileAccess fileAccess;

    private ModelTrainingAgent agent;

    @BeforeEach
    void setUp() {
        agent = new ModelTrainingAgent(processInvoker, fileAccess, 100);
    }

    @Test
    void shouldRequireCommandList() {
        ExecutionResult result = agent.execute(Map.of("command", "python train.py"));

        assertEquals(List.of("command must be a non-empty list of arguments"), result.getErrors());
        verifyNoInteractions(processInvoker);
    }

    @Test
    void shouldRunInGivenWorkingDirectory() {
        when(fileAccess.exists(Path.of("ml"))).thenReturn(true);
        when(processInvoker.invoke(COMMAND, Path.of("ml")))
                .thenReturn(new ProcessResult(COMMAND, 0, "AUROC 0.86", ""));

        ExecutionResult result = agent.execute(Map.of("command", COMMAND, "working_dir", "ml"));

        assertTrue(result.isSuccess());
        assertEquals("python scripts/train_model.py", result.getOutput().get("command"));
        assertEquals("AUROC 0.86", result.getOutput().get("stdout"));
    }

    @Test
    void shouldFailOnNonZeroExit() {
        when(processInvoker.invoke(eq(COMMAND), isNull()))
                .thenReturn(new ProcessResult(COMMAND, 1, "", "ModuleNotFoundError"));

        ExecutionResult result = agent.execute(Map.of("command", COMMAND));

        assertFalse(result.isSuccess());
        assertEquals(List.of("Training command failed (exit 1): ModuleNotFoundError"), result.getErrors());
    }
}
