package com.mediai.mediai_agents.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediai.mediai_agents.model.ingest.CheckpointState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileCheckpointStoreTest {

    @TempDir
    Path tempDir;

    private final JsonFileAccess fileAccess = new JsonFileAccess(new ObjectMapper());
    private final FileCheckpointStore store = new FileCheckpointStore(fileAccess);

    @Test
    void shouldReturnEmptyWhenNoCheckpointExists() throws IOException {
        assertEquals(Optional.empty(), store.load(tempDir.resolve("missing.json").toString()));
    }

    @Test
    void shouldPersistLastRowAsJson() throws IOException {
        Path file = tempDir.resolve("nested/dir/cp.json");

        store.save(file.toString(), new CheckpointState(42));

        assertEquals(Map.of("last_row", 42), fileAccess.readJson(file));
        assertEquals(42L, store.load(file.toString()).orElseThrow().lastProcessedRow());
    }

    @Test
    void shouldOverwritePreviousCheckpointWithoutLeavingTempFiles() throws IOException {
        Path file = tempDir.resolve("cp.json");

        store.save(file.toString(), new CheckpointState(10));
        store.save(file.toString(), new CheckpointState(20));

        assertEquals(20L, store.load(file.toString()).orElseThrow().lastProcessedRow());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void shouldStartFromZeroWhenLastRowIsNotNumeric() throws IOException {
        Path file = tempDir.resolve("cp.json");
        Files.writeString(file, "{\"last_row\": \"oops\"}");

        assertEquals(0L, store.load(file.toString()).orElseThrow().lastProcessedRow());
    }

    @Test
    void shouldRejectNegativeRow() {
        assertThrows(IllegalArgumentException.class, () -> new CheckpointState(-1));
    }
}
