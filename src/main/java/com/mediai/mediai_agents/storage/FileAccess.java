package com.mediai.mediai_agents.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * JSON file operations used by agents and the checkpoint store.
 */
public interface FileAccess {

    boolean exists(Path path);

    Map<String, Object> readJson(Path path) throws IOException;

    /** Replaces the file atomically, creating parent directories as needed. */
    void writeJson(Path path, Object value) throws IOException;
}
