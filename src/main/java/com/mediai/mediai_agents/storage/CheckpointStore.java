package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.CheckpointState;

import java.io.IOException;
import java.util.Optional;

/**
 * Single-writer progress store keyed by checkpoint id.
 */
public interface CheckpointStore {

    Optional<CheckpointState> load(String checkpointId) throws IOException;

    void save(String checkpointId, CheckpointState state) throws IOException;
}
