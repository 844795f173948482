package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.CheckpointState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint id is a file path; the file holds {@code {"last_row": n}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileCheckpointStore implements CheckpointStore {

    private static final String LAST_ROW = "last_row";

    private final FileAccess fileAccess;

    @Override
    public Optional<CheckpointState> load(String checkpointId) throws IOException {
        Path path = Path.of(checkpointId);
        if (!fileAccess.exists(path)) {
            return Optional.empty();
        }
        Map<String, Object> raw = fileAccess.readJson(path);
        Object lastRow = raw.get(LAST_ROW);
        if (!(lastRow instanceof Number number)) {
            log.warn("Checkpoint {} has no numeric {}; starting from row 0", checkpointId, LAST_ROW);
            return Optional.of(new CheckpointState(0));
        }
        return Optional.of(new CheckpointState(number.longValue()));
    }

    @Override
    public void save(String checkpointId, CheckpointState state) throws IOException {
        fileAccess.writeJson(Path.of(checkpointId), Map.of(LAST_ROW, state.lastProcessedRow()));
    }
}
