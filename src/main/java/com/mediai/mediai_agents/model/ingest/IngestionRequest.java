package com.mediai.mediai_agents.model.ingest;

import lombok.Builder;

import java.nio.file.Path;

/**
 * @param checkpointId where progress is persisted; null disables checkpointing
 */
@Builder
public record IngestionRequest(Path sourceFile,
                               TableRef targetTable,
                               int batchSize,
                               String checkpointId,
                               RetryConfig retry) {

    public static final int DEFAULT_BATCH_SIZE = 10_000;

    public IngestionRequest {
        if (sourceFile == null || targetTable == null) {
            throw new IllegalArgumentException("sourceFile and targetTable are required");
        }
        if (batchSize <= 0) batchSize = DEFAULT_BATCH_SIZE;
        if (retry == null) retry = new RetryConfig();
    }

    public boolean checkpointed() {
        return checkpointId != null && !checkpointId.isBlank();
    }
}
