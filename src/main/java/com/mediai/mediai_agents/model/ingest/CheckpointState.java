package com.mediai.mediai_agents.model.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Durable ingestion progress: number of data rows (header excluded) already committed.
 */
public record CheckpointState(@JsonProperty("last_row") long lastProcessedRow) {

    public CheckpointState {
        if (lastProcessedRow < 0) {
            throw new IllegalArgumentException("last_row must not be negative: " + lastProcessedRow);
        }
    }
}
