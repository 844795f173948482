package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.RowBatch;

import java.io.IOException;
import java.util.List;

/**
 * Forward-only chunk iterator; at most one chunk is held in memory.
 */
public interface BatchReader extends AutoCloseable {

    List<String> columns();

    boolean hasNext() throws IOException;

    RowBatch next() throws IOException;

    @Override
    void close() throws IOException;
}
