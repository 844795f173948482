package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.TableRef;

import java.util.List;

/**
 * Transactional session on a {@link DestinationStore}. Nothing written through
 * {@link #insertBatch} is visible before {@link #commit}.
 */
public interface DestinationConnection extends AutoCloseable {

    /**
     * @throws BatchInsertException when the rows cannot be written
     */
    void insertBatch(TableRef table, List<String> columns, List<String[]> rows);

    void commit();

    void rollback();

    @Override
    void close();
}
