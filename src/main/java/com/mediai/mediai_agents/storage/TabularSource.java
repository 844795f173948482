package com.mediai.mediai_agents.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reader of delimited files with a header row.
 */
public interface TabularSource {

    /** Number of data rows, header excluded. */
    long countDataRows(Path source) throws IOException;

    /**
     * Opens the source positioned after {@code skipRows} data rows.
     */
    BatchReader openBatches(Path source, long skipRows, int batchSize) throws IOException;
}
