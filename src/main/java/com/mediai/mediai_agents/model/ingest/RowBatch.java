package com.mediai.mediai_agents.model.ingest;

import java.util.List;

/**
 * One chunk of source rows.
 *
 * @param firstRow zero-based data-row index of the first row in this chunk
 * @param columns  header of the source, shared by every chunk
 */
public record RowBatch(long firstRow, List<String> columns, List<String[]> rows) {

    public int size() {
        return rows.size();
    }
}
