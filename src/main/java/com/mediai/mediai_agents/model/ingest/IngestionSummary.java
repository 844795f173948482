package com.mediai.mediai_agents.model.ingest;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class IngestionSummary {

    String sourceFile;
    String targetTable;
    long totalRows;
    long rowsIngested;
    long rowsFailed;
    long resumedFromRow;

    /** 0 for an empty source instead of dividing by zero. */
    public double getSuccessRate() {
        return totalRows > 0 ? (double) rowsIngested / totalRows : 0.0d;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("source_file",      sourceFile);
        map.put("target_table",     targetTable);
        map.put("total_rows",       totalRows);
        map.put("rows_ingested",    rowsIngested);
        map.put("rows_failed",      rowsFailed);
        map.put("success_rate",     getSuccessRate());
        map.put("resumed_from_row", resumedFromRow);
        return map;
    }
}
