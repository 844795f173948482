package com.mediai.mediai_agents.model.ingest;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IngestionSummaryTest {

    @Test
    void shouldReportZeroSuccessRateForEmptySource() {
        IngestionSummary summary = IngestionSummary.builder()
                .sourceFile("empty.csv").targetTable("raw.empty")
                .totalRows(0).rowsIngested(0).rowsFailed(0)
                .build();

        assertEquals(0.0d, summary.getSuccessRate());
    }

    @Test
    void shouldExposeSummaryKeys() {
        IngestionSummary summary = IngestionSummary.builder()
                .sourceFile("icustays.csv").targetTable("raw.icustays")
                .totalRows(100).rowsIngested(70).rowsFailed(30).resumedFromRow(0)
                .build();

        Map<String, Object> map = summary.toMap();

        assertEquals(0.7d, (double) map.get("success_rate"), 1e-9);
        assertEquals(70L, map.get("rows_ingested"));
        assertEquals(30L, map.get("rows_failed"));
        assertEquals("raw.icustays", map.get("target_table"));
    }
}
