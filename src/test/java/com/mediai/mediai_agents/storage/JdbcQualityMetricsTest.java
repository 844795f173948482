package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.TableRef;
import com.mediai.mediai_agents.storage.QualityMetrics.CheckResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQualityMetricsTest {

    private static final TableRef TABLE = TableRef.parse("raw.icustays");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbc;
    private JdbcQualityMetrics metrics;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
        jdbc = new JdbcTemplate(database);
        jdbc.execute("CREATE SCHEMA raw");
        jdbc.execute("CREATE TABLE raw.icustays (stay_id INT, subject_id INT)");
        metrics = new JdbcQualityMetrics(jdbc);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void shouldMeasureNonNullShareAcrossColumns() {
        jdbc.update("INSERT INTO raw.icustays VALUES (1, 10), (2, NULL), (3, 30), (4, NULL)");

        CheckResult result = metrics.completeness(TABLE, List.of("stay_id", "subject_id"));

        assertEquals("completeness", result.check());
        assertEquals(0.75d, result.score(), 1e-9);
        assertEquals(4L, result.details().get("total_rows"));
        assertEquals(2L, result.details().get("non_null_subject_id"));
    }

    @Test
    void shouldMeasureDistinctShareOfKey() {
        jdbc.update("INSERT INTO raw.icustays VALUES (1, 10), (1, 11), (2, 12), (3, 13)");

        CheckResult result = metrics.uniqueness(TABLE, "stay_id");

        assertEquals(0.75d, result.score(), 1e-9);
        assertEquals(3L, result.details().get("unique_stay_id"));
    }

    @Test
    void shouldScoreEmptyTableAsZero() {
        assertEquals(0.0d, metrics.completeness(TABLE, List.of("stay_id")).score());
        assertEquals(0.0d, metrics.uniqueness(TABLE, "stay_id").score());
    }

    @Test
    void shouldRejectUnsafeColumnName() {
        assertThrows(IllegalArgumentException.class, () -> metrics.uniqueness(TABLE, "stay_id) FROM x --"));
        assertThrows(IllegalArgumentException.class, () -> metrics.completeness(TABLE, List.of()));
    }
}
