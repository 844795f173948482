package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.TableRef;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Quality checks as aggregate queries. Table and column names are validated
 * identifiers before they are inlined.
 */
@Component
@RequiredArgsConstructor
public class JdbcQualityMetrics implements QualityMetrics {

    private final JdbcTemplate jdbcTemplate;

    /** Share of non-null cells over the given columns. */
    @Override
    public CheckResult completeness(TableRef table, List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("completeness needs at least one column");
        }
        columns.forEach(JdbcQualityMetrics::requireIdentifier);

        String counts = columns.stream()
                .map(c -> "COUNT(" + c + ")")
                .collect(Collectors.joining(", "));
        String sql = "SELECT COUNT(*), " + counts + " FROM " + table.qualifiedName();

        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> {
            long totalRows = rs.getLong(1);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("total_rows", totalRows);
            long nonNull = 0;
            for (int i = 0; i < columns.size(); i++) {
                long count = rs.getLong(i + 2);
                details.put("non_null_" + columns.get(i), count);
                nonNull += count;
            }
            double score = totalRows > 0 ? (double) nonNull / (columns.size() * totalRows) : 0.0d;
            return new CheckResult("completeness", score, details);
        });
    }

    /** Share of distinct values in the key column. */
    @Override
    public CheckResult uniqueness(TableRef table, String keyColumn) {
        requireIdentifier(keyColumn);
        String sql = "SELECT COUNT(*), COUNT(DISTINCT " + keyColumn + ") FROM " + table.qualifiedName();

        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> {
            long totalRows = rs.getLong(1);
            long unique = rs.getLong(2);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("total_rows", totalRows);
            details.put("unique_" + keyColumn, unique);
            double score = totalRows > 0 ? (double) unique / totalRows : 0.0d;
            return new CheckResult("uniqueness", score, details);
        });
    }

    private static void requireIdentifier(String column) {
        if (!TableRef.isIdentifier(column)) {
            throw new IllegalArgumentException("Invalid column name: " + column);
        }
    }
}
