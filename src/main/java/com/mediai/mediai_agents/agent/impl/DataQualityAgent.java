package com.mediai.mediai_agents.agent.impl;

import com.mediai.mediai_agents.agent.Agent;
import com.mediai.mediai_agents.agent.ContextValues;
import com.mediai.mediai_agents.model.ingest.TableRef;
import com.mediai.mediai_agents.model.result.CoreOutcome;
import com.mediai.mediai_agents.model.result.ValidationOutcome;
import com.mediai.mediai_agents.storage.QualityMetrics;
import com.mediai.mediai_agents.storage.QualityMetrics.CheckResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a stored table on completeness and uniqueness.
 *
 * Context shape:
 * {
 *   "table_name":           "raw.icustays",
 *   "checks":               ["completeness", "uniqueness"],   // optional, default both
 *   "completeness_columns": ["stay_id", "subject_id"],        // optional override
 *   "unique_key":           "stay_id"                         // optional override
 * }
 *
 * Output: one entry per check plus {@code overall_score} (mean of the check scores) and
 * {@code passed} (overall score at or above the configured threshold).
 */
@Slf4j
@Component
public class DataQualityAgent extends Agent {

    public static final String TASK = "quality";
    public static final String COMPLETENESS = "completeness";
    public static final String UNIQUENESS = "uniqueness";
    public static final String OVERALL_SCORE = "overall_score";

    private static final List<String> SUPPORTED_CHECKS = List.of(COMPLETENESS, UNIQUENESS);

    private final QualityMetrics qualityMetrics;
    private final List<String>   completenessColumns;
    private final String         uniqueKey;
    private final double         threshold;

    public DataQualityAgent(QualityMetrics qualityMetrics,
                            @Value("${mediai.quality.completeness-columns:stay_id,subject_id}") List<String> completenessColumns,
                            @Value("${mediai.quality.unique-key:stay_id}") String uniqueKey,
                            @Value("${mediai.quality.threshold:0.90}") double threshold,
                            @Value("${mediai.agent.history-limit:100}") int historyLimit) {
        super("DataQualityAgent", "Validates data quality", historyLimit);
        this.qualityMetrics = qualityMetrics;
        this.completenessColumns = List.copyOf(completenessColumns);
        this.uniqueKey = uniqueKey;
        this.threshold = threshold;
    }

    @Override
    public ValidationOutcome validateInputs(Map<String, Object> context) {
        List<String> errors = new ArrayList<>();

        String tableName = ContextValues.string(context, "table_name");
        if (tableName == null) {
            errors.add("Missing required field: table_name");
        } else if (TableRef.tryParse(tableName).isEmpty()) {
            errors.add("table_name must be schema.table, got: " + tableName);
        }

        if (!ContextValues.isListOrAbsent(context, "checks")) {
            errors.add("checks must be a list");
        } else {
            for (String check : ContextValues.stringList(context, "checks")) {
                if (!SUPPORTED_CHECKS.contains(check)) {
                    errors.add("Unsupported check: " + check + " (supported: " + SUPPORTED_CHECKS + ")");
                }
            }
        }

        if (!ContextValues.isListOrAbsent(context, "completeness_columns")) {
            errors.add("completeness_columns must be a list");
        } else {
            for (String column : ContextValues.stringList(context, "completeness_columns")) {
                if (!TableRef.isIdentifier(column)) errors.add("Invalid column name: " + column);
            }
        }

        String key = ContextValues.string(context, "unique_key");
        if (key != null && !TableRef.isIdentifier(key)) {
            errors.add("Invalid column name: " + key);
        }

        return ValidationOutcome.of(errors);
    }

    @Override
    protected CoreOutcome runCore(Map<String, Object> context) {
        TableRef table = TableRef.parse(ContextValues.string(context, "table_name"));
        List<String> checks = context.containsKey("checks")
                ? ContextValues.stringList(context, "checks")
                : SUPPORTED_CHECKS;

        log.info("Running quality checks {} on {}", checks, table);

        Map<String, Object> output = new LinkedHashMap<>();
        List<Double> scores = new ArrayList<>();

        if (checks.contains(COMPLETENESS)) {
            List<String> columns = context.containsKey("completeness_columns")
                    ? ContextValues.stringList(context, "completeness_columns")
                    : completenessColumns;
            CheckResult completeness = qualityMetrics.completeness(table, columns);
            output.put(COMPLETENESS, completeness.toMap());
            scores.add(completeness.score());
        }

        if (checks.contains(UNIQUENESS)) {
            CheckResult uniqueness = qualityMetrics.uniqueness(table,
                    ContextValues.string(context, "unique_key", uniqueKey));
            output.put(UNIQUENESS, uniqueness.toMap());
            scores.add(uniqueness.score());
        }

        double overall = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        output.put(OVERALL_SCORE, overall);
        output.put("passed", overall >= threshold);

        log.info("Quality score for {}: {}", table, String.format("%.2f%%", overall * 100));
        return CoreOutcome.ok(output);
    }
}
