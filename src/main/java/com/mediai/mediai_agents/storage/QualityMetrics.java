package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.TableRef;

import java.util.List;
import java.util.Map;

/**
 * Numeric data-quality measurements on a stored table. Scores are in [0, 1].
 */
public interface QualityMetrics {

    CheckResult completeness(TableRef table, List<String> columns);

    CheckResult uniqueness(TableRef table, String keyColumn);

    record CheckResult(String check, double score, Map<String, Object> details) {

        public Map<String, Object> toMap() {
            return Map.of("check", check, "score", score, "details", details);
        }
    }
}
