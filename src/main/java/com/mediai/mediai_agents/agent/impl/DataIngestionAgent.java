package com.mediai.mediai_agents.agent.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediai.mediai_agents.agent.Agent;
import com.mediai.mediai_agents.agent.ContextValues;
import com.mediai.mediai_agents.engine.CheckpointedBatchIngestor;
import com.mediai.mediai_agents.model.ingest.IngestionRequest;
import com.mediai.mediai_agents.model.ingest.IngestionSummary;
import com.mediai.mediai_agents.model.ingest.RetryConfig;
import com.mediai.mediai_agents.model.ingest.TableRef;
import com.mediai.mediai_agents.model.result.CoreOutcome;
import com.mediai.mediai_agents.model.result.ValidationOutcome;
import com.mediai.mediai_agents.storage.FileAccess;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a CSV extract into a raw table.
 *
 * Context shape:
 * {
 *   "source_file":     "data/sample/icustays.csv",
 *   "target_table":    "raw.icustays",
 *   "batch_size":      10000,                         // optional
 *   "checkpoint_file": "checkpoints/icustays.json",   // optional, enables resume
 *   "retry":           { "max_retries": 3 }           // optional, see RetryConfig
 * }
 *
 * Output: the ingestion summary (rows ingested / failed, success rate, resume offset).
 */
@Component
public class DataIngestionAgent extends Agent {

    public static final String TASK = "ingestion";

    private final CheckpointedBatchIngestor ingestor;
    private final FileAccess                fileAccess;
    private final ObjectMapper              objectMapper;
    private final RetryConfig               defaultRetry;
    private final int                       defaultBatchSize;

    public DataIngestionAgent(CheckpointedBatchIngestor ingestor,
                              FileAccess fileAccess,
                              ObjectMapper objectMapper,
                              RetryConfig defaultRetry,
                              @Value("${mediai.ingestion.batch-size:10000}") int defaultBatchSize,
                              @Value("${mediai.agent.history-limit:100}") int historyLimit) {
        super("DataIngestionAgent", "Ingests CSV extracts into the raw schema in checkpointed batches", historyLimit);
        this.ingestor = ingestor;
        this.fileAccess = fileAccess;
        this.objectMapper = objectMapper;
        this.defaultRetry = defaultRetry;
        this.defaultBatchSize = defaultBatchSize > 0 ? defaultBatchSize : IngestionRequest.DEFAULT_BATCH_SIZE;
    }

    @Override
    public ValidationOutcome validateInputs(Map<String, Object> context) {
        List<String> errors = new ArrayList<>();

        String sourceFile = ContextValues.string(context, "source_file");
        if (sourceFile == null) {
            errors.add("source_file is required");
        } else if (!fileAccess.exists(Path.of(sourceFile))) {
            errors.add("Source file not found: " + sourceFile);
        }

        String targetTable = ContextValues.string(context, "target_table");
        if (targetTable == null) {
            errors.add("target_table is required");
        } else if (TableRef.tryParse(targetTable).isEmpty()) {
            errors.add("target_table must be schema.table (e.g. raw.icustays), got: " + targetTable);
        }

        try {
            Optional<Long> batchSize = ContextValues.wholeNumber(context, "batch_size");
            if (batchSize.isPresent() && batchSize.get() <= 0) {
                errors.add("batch_size must be positive, got: " + batchSize.get());
            } else if (batchSize.isPresent() && batchSize.get() > Integer.MAX_VALUE) {
                errors.add("batch_size must be at most " + Integer.MAX_VALUE + ", got: " + batchSize.get());
            }
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (!ContextValues.isMapOrAbsent(context, "retry")) {
            errors.add("retry must be an object");
        }

        return ValidationOutcome.of(errors);
    }

    @Override
    protected CoreOutcome runCore(Map<String, Object> context) throws Exception {
        IngestionRequest request = IngestionRequest.builder()
                .sourceFile(Path.of(ContextValues.string(context, "source_file")))
                .targetTable(TableRef.parse(ContextValues.string(context, "target_table")))
                .batchSize(ContextValues.wholeNumber(context, "batch_size")
                        .map(Math::toIntExact)
                        .orElse(defaultBatchSize))
                .checkpointId(ContextValues.string(context, "checkpoint_file"))
                .retry(resolveRetry(context))
                .build();

        IngestionSummary summary = ingestor.ingest(request);
        return CoreOutcome.ok(summary.toMap());
    }

    @SuppressWarnings("unchecked")
    private RetryConfig resolveRetry(Map<String, Object> context) {
        Map<String, Object> overrides = ContextValues.map(context, "retry");
        if (overrides.isEmpty()) {
            return defaultRetry;
        }
        // start from the configured defaults, then apply only the keys the caller sent
        Map<String, Object> merged = objectMapper.convertValue(defaultRetry, Map.class);
        merged.putAll(overrides);
        return objectMapper.convertValue(merged, RetryConfig.class);
    }
}
