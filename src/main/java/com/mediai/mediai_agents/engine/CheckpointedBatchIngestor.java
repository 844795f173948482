package com.mediai.mediai_agents.engine;

import com.mediai.mediai_agents.model.ingest.CheckpointState;
import com.mediai.mediai_agents.model.ingest.IngestionRequest;
import com.mediai.mediai_agents.model.ingest.IngestionSummary;
import com.mediai.mediai_agents.model.ingest.RetryConfig;
import com.mediai.mediai_agents.model.ingest.RowBatch;
import com.mediai.mediai_agents.storage.BatchReader;
import com.mediai.mediai_agents.storage.CheckpointStore;
import com.mediai.mediai_agents.storage.DestinationConnection;
import com.mediai.mediai_agents.storage.DestinationStore;
import com.mediai.mediai_agents.storage.StorageConnectionException;
import com.mediai.mediai_agents.storage.TabularSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Moves a tabular source into a destination table chunk by chunk.
 *
 * How it works:
 *   1. Read the checkpoint (if configured) to get the number of rows already committed
 *   2. Count the data rows of the source once
 *   3. Open the destination, retrying transient connection faults with exponential backoff
 *   4. For every chunk: insert + commit, then persist the new checkpoint before reading on.
 *      A chunk that fails is rolled back, counted as failed, and the run continues.
 *   5. Close the connection on every exit path and return the summary
 *
 * Only a connection that still fails after the last attempt escapes {@link #ingest}.
 */
@Slf4j
public class CheckpointedBatchIngestor {

    private final TabularSource    tabularSource;
    private final DestinationStore destinationStore;
    private final CheckpointStore  checkpointStore;
    private final BackoffSleeper   sleeper;

    public CheckpointedBatchIngestor(TabularSource tabularSource,
                                     DestinationStore destinationStore,
                                     CheckpointStore checkpointStore,
                                     BackoffSleeper sleeper) {
        this.tabularSource = tabularSource;
        this.destinationStore = destinationStore;
        this.checkpointStore = checkpointStore;
        this.sleeper = sleeper;
    }

    public IngestionSummary ingest(IngestionRequest request) throws IOException {
        log.info("Starting ingestion: {} -> {}", request.sourceFile(), request.targetTable());

        long resumeOffset = resolveResumeOffset(request);
        long totalRows = tabularSource.countDataRows(request.sourceFile());
        log.info("Total rows in source: {}", totalRows);

        IngestionSummary.IngestionSummaryBuilder summary = IngestionSummary.builder()
                .sourceFile(request.sourceFile().toString())
                .targetTable(request.targetTable().qualifiedName())
                .totalRows(totalRows)
                .resumedFromRow(resumeOffset);

        if (resumeOffset >= totalRows) {
            log.info("Checkpoint at row {} covers all {} rows, nothing to ingest", resumeOffset, totalRows);
            return summary.rowsIngested(0).rowsFailed(0).build();
        }

        long rowsIngested = 0;
        long rowsFailed = 0;

        try (DestinationConnection connection = connectWithRetry(request.retry());
             BatchReader reader = tabularSource.openBatches(request.sourceFile(), resumeOffset, request.batchSize())) {

            while (reader.hasNext()) {
                RowBatch batch = reader.next();
                try {
                    connection.insertBatch(request.targetTable(), batch.columns(), batch.rows());
                    connection.commit();
                } catch (RuntimeException e) {
                    rollbackAfterFailure(connection);
                    rowsFailed += batch.size();
                    log.error("Failed to ingest batch starting at row {} ({} rows): {}",
                            batch.firstRow(), batch.size(), e.getMessage());
                    continue;
                }

                rowsIngested += batch.size();
                if (request.checkpointed()) {
                    checkpointStore.save(request.checkpointId(), new CheckpointState(resumeOffset + rowsIngested));
                }
                log.debug("Committed batch starting at row {} ({} rows)", batch.firstRow(), batch.size());
            }
        }

        IngestionSummary result = summary.rowsIngested(rowsIngested).rowsFailed(rowsFailed).build();
        log.info("Ingestion complete: {}/{} rows ingested, {} failed", rowsIngested, totalRows, rowsFailed);
        return result;
    }

    private long resolveResumeOffset(IngestionRequest request) throws IOException {
        if (!request.checkpointed()) {
            return 0L;
        }
        long offset = checkpointStore.load(request.checkpointId())
                .map(CheckpointState::lastProcessedRow)
                .orElse(0L);
        if (offset > 0) {
            log.info("Resuming from row {}", offset);
        }
        return offset;
    }

    DestinationConnection connectWithRetry(RetryConfig config) {
        RetryConfig retry = config.bounded();
        int attempts = retry.getMaxRetries();

        for (int attemptIndex = 0; ; attemptIndex++) {
            try {
                return destinationStore.open();
            } catch (StorageConnectionException ex) {
                if (attemptIndex + 1 >= attempts) {
                    log.error("Destination unreachable after {} attempts: {}", attempts, ex.getMessage());
                    throw ex;
                }
                long waitMs = retry.delayAfterAttempt(attemptIndex);
                log.warn("Connection attempt {}/{} failed: {}. Retrying in {} ms",
                        attemptIndex + 1, attempts, ex.getMessage(), waitMs);
                try {
                    sleeper.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry sleep interrupted, giving up on the destination");
                    throw ex;
                }
            }
        }
    }

    private void rollbackAfterFailure(DestinationConnection connection) {
        try {
            connection.rollback();
        } catch (RuntimeException e) {
            log.warn("Rollback after failed batch also failed: {}", e.getMessage());
        }
    }
}
