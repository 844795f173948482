package com.mediai.mediai_agents.storage;

/**
 * A single chunk could not be written. Never fatal for an ingestion run.
 */
public class BatchInsertException extends RuntimeException {

    public BatchInsertException(String message, Throwable cause) {
        super(message, cause);
    }

    public BatchInsertException(String message) {
        super(message);
    }
}
