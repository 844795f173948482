package com.mediai.mediai_agents.storage;

/**
 * The destination could not be reached. Treated as transient by the ingestor.
 */
public class StorageConnectionException extends RuntimeException {

    public StorageConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageConnectionException(String message) {
        super(message);
    }
}
