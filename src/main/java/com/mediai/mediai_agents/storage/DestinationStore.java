package com.mediai.mediai_agents.storage;

/**
 * Persistent store rows are ingested into.
 */
public interface DestinationStore {

    /**
     * Opens a connection owned by the caller until closed.
     *
     * @throws StorageConnectionException when the destination is unreachable
     */
    DestinationConnection open();
}
