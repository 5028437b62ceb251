package com.invdash.store;

/**
 * Durable snapshot store failure. Never fatal for in-memory serving.
 */
public class SnapshotPersistenceException extends RuntimeException {
    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
