package com.sparrowlogic.networktopology.ingest;

/**
 * Raised when a snapshot cannot be loaded at all, for instance because its directory does not exist.
 * Individual missing or unreadable files never raise it.
 */
public class SnapshotLoadException extends RuntimeException {

    public SnapshotLoadException(String message) {
        super(message);
    }

    public SnapshotLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
