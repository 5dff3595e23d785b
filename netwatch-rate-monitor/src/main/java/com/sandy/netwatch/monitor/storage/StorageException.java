package com.sandy.netwatch.monitor.storage;

/**
 * A backing store operation that still failed after all retries.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
