package io.zither.canvas.storage;

/**
 * Checked exception for spatial storage operations.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
