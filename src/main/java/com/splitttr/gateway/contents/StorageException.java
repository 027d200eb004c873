package com.splitttr.gateway.contents;

/**
 * Read or write failure of a contents backend.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
