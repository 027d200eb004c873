package com.splitttr.gateway.contents;

/**
 * Content that cannot be written in the requested format. Retrying the same content fails again.
 */
public class InvalidContentException extends StorageException {

    public InvalidContentException(String message) {
        super(message);
    }

    public InvalidContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
