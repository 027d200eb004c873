package com.splitttr.gateway.message;

/**
 * A frame that does not follow the wire protocol.
 */
public class MessageFormatException extends RuntimeException {

    public MessageFormatException(String message) {
        super(message);
    }

    public MessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
