package com.splitttr.gateway.websocket;

/**
 * Outbound side of a client connection.
 */
public interface ConnectionChannel {

    /**
     * @throws RuntimeException if the frame could not be written
     */
    void send(byte[] message);

    void close(int code, String reason);
}
