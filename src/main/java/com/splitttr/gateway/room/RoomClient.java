package com.splitttr.gateway.room;

/**
 * A connected peer as seen by a {@link Room}.
 */
public interface RoomClient {

    String id();

    /**
     * Blocks until the next inbound frame arrives.
     *
     * @return the frame, or {@code null} once the peer disconnected
     */
    byte[] receive() throws InterruptedException;

    /**
     * Best-effort delivery; failures are handled by the client and never thrown.
     */
    void send(byte[] message);

    void close(int code, String reason);
}
