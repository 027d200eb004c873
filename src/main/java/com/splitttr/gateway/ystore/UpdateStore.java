package com.splitttr.gateway.ystore;

import java.util.List;

/**
 * Append-only log of document updates, replayable in the order they were appended.
 */
public interface UpdateStore extends AutoCloseable {

    /**
     * @throws com.splitttr.gateway.contents.StorageException if the record cannot be written
     */
    void append(byte[] update);

    /**
     * Every update appended so far, oldest first. Empty when the log does not exist yet.
     */
    List<byte[]> replay();

    @Override
    void close();
}
