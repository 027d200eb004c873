package com.splitttr.gateway.ydoc;

/**
 * In-memory replica of a collaboratively edited document. Implementations merge concurrent
 * updates; the gateway only moves their encoded form around.
 */
public interface SharedDocument {

    /**
     * Serialized form of the document as it is written to storage.
     */
    String getSource();

    /**
     * Replaces the document with {@code source} as a local change.
     *
     * @return the update describing the change, to be sent to peers
     */
    byte[] setSource(String source);

    /**
     * Merges a peer update.
     *
     * @return {@code true} if the document changed
     * @throws com.splitttr.gateway.message.MessageFormatException if {@code update} is malformed
     */
    boolean applyUpdate(byte[] update);

    byte[] encodeStateVector();

    /**
     * Encodes everything a peer at {@code stateVector} is missing.
     */
    byte[] encodeStateAsUpdate(byte[] stateVector);

    default byte[] encodeStateAsUpdate() {
        return encodeStateAsUpdate(new byte[0]);
    }
}
