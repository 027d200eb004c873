package com.splitttr.gateway.session;

import com.splitttr.gateway.room.DocumentKey;

/**
 * What a client needs to join the room of a document.
 */
public record DocumentSession(
    String format,
    String type,
    String fileId,
    String sessionId
) {

    public String roomId() {
        return new DocumentKey(format, type, fileId).toRoomId();
    }
}
