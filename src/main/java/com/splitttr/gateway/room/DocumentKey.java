package com.splitttr.gateway.room;

import java.util.Objects;

/**
 * Identity of a document room, serialized as {@code format:type:fileId}. Any room id with fewer
 * than two separators names a transient room.
 */
public record DocumentKey(String format, String type, String fileId) {

    private static final char SEPARATOR = ':';

    public DocumentKey {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fileId, "fileId");
    }

    public static boolean isDocumentRoom(String roomId) {
        int first = roomId.indexOf(SEPARATOR);
        return first >= 0 && roomId.indexOf(SEPARATOR, first + 1) >= 0;
    }

    /**
     * @throws IllegalArgumentException if {@code roomId} is not a document room id
     */
    public static DocumentKey parse(String roomId) {
        if (!isDocumentRoom(roomId)) {
            throw new IllegalArgumentException("Not a document room id: " + roomId);
        }
        String[] parts = roomId.split(":", 3);
        return new DocumentKey(parts[0], parts[1], parts[2]);
    }

    public String toRoomId() {
        return format + SEPARATOR + type + SEPARATOR + fileId;
    }
}
