package com.splitttr.gateway.message;

import java.util.Optional;

/**
 * Discriminator carried by the first byte of every frame.
 */
public enum YMessageType {
    SYNC(0),
    AWARENESS(1),
    AUTH(2),
    QUERY_AWARENESS(3);

    private final int code;

    YMessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<YMessageType> of(int code) {
        for (YMessageType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
