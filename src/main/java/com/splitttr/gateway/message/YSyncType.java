package com.splitttr.gateway.message;

public enum YSyncType {
    STEP1,      // state vector
    STEP2,      // missing updates for a state vector
    UPDATE;

    public int code() {
        return ordinal();
    }

    public static YSyncType of(long code) {
        YSyncType[] types = values();
        if (code < 0 || code >= types.length) {
            throw new MessageFormatException("Unknown sync message type " + code);
        }
        return types[(int) code];
    }
}
