package com.splitttr.gateway.websocket;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingChannel implements ConnectionChannel {

    private final List<byte[]> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;
    private volatile int closeCode = -1;
    private volatile String closeReason;

    static RecordingChannel failing() {
        RecordingChannel channel = new RecordingChannel();
        channel.failing = true;
        return channel;
    }

    @Override
    public void send(byte[] message) {
        if (failing) {
            throw new IllegalStateException("connection reset");
        }
        sent.add(message);
    }

    @Override
    public void close(int code, String reason) {
        closeCode = code;
        closeReason = reason;
    }

    List<byte[]> sent() {
        return List.copyOf(sent);
    }

    int closeCode() {
        return closeCode;
    }

    String closeReason() {
        return closeReason;
    }
}
