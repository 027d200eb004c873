package com.splitttr.gateway.message;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a {@link YMessageType#AWARENESS} frame. Each entry carries a participant's client id,
 * its logical clock and its state as JSON ({@code "null"} when the participant left).
 */
public record AwarenessUpdate(List<Entry> entries) {

    public record Entry(long clientId, long clock, String state) {

        public boolean isRemoval() {
            return state == null || "null".equals(state);
        }
    }

    public AwarenessUpdate {
        entries = List.copyOf(entries);
    }

    public static AwarenessUpdate decode(byte[] frame) {
        BinaryDecoder outer = new BinaryDecoder(frame);
        int messageType = outer.readUint8();
        if (messageType != YMessageType.AWARENESS.code()) {
            throw new MessageFormatException("Not an awareness message: " + messageType);
        }
        BinaryDecoder decoder = new BinaryDecoder(outer.readVarUint8Array());
        long count = decoder.readVarUint();
        List<Entry> entries = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            long clientId = decoder.readVarUint();
            long clock = decoder.readVarUint();
            String state = decoder.readVarString();
            entries.add(new Entry(clientId, clock, state));
        }
        return new AwarenessUpdate(entries);
    }

    public byte[] encode() {
        BinaryEncoder body = new BinaryEncoder().writeVarUint(entries.size());
        for (Entry entry : entries) {
            body.writeVarUint(entry.clientId())
                .writeVarUint(entry.clock())
                .writeVarString(entry.state() == null ? "null" : entry.state());
        }
        return new BinaryEncoder()
                .writeVarUint(YMessageType.AWARENESS.code())
                .writeVarUint8Array(body.toByteArray())
                .toByteArray();
    }
}
