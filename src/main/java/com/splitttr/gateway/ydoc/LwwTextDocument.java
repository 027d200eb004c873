package com.splitttr.gateway.ydoc;

import com.splitttr.gateway.message.BinaryDecoder;
import com.splitttr.gateway.message.BinaryEncoder;

/**
 * Last-writer-wins register holding the whole document source.
 *
 * <p>Each write carries a logical clock and the writer's client id; a replica adopts an update
 * when its clock is higher, ties going to the higher client id. Updates are encoded as
 * {@code varuint clock, varuint clientId, varstring source}; the state vector is the clock.
 */
public final class LwwTextDocument implements SharedDocument {

    private final long clientId;

    private String source = "";
    private long clock;
    private long writer;

    public LwwTextDocument(long clientId) {
        this.clientId = clientId;
    }

    public long clientId() {
        return clientId;
    }

    public synchronized long clock() {
        return clock;
    }

    @Override
    public synchronized String getSource() {
        return source;
    }

    @Override
    public synchronized byte[] setSource(String newSource) {
        clock++;
        writer = clientId;
        source = newSource;
        return encodeState();
    }

    @Override
    public synchronized boolean applyUpdate(byte[] update) {
        if (update.length == 0) {
            return false;
        }
        BinaryDecoder decoder = new BinaryDecoder(update);
        long updateClock = decoder.readVarUint();
        long updateWriter = decoder.readVarUint();
        String updateSource = decoder.readVarString();
        if (updateClock < clock || (updateClock == clock && updateWriter <= writer)) {
            return false;
        }
        clock = updateClock;
        writer = updateWriter;
        source = updateSource;
        return true;
    }

    @Override
    public synchronized byte[] encodeStateVector() {
        return new BinaryEncoder().writeVarUint(clock).toByteArray();
    }

    @Override
    public synchronized byte[] encodeStateAsUpdate(byte[] stateVector) {
        if (stateVector.length > 0 && new BinaryDecoder(stateVector).readVarUint() > clock) {
            return new byte[0];
        }
        return encodeState();
    }

    private byte[] encodeState() {
        return new BinaryEncoder()
                .writeVarUint(clock)
                .writeVarUint(writer)
                .writeVarString(source)
                .toByteArray();
    }
}
