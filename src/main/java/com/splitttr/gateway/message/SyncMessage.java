package com.splitttr.gateway.message;

/**
 * Body of a {@link YMessageType#SYNC} frame: a sync step and its payload (a state vector for
 * {@link YSyncType#STEP1}, an update otherwise).
 */
public record SyncMessage(YSyncType type, byte[] payload) {

    public static SyncMessage step1(byte[] stateVector) {
        return new SyncMessage(YSyncType.STEP1, stateVector);
    }

    public static SyncMessage step2(byte[] update) {
        return new SyncMessage(YSyncType.STEP2, update);
    }

    public static SyncMessage update(byte[] update) {
        return new SyncMessage(YSyncType.UPDATE, update);
    }

    public static SyncMessage decode(byte[] frame) {
        BinaryDecoder decoder = new BinaryDecoder(frame);
        int messageType = decoder.readUint8();
        if (messageType != YMessageType.SYNC.code()) {
            throw new MessageFormatException("Not a sync message: " + messageType);
        }
        YSyncType type = YSyncType.of(decoder.readVarUint());
        return new SyncMessage(type, decoder.readVarUint8Array());
    }

    public byte[] encode() {
        return new BinaryEncoder()
                .writeVarUint(YMessageType.SYNC.code())
                .writeVarUint(type.code())
                .writeVarUint8Array(payload)
                .toByteArray();
    }
}
