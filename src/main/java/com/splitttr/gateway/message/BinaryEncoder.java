package com.splitttr.gateway.message;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes lib0 style variable-length integers, byte arrays and strings.
 */
public final class BinaryEncoder {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public BinaryEncoder writeUint8(int value) {
        out.write(value & 0xFF);
        return this;
    }

    public BinaryEncoder writeVarUint(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("negative varuint: " + value);
        }
        while (value > 0x7F) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
        return this;
    }

    public BinaryEncoder writeVarUint8Array(byte[] bytes) {
        writeVarUint(bytes.length);
        out.writeBytes(bytes);
        return this;
    }

    public BinaryEncoder writeVarString(String value) {
        return writeVarUint8Array(value.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
