package com.splitttr.gateway.message;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reads what {@link BinaryEncoder} writes. Every read past the end of the buffer fails with
 * {@link MessageFormatException}.
 */
public final class BinaryDecoder {

    // varuints are bounded to 53 bits like JavaScript numbers
    private static final int MAX_VARUINT_SHIFT = 53;

    private final byte[] buffer;
    private int position;

    public BinaryDecoder(byte[] buffer) {
        this(buffer, 0);
    }

    public BinaryDecoder(byte[] buffer, int offset) {
        this.buffer = buffer;
        this.position = offset;
    }

    public boolean hasRemaining() {
        return position < buffer.length;
    }

    public int readUint8() {
        if (position >= buffer.length) {
            throw new MessageFormatException("Unexpected end of message at byte " + position);
        }
        return buffer[position++] & 0xFF;
    }

    public long readVarUint() {
        long value = 0;
        int shift = 0;
        while (true) {
            int b = readUint8();
            value |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
            shift += 7;
            if (shift > MAX_VARUINT_SHIFT) {
                throw new MessageFormatException("Integer out of range at byte " + position);
            }
        }
    }

    public byte[] readVarUint8Array() {
        long length = readVarUint();
        if (length > buffer.length - position) {
            throw new MessageFormatException("Declared length " + length + " exceeds the message size");
        }
        int start = position;
        position += (int) length;
        return Arrays.copyOfRange(buffer, start, position);
    }

    public String readVarString() {
        return new String(readVarUint8Array(), StandardCharsets.UTF_8);
    }
}
