package com.jtablet.common.coding;

import com.jtablet.common.CorruptionException;
import com.jtablet.common.memory.Slice;

import java.io.ByteArrayOutputStream;

/**
 * Base-128 varint coding of unsigned 32-bit integers: seven bits per byte,
 * least significant group first, high bit set on every byte but the last.
 */
public final class Varint {
    private static final int MAX_VARINT32_BYTES = 5;

    private Varint() {
        // Prevent instantiation
    }

    public static void putVarint32(ByteArrayOutputStream out, int value) {
        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value);
    }

    public static int varint32Length(int value) {
        int length = 1;
        while ((value & ~0x7F) != 0) {
            value >>>= 7;
            length++;
        }
        return length;
    }

    /**
     * Decodes a varint starting at {@code offset} in {@code src}.
     *
     * @throws CorruptionException If the varint is truncated or longer than five bytes
     */
    public static Decoded getVarint32(Slice src, int offset) throws CorruptionException {
        int result = 0;
        int shift = 0;
        for (int i = 0; i < MAX_VARINT32_BYTES; i++) {
            if (offset >= src.size()) {
                throw new CorruptionException("Truncated varint at offset " + offset);
            }
            byte b = src.get(offset++);
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return new Decoded(result, offset);
            }
            shift += 7;
        }
        throw new CorruptionException("Malformed varint ending at offset " + offset);
    }

    /**
     * A decoded value together with the offset of the first byte after it.
     */
    public static final class Decoded {
        private final int value;
        private final int nextOffset;

        Decoded(int value, int nextOffset) {
            this.value = value;
            this.nextOffset = nextOffset;
        }

        public int getValue() {
            return value;
        }

        public int getNextOffset() {
            return nextOffset;
        }
    }
}
