package com.jtablet.common.memory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A read-only view over a range of a byte array.
 * A slice does not own its bytes: whoever handed it out (a caller buffer, an
 * {@link Arena}) decides how long they stay valid. Use {@link Arena#allocateCopy}
 * to obtain a slice that outlives the source buffer.
 */
public final class Slice implements Comparable<Slice> {
    public static final Slice EMPTY = new Slice(new byte[0], 0, 0);

    private final byte[] data;
    private final int offset;
    private final int length;

    private Slice(byte[] data, int offset, int length) {
        this.data = data;
        this.offset = offset;
        this.length = length;
    }

    public static Slice wrap(byte[] data) {
        return new Slice(Objects.requireNonNull(data, "data cannot be null"), 0, data.length);
    }

    public static Slice wrap(byte[] data, int offset, int length) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.checkFromIndexSize(offset, length, data.length);
        return new Slice(data, offset, length);
    }

    public int size() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public byte get(int index) {
        Objects.checkIndex(index, length);
        return data[offset + index];
    }

    public Slice subSlice(int start, int size) {
        Objects.checkFromIndexSize(start, size, length);
        return new Slice(data, offset + start, size);
    }

    public Slice subSlice(int start) {
        return subSlice(start, length - start);
    }

    /**
     * Copies this slice's bytes into {@code dest} starting at {@code destOffset}.
     */
    public void copyTo(byte[] dest, int destOffset) {
        System.arraycopy(data, offset, dest, destOffset, length);
    }

    public byte[] toByteArray() {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    public ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(data, offset, length).slice().asReadOnlyBuffer();
    }

    public String toStringUtf8() {
        return new String(data, offset, length, StandardCharsets.UTF_8);
    }

    /**
     * Renders the bytes with printable ASCII kept as-is and everything else hex-escaped.
     */
    public String toDebugString() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = offset; i < offset + length; i++) {
            int b = data[i] & 0xFF;
            if (b >= 0x20 && b < 0x7F) {
                sb.append((char) b);
            } else {
                sb.append(String.format("\\x%02x", b));
            }
        }
        return sb.toString();
    }

    @Override
    public int compareTo(Slice other) {
        return Arrays.compareUnsigned(data, offset, offset + length,
            other.data, other.offset, other.offset + other.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slice)) return false;
        Slice that = (Slice) o;
        return Arrays.equals(data, offset, offset + length,
            that.data, that.offset, that.offset + that.length);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = offset; i < offset + length; i++) {
            result = 31 * result + data[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return toDebugString();
    }
}
