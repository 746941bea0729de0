package com.jtablet.common.schema;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Represents the physical cell types a tablet column can hold.
 * Fixed-width types are stored little-endian in exactly {@link #getSize()} bytes;
 * STRING and BINARY are variable-width and are always copied through an arena.
 */
public enum Type {
    UINT8(0, 1),
    INT8(1, 1),
    UINT16(2, 2),
    INT16(3, 2),
    UINT32(4, 4),
    INT32(5, 4),
    UINT64(6, 8),
    INT64(7, 8),
    FLOAT(8, 4),
    DOUBLE(9, 8),
    BOOL(10, 1),
    STRING(11, -1),
    BINARY(12, -1);

    /**
     * Width of a variable-width cell in a row-major layout: an offset/length pair
     * referencing arena-owned bytes.
     */
    public static final int VARIABLE_SLOT_SIZE = 16;

    private final int value;
    private final int size;

    Type(int value, int size) {
        this.value = value;
        this.size = size;
    }

    public int getValue() {
        return value;
    }

    /**
     * Returns the fixed byte width of a cell of this type.
     *
     * @throws UnsupportedOperationException for variable-width types
     */
    public int getSize() {
        if (size < 0) {
            throw new UnsupportedOperationException("Type " + this + " has no fixed width");
        }
        return size;
    }

    public boolean isVariableWidth() {
        return size < 0;
    }

    /**
     * Returns the number of bytes a cell of this type occupies in a row-major layout.
     */
    public int getSlotSize() {
        return size < 0 ? VARIABLE_SLOT_SIZE : size;
    }

    /**
     * Encodes a Java value into the cell bytes of this type.
     * Integral types accept any {@link Number} and keep its low-order bits.
     *
     * @param value The value to encode
     * @return The encoded cell bytes
     * @throws IllegalArgumentException if the value does not fit this type
     */
    public byte[] encode(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot encode null as " + this);
        }
        if (this == STRING) {
            if (!(value instanceof CharSequence)) {
                throw new IllegalArgumentException("Expected a string for " + this + ", got " + value.getClass().getSimpleName());
            }
            return value.toString().getBytes(StandardCharsets.UTF_8);
        }
        if (this == BINARY) {
            if (!(value instanceof byte[])) {
                throw new IllegalArgumentException("Expected byte[] for " + this + ", got " + value.getClass().getSimpleName());
            }
            return ((byte[]) value).clone();
        }
        ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        if (this == BOOL) {
            if (!(value instanceof Boolean)) {
                throw new IllegalArgumentException("Expected a boolean for " + this + ", got " + value.getClass().getSimpleName());
            }
            buffer.put((byte) (((Boolean) value) ? 1 : 0));
            return buffer.array();
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Expected a number for " + this + ", got " + value.getClass().getSimpleName());
        }
        Number number = (Number) value;
        switch (this) {
            case UINT8, INT8 -> buffer.put(number.byteValue());
            case UINT16, INT16 -> buffer.putShort(number.shortValue());
            case UINT32, INT32 -> buffer.putInt((int) number.longValue());
            case UINT64, INT64 -> buffer.putLong(number.longValue());
            case FLOAT -> buffer.putFloat(number.floatValue());
            case DOUBLE -> buffer.putDouble(number.doubleValue());
            default -> throw new IllegalStateException("Unhandled type " + this);
        }
        return buffer.array();
    }

    /**
     * Decodes cell bytes of this type into a Java value. UINT8, UINT16 and
     * UINT32 widen to the next larger Java type so their value is never
     * negative. UINT64 has no larger primitive and decodes to the {@code long}
     * with the same bits, so values of 2^63 and above come back negative.
     *
     * @param cell The encoded cell, positioned at its first byte
     * @return The decoded value
     */
    public Object decode(ByteBuffer cell) {
        ByteBuffer buffer = cell.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        return switch (this) {
            case UINT8 -> Byte.toUnsignedInt(buffer.get());
            case INT8 -> (int) buffer.get();
            case UINT16 -> Short.toUnsignedInt(buffer.getShort());
            case INT16 -> (int) buffer.getShort();
            case UINT32 -> Integer.toUnsignedLong(buffer.getInt());
            case INT32 -> buffer.getInt();
            case UINT64, INT64 -> buffer.getLong();
            case FLOAT -> buffer.getFloat();
            case DOUBLE -> buffer.getDouble();
            case BOOL -> buffer.get() != 0;
            case STRING -> {
                byte[] bytes = new byte[buffer.remaining()];
                buffer.get(bytes);
                yield new String(bytes, StandardCharsets.UTF_8);
            }
            case BINARY -> {
                byte[] bytes = new byte[buffer.remaining()];
                buffer.get(bytes);
                yield bytes;
            }
        };
    }

    public static Type fromValue(int value) {
        for (Type type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown type value: " + value);
    }
}
