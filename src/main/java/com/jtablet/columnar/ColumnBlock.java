package com.jtablet.columnar;

import com.jtablet.common.memory.Arena;
import com.jtablet.common.memory.ArenaExhaustedException;
import com.jtablet.common.memory.Slice;
import com.jtablet.common.schema.Type;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Represents the values of one column for a contiguous range of rows.
 * Fixed-width cells live in a little-endian buffer of {@code nrows * width}
 * bytes; variable-width cells are slices whose bytes are copied into the
 * block's arena when they are set.
 *
 * <p>The block is supplied by the scanner for each batch; cell {@code i}
 * corresponds to the {@code i}-th row of that batch.</p>
 */
public class ColumnBlock {
    private final Type type;
    private final int nrows;
    private final Arena arena;
    private final ByteBuffer data;
    private final Slice[] cells;

    public ColumnBlock(Type type, int nrows, Arena arena) {
        if (nrows < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + nrows);
        }
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.nrows = nrows;
        this.arena = Objects.requireNonNull(arena, "arena cannot be null");
        if (type.isVariableWidth()) {
            this.data = null;
            this.cells = new Slice[nrows];
        } else {
            this.data = ByteBuffer.allocate(nrows * type.getSize()).order(ByteOrder.LITTLE_ENDIAN);
            this.cells = null;
        }
    }

    public Type getType() {
        return type;
    }

    public int nrows() {
        return nrows;
    }

    public Arena getArena() {
        return arena;
    }

    /**
     * Sets a cell from its encoded bytes. Variable-width bytes are copied into
     * this block's arena, so the source may be reclaimed afterwards.
     *
     * @param row Row offset within the block
     * @param encoded Encoded cell value
     * @throws ArenaExhaustedException If the block's arena cannot hold the copy
     */
    public void setCell(int row, Slice encoded) throws ArenaExhaustedException {
        Objects.checkIndex(row, nrows);
        if (type.isVariableWidth()) {
            cells[row] = arena.allocateCopy(encoded);
            return;
        }
        int width = type.getSize();
        if (encoded.size() != width) {
            throw new IllegalArgumentException("Cell of type " + type + " must be " + width
                + " bytes, got " + encoded.size());
        }
        for (int i = 0; i < width; i++) {
            data.put(row * width + i, encoded.get(i));
        }
    }

    /**
     * Returns the encoded bytes of a cell, or null for a variable-width cell never set.
     */
    public Slice getCell(int row) {
        Objects.checkIndex(row, nrows);
        if (type.isVariableWidth()) {
            return cells[row];
        }
        int width = type.getSize();
        return Slice.wrap(data.array(), row * width, width);
    }

    public void setValue(int row, Object value) throws ArenaExhaustedException {
        setCell(row, Slice.wrap(type.encode(value)));
    }

    /**
     * Returns the decoded value of a cell, or null for a variable-width cell never set.
     */
    public Object getValue(int row) {
        Slice cell = getCell(row);
        return cell == null ? null : type.decode(cell.toByteBuffer());
    }

    public long getUInt32(int row) {
        checkType(Type.UINT32);
        Objects.checkIndex(row, nrows);
        return Integer.toUnsignedLong(data.getInt(row * 4));
    }

    public void setUInt32(int row, long value) {
        checkType(Type.UINT32);
        Objects.checkIndex(row, nrows);
        data.putInt(row * 4, (int) value);
    }

    public String getString(int row) {
        checkType(Type.STRING);
        Slice cell = getCell(row);
        return cell == null ? null : cell.toStringUtf8();
    }

    private void checkType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Column block holds " + type + ", not " + expected);
        }
    }
}
