package com.jtablet.rowchange;

import com.jtablet.common.memory.Slice;

/**
 * One decoded {@code (column index, new value)} pair of a row change list.
 * The value slice points into the buffer the list was decoded from.
 */
public final class ColumnUpdate {
    private final int columnIndex;
    private final Slice value;

    public ColumnUpdate(int columnIndex, Slice value) {
        this.columnIndex = columnIndex;
        this.value = value;
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public Slice getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "ColumnUpdate{" + columnIndex + "=" + value.toDebugString() + "}";
    }
}
