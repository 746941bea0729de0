package com.jtablet.rowchange;

import com.jtablet.common.coding.Varint;
import com.jtablet.common.memory.Slice;
import com.jtablet.common.schema.ColumnSchema;
import com.jtablet.common.schema.Schema;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Builds encoded row change lists against a schema.
 *
 * <p>Updates are appended in the order they are added. One encoder can be reused
 * for many rows by calling {@link #reset()} between them. Value bytes are copied
 * into the encoder's buffer when they are added, so callers may reuse their own
 * buffers right away.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class RowChangeListEncoder {
    private final Schema schema;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private ChangeType type;

    public RowChangeListEncoder(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
    }

    /**
     * Adds an update of the given column to a Java value, encoded per the column's type.
     *
     * @param columnIndex Index of the column in the encoder's schema
     * @param value New value of the cell
     * @return this encoder
     */
    public RowChangeListEncoder addColumnUpdate(int columnIndex, Object value) {
        ColumnSchema column = schema.getColumn(columnIndex);
        return addRawColumnUpdate(columnIndex, column.getType().encode(value));
    }

    /**
     * Adds an update of the given column to already-encoded cell bytes.
     *
     * @param columnIndex Index of the column in the encoder's schema
     * @param cell Encoded cell; must be exactly the column's width for fixed-width types
     * @return this encoder
     */
    public RowChangeListEncoder addRawColumnUpdate(int columnIndex, byte[] cell) {
        ColumnSchema column = schema.getColumn(columnIndex);
        if (type == ChangeType.DELETE) {
            throw new IllegalStateException("Cannot add a column update to a row delete");
        }
        if (column.getType().isVariableWidth()) {
            startIfNeeded();
            Varint.putVarint32(buffer, columnIndex);
            Varint.putVarint32(buffer, cell.length);
        } else {
            if (cell.length != column.getType().getSize()) {
                throw new IllegalArgumentException("Column " + column + " expects "
                    + column.getType().getSize() + " bytes, got " + cell.length);
            }
            startIfNeeded();
            Varint.putVarint32(buffer, columnIndex);
        }
        buffer.write(cell, 0, cell.length);
        return this;
    }

    /**
     * Turns this change into a row delete. The encoder must be empty.
     */
    public RowChangeListEncoder setToDelete() {
        if (type != null) {
            throw new IllegalStateException("Encoder already holds a " + type + " change");
        }
        type = ChangeType.DELETE;
        buffer.write(ChangeType.DELETE.getValue());
        return this;
    }

    public boolean isEmpty() {
        return type == null;
    }

    public void reset() {
        buffer.reset();
        type = null;
    }

    /**
     * Returns the encoded change. The returned list owns a copy of the encoder's
     * buffer and is unaffected by later use of the encoder.
     */
    public RowChangeList toRowChangeList() {
        if (type == null) {
            throw new IllegalStateException("No change has been encoded");
        }
        return new RowChangeList(Slice.wrap(buffer.toByteArray()));
    }

    /**
     * Returns the encoded bytes.
     */
    public byte[] toByteArray() {
        return buffer.toByteArray();
    }

    private void startIfNeeded() {
        if (type == null) {
            type = ChangeType.UPDATE;
            buffer.write(ChangeType.UPDATE.getValue());
        }
    }
}
