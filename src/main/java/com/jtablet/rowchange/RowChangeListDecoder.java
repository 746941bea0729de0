package com.jtablet.rowchange;

import com.jtablet.common.CorruptionException;
import com.jtablet.common.coding.Varint;
import com.jtablet.common.memory.Slice;
import com.jtablet.common.schema.Type;
import com.jtablet.common.schema.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Single-pass, forward-only reader of an encoded {@link RowChangeList}.
 *
 * <p>Call {@link #init()} first, then either check {@link #isDelete()} or pull
 * updates with {@link #hasNext()} / {@link #decodeNext()}. Decoded values are
 * slices into the source buffer; copy them before the buffer goes away.</p>
 */
public class RowChangeListDecoder {
    private final Schema schema;
    private final Slice encoded;
    private ChangeType type;
    private int offset;

    public RowChangeListDecoder(Schema schema, RowChangeList change) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.encoded = Objects.requireNonNull(change, "change cannot be null").getSlice();
    }

    /**
     * Reads the header.
     *
     * @throws CorruptionException If the buffer is empty or its header is invalid
     */
    public void init() throws CorruptionException {
        if (encoded.isEmpty()) {
            throw new CorruptionException("Empty row change list");
        }
        int header = encoded.get(0) & 0xFF;
        if (header == ChangeType.UPDATE.getValue()) {
            type = ChangeType.UPDATE;
            if (encoded.size() == 1) {
                throw new CorruptionException("Update with no column changes");
            }
        } else if (header == ChangeType.DELETE.getValue()) {
            type = ChangeType.DELETE;
            if (encoded.size() != 1) {
                throw new CorruptionException("Row delete carries " + (encoded.size() - 1)
                    + " unexpected trailing bytes");
            }
        } else {
            throw new CorruptionException("Bad row change list header: " + header);
        }
        offset = 1;
    }

    public ChangeType getType() {
        checkInitialized();
        return type;
    }

    public boolean isDelete() {
        return getType() == ChangeType.DELETE;
    }

    public boolean isUpdate() {
        return getType() == ChangeType.UPDATE;
    }

    public boolean hasNext() {
        checkInitialized();
        return type == ChangeType.UPDATE && offset < encoded.size();
    }

    /**
     * Decodes the next column update.
     *
     * @throws CorruptionException If the entry is truncated or names an unknown column
     * @throws NoSuchElementException If there are no more updates
     */
    public ColumnUpdate decodeNext() throws CorruptionException {
        if (!hasNext()) {
            throw new NoSuchElementException("No more column updates");
        }
        Varint.Decoded columnIdx = Varint.getVarint32(encoded, offset);
        int col = columnIdx.getValue();
        if (col < 0 || col >= schema.getColumnCount()) {
            throw new CorruptionException("Column index " + Integer.toUnsignedString(col)
                + " out of range for schema with " + schema.getColumnCount() + " columns");
        }
        offset = columnIdx.getNextOffset();

        Type colType = schema.getColumn(col).getType();
        int valueSize;
        if (colType.isVariableWidth()) {
            Varint.Decoded length = Varint.getVarint32(encoded, offset);
            valueSize = length.getValue();
            offset = length.getNextOffset();
        } else {
            valueSize = colType.getSize();
        }
        if (valueSize < 0 || valueSize > encoded.size() - offset) {
            throw new CorruptionException("Truncated value for column " + col + ": need "
                + Integer.toUnsignedString(valueSize) + " bytes, have " + (encoded.size() - offset));
        }
        Slice value = encoded.subSlice(offset, valueSize);
        offset += valueSize;
        return new ColumnUpdate(col, value);
    }

    /**
     * Decodes the updates not read yet.
     */
    public List<ColumnUpdate> decodeAll() throws CorruptionException {
        List<ColumnUpdate> updates = new ArrayList<>();
        while (hasNext()) {
            updates.add(decodeNext());
        }
        return updates;
    }

    private void checkInitialized() {
        if (type == null) {
            throw new IllegalStateException("Decoder not initialized");
        }
    }
}
