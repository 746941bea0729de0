package com.jtablet.rowchange;

import com.jtablet.common.CorruptionException;
import com.jtablet.common.memory.Slice;
import com.jtablet.common.schema.ColumnSchema;
import com.jtablet.common.schema.Schema;

import java.util.Objects;

/**
 * An encoded partial-row change: either a set of column updates or a row delete.
 *
 * <p>Wire format: one header byte ({@link ChangeType#getValue()}). A DELETE has
 * nothing after the header. An UPDATE is followed by entries of
 * {@code varint column_index} and the new value, which is the column's fixed
 * width for fixed-width types or a varint length followed by the bytes for
 * variable-width types.</p>
 *
 * <p>A row change list does not own its bytes; see {@link Slice}.</p>
 */
public final class RowChangeList {
    private static final RowChangeList DELETE =
        new RowChangeList(Slice.wrap(new byte[] { (byte) ChangeType.DELETE.getValue() }));

    private final Slice encoded;

    public RowChangeList(Slice encoded) {
        this.encoded = Objects.requireNonNull(encoded, "encoded cannot be null");
    }

    public static RowChangeList createDelete() {
        return DELETE;
    }

    public Slice getSlice() {
        return encoded;
    }

    public int size() {
        return encoded.size();
    }

    public boolean isDelete() {
        return encoded.size() > 0 && encoded.get(0) == ChangeType.DELETE.getValue();
    }

    /**
     * Renders the change as {@code SET col=value, ...} or {@code DELETE}.
     *
     * @throws CorruptionException If the list cannot be decoded against the schema
     */
    public String toString(Schema schema) throws CorruptionException {
        RowChangeListDecoder decoder = new RowChangeListDecoder(schema, this);
        decoder.init();
        if (decoder.isDelete()) {
            return "DELETE";
        }
        StringBuilder sb = new StringBuilder("SET ");
        boolean first = true;
        while (decoder.hasNext()) {
            ColumnUpdate update = decoder.decodeNext();
            ColumnSchema column = schema.getColumn(update.getColumnIndex());
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(column.getName()).append('=')
              .append(column.stringifyCell(column.getType().decode(update.getValue().toByteBuffer())));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RowChangeList{" + encoded.toDebugString() + "}";
    }
}
