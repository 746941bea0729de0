package com.jtablet.delta;

import com.jtablet.columnar.ColumnBlock;
import com.jtablet.columnar.SelectionVector;
import com.jtablet.common.CorruptionException;
import com.jtablet.common.schema.ColumnSchema;
import com.jtablet.common.schema.Schema;
import com.jtablet.mvcc.MvccSnapshot;
import com.jtablet.rowchange.ColumnUpdate;
import com.jtablet.rowchange.RowChangeList;
import com.jtablet.rowchange.RowChangeListDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Delta iterator over a {@link DeltaMemStore}.
 *
 * <p>Walks the store's entries in {@code (row, txId)} order exactly once: each
 * {@link #prepareBatch(int)} resumes where the previous batch stopped. Every
 * visible entry of a batch is decoded while preparing, so a corrupt entry fails
 * the batch before any cell of the caller's blocks has been touched.</p>
 *
 * <p>Not thread-safe; each scan uses its own iterator.</p>
 */
public class DMSIterator implements DeltaIterator {
    private static final Logger LOG = LoggerFactory.getLogger(DMSIterator.class);

    private final DeltaMemStore dms;
    private final Schema projection;
    private final MvccSnapshot snapshot;

    // Store column index for each projected column.
    private int[] projectionMapping;

    private Iterator<Map.Entry<DeltaKey, RowChangeList>> entries;
    // Entry read from the store but past the end of the last prepared batch.
    private Map.Entry<DeltaKey, RowChangeList> pending;

    // Exceeds Integer.MAX_VALUE once a batch runs past the last possible row.
    private long curIdx;
    private int preparedCount;
    private final List<PreparedDelta> preparedDeltas = new ArrayList<>();

    private boolean initted;
    private boolean seeked;
    private boolean prepared;
    private boolean failed;

    DMSIterator(DeltaMemStore dms, Schema projection, MvccSnapshot snapshot) {
        this.dms = dms;
        this.projection = Objects.requireNonNull(projection, "projection cannot be null");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot cannot be null");
    }

    @Override
    public void init() {
        checkNotFailed();
        if (initted) {
            return;
        }
        Schema storeSchema = dms.getSchema();
        projectionMapping = new int[projection.getColumnCount()];
        for (int i = 0; i < projection.getColumnCount(); i++) {
            ColumnSchema col = projection.getColumn(i);
            int storeIdx = storeSchema.findColumn(col.getName());
            if (storeIdx < 0) {
                throw new IllegalArgumentException("Projected column " + col + " is not in " + storeSchema);
            }
            if (storeSchema.getColumn(storeIdx).getType() != col.getType()) {
                throw new IllegalArgumentException("Projected column " + col + " does not match "
                    + storeSchema.getColumn(storeIdx));
            }
            projectionMapping[i] = storeIdx;
        }
        initted = true;
    }

    @Override
    public void seekToOrdinal(int rowIdx) {
        checkNotFailed();
        if (!initted) {
            throw new IllegalStateException("Must init before seeking");
        }
        if (rowIdx < 0) {
            throw new IllegalArgumentException("Cannot seek to negative row " + rowIdx);
        }
        entries = dms.entriesFrom(rowIdx);
        pending = null;
        curIdx = rowIdx;
        preparedCount = 0;
        preparedDeltas.clear();
        prepared = false;
        seeked = true;
    }

    @Override
    public void prepareBatch(int nrows) throws CorruptionException {
        checkNotFailed();
        if (!seeked) {
            throw new IllegalStateException("Must seek before preparing a batch");
        }
        if (nrows < 0) {
            throw new IllegalArgumentException("Batch size must not be negative: " + nrows);
        }
        if (prepared) {
            curIdx += preparedCount;
        }
        preparedDeltas.clear();
        prepared = false;

        long endIdx = curIdx + nrows;
        int skipped = 0;
        try {
            while (true) {
                if (pending == null) {
                    if (!entries.hasNext()) {
                        break;
                    }
                    pending = entries.next();
                }
                DeltaKey key = pending.getKey();
                if (key.getRowIdx() >= endIdx) {
                    break;
                }
                if (key.getRowIdx() >= curIdx && snapshot.isCommitted(key.getTxId())) {
                    preparedDeltas.add(decode(key, pending.getValue()));
                } else {
                    skipped++;
                }
                pending = null;
            }
        } catch (CorruptionException e) {
            failed = true;
            LOG.warn("Corrupt delta while preparing rows [{}, {}): {}", curIdx, endIdx, e.getMessage());
            throw e;
        }

        preparedCount = nrows;
        prepared = true;
        LOG.trace("Prepared rows [{}, {}): {} visible deltas, {} skipped", curIdx, endIdx,
            preparedDeltas.size(), skipped);
    }

    @Override
    public void applyUpdates(int projectionColumnIdx, ColumnBlock dst) throws IOException {
        checkPrepared();
        if (projectionColumnIdx < 0 || projectionColumnIdx >= projectionMapping.length) {
            throw new IllegalArgumentException("Column " + projectionColumnIdx + " is not in the projection");
        }
        if (dst.nrows() < preparedCount) {
            throw new IllegalArgumentException("Block of " + dst.nrows() + " rows cannot hold a batch of "
                + preparedCount);
        }
        ColumnSchema column = projection.getColumn(projectionColumnIdx);
        if (dst.getType() != column.getType()) {
            throw new IllegalArgumentException("Block of type " + dst.getType() + " cannot hold column " + column);
        }

        int storeIdx = projectionMapping[projectionColumnIdx];
        for (PreparedDelta delta : preparedDeltas) {
            for (ColumnUpdate update : delta.updates) {
                if (update.getColumnIndex() == storeIdx) {
                    dst.setCell(delta.rowOffset, update.getValue());
                }
            }
        }
    }

    @Override
    public void applyDeletes(SelectionVector selection) {
        checkPrepared();
        if (selection.nrows() < preparedCount) {
            throw new IllegalArgumentException("Selection vector of " + selection.nrows()
                + " rows cannot hold a batch of " + preparedCount);
        }
        for (PreparedDelta delta : preparedDeltas) {
            if (delta.delete) {
                selection.setRowUnselected(delta.rowOffset);
            }
        }
    }

    @Override
    public String toString() {
        return "DMSIterator(" + snapshot + ", next row " + (prepared ? curIdx + preparedCount : curIdx) + ")";
    }

    private PreparedDelta decode(DeltaKey key, RowChangeList change) throws CorruptionException {
        RowChangeListDecoder decoder = new RowChangeListDecoder(dms.getSchema(), change);
        try {
            decoder.init();
            if (decoder.isDelete()) {
                return new PreparedDelta((int) (key.getRowIdx() - curIdx), true,
                    Collections.emptyList());
            }
            return new PreparedDelta((int) (key.getRowIdx() - curIdx), false, decoder.decodeAll());
        } catch (CorruptionException e) {
            throw new CorruptionException("Unable to decode delta " + key + ": " + e.getMessage(), e);
        }
    }

    private void checkPrepared() {
        checkNotFailed();
        if (!prepared) {
            throw new IllegalStateException("Must prepare a batch before applying it");
        }
    }

    private void checkNotFailed() {
        if (failed) {
            throw new IllegalStateException("Iterator failed earlier and cannot be reused");
        }
    }

    /**
     * A decoded, visible delta of the prepared batch.
     */
    private static final class PreparedDelta {
        private final int rowOffset;
        private final boolean delete;
        private final List<ColumnUpdate> updates;

        PreparedDelta(int rowOffset, boolean delete, List<ColumnUpdate> updates) {
            this.rowOffset = rowOffset;
            this.delete = delete;
            this.updates = updates;
        }
    }
}
