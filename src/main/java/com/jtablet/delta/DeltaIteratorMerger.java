package com.jtablet.delta;

import com.jtablet.columnar.ColumnBlock;
import com.jtablet.columnar.SelectionVector;
import com.jtablet.common.schema.Schema;
import com.jtablet.mvcc.MvccSnapshot;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives the iterators of several delta stores in lock-step.
 *
 * <p>Updates are applied store by store in the order the stores were given, so
 * stores must be ordered from oldest to newest for the newest value of a cell
 * to win.</p>
 */
public class DeltaIteratorMerger implements DeltaIterator {
    private final List<DeltaIterator> iters;

    private DeltaIteratorMerger(List<DeltaIterator> iters) {
        this.iters = iters;
    }

    /**
     * Creates an iterator over all the given stores. A single store's own
     * iterator is returned unwrapped.
     *
     * @param stores Delta stores, oldest first
     * @param projection Columns the scan reads
     * @param snapshot Decides which transactions' deltas are applied
     */
    public static DeltaIterator create(List<? extends DeltaStore> stores, Schema projection, MvccSnapshot snapshot) {
        if (stores.isEmpty()) {
            throw new IllegalArgumentException("At least one delta store is required");
        }
        List<DeltaIterator> iters = new ArrayList<>(stores.size());
        for (DeltaStore store : stores) {
            iters.add(store.newDeltaIterator(projection, snapshot));
        }
        if (iters.size() == 1) {
            return iters.get(0);
        }
        return new DeltaIteratorMerger(iters);
    }

    @Override
    public void init() throws IOException {
        for (DeltaIterator iter : iters) {
            iter.init();
        }
    }

    @Override
    public void seekToOrdinal(int rowIdx) throws IOException {
        for (DeltaIterator iter : iters) {
            iter.seekToOrdinal(rowIdx);
        }
    }

    @Override
    public void prepareBatch(int nrows) throws IOException {
        for (DeltaIterator iter : iters) {
            iter.prepareBatch(nrows);
        }
    }

    @Override
    public void applyUpdates(int projectionColumnIdx, ColumnBlock dst) throws IOException {
        for (DeltaIterator iter : iters) {
            iter.applyUpdates(projectionColumnIdx, dst);
        }
    }

    @Override
    public void applyDeletes(SelectionVector selection) throws IOException {
        for (DeltaIterator iter : iters) {
            iter.applyDeletes(selection);
        }
    }

    @Override
    public String toString() {
        return "DeltaIteratorMerger" + iters;
    }
}
