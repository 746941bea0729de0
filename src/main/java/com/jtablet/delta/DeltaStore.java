package com.jtablet.delta;

import com.jtablet.common.schema.Schema;
import com.jtablet.mvcc.MvccSnapshot;

/**
 * A source of deltas for one tablet segment.
 */
public interface DeltaStore {
    /**
     * Creates an iterator that applies this store's deltas for the given
     * projection, as visible in the given snapshot.
     *
     * @param projection Columns the scan reads; each must exist in the store's schema
     * @param snapshot Decides which transactions' deltas are applied
     * @return A new, uninitialized iterator
     */
    DeltaIterator newDeltaIterator(Schema projection, MvccSnapshot snapshot);
}
