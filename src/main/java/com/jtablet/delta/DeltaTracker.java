package com.jtablet.delta;

import com.jtablet.common.schema.Schema;
import com.jtablet.mvcc.MvccManager;
import com.jtablet.mvcc.MvccSnapshot;
import com.jtablet.mvcc.ScopedTransaction;
import com.jtablet.mvcc.TxId;
import com.jtablet.rowchange.RowChangeList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks the deltas of one tablet segment: the mutable {@link DeltaMemStore}
 * receiving new changes plus any older, read-only delta stores.
 *
 * <p>Writes go through {@link #update}, which runs each change in its own
 * transaction. Reads go through {@link #newDeltaIterator}, which applies the
 * older stores first and the memstore last.</p>
 */
public class DeltaTracker {
    private static final Logger LOG = LoggerFactory.getLogger(DeltaTracker.class);

    private final MvccManager mvcc;
    private final DeltaMemStore dms;
    private final List<DeltaStore> olderStores = new CopyOnWriteArrayList<>();

    public DeltaTracker(Schema schema, MvccManager mvcc) {
        this(schema, mvcc, DeltaStoreConfig.defaults());
    }

    public DeltaTracker(Schema schema, MvccManager mvcc, DeltaStoreConfig config) {
        this.mvcc = Objects.requireNonNull(mvcc, "mvcc cannot be null");
        this.dms = new DeltaMemStore(schema, config);
    }

    /**
     * Applies a change to a row in a new transaction and commits it.
     * The transaction commits even if the store rejects the change.
     *
     * @param rowIdx Index of the changed row
     * @param change Encoded change against the segment's schema
     * @return The id of the transaction that made the change
     * @throws IOException If the memstore cannot hold the change
     */
    public TxId update(int rowIdx, RowChangeList change) throws IOException {
        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            dms.update(tx.getTxId(), rowIdx, change);
            return tx.getTxId();
        }
    }

    /**
     * Registers a read-only store holding changes older than any still to come.
     * Stores added later are treated as newer than stores added earlier.
     */
    public void addDeltaStore(DeltaStore store) {
        olderStores.add(Objects.requireNonNull(store, "store cannot be null"));
        LOG.debug("Added delta store {}, now tracking {} stores besides the memstore", store, olderStores.size());
    }

    public DeltaIterator newDeltaIterator(Schema projection, MvccSnapshot snapshot) {
        List<DeltaStore> stores = new ArrayList<>(olderStores);
        stores.add(dms);
        return DeltaIteratorMerger.create(stores, projection, snapshot);
    }

    public MvccSnapshot takeSnapshot() {
        return mvcc.takeSnapshot();
    }

    public DeltaMemStore getDeltaMemStore() {
        return dms;
    }
}
