package com.jtablet.delta;

import com.jtablet.common.CorruptionException;
import com.jtablet.common.memory.Arena;
import com.jtablet.common.memory.Slice;
import com.jtablet.common.schema.Schema;
import com.jtablet.mvcc.MvccSnapshot;
import com.jtablet.mvcc.TxId;
import com.jtablet.rowchange.RowChangeList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of the updates and deletes applied to a tablet segment's
 * immutable base data.
 *
 * <p>Every {@link #update} adds a new entry keyed by {@code (row, txId)}; entries
 * are never modified or removed, so older snapshots keep seeing the values they
 * saw. Encoded changes are copied into the store's arena, so callers may reuse
 * their buffers as soon as {@code update} returns.</p>
 *
 * <p>Writers and readers may run concurrently. An iterator sees every entry
 * inserted before it was positioned; entries inserted afterwards may or may not
 * be seen.</p>
 */
public class DeltaMemStore implements DeltaStore {
    private static final Logger LOG = LoggerFactory.getLogger(DeltaMemStore.class);

    private final Schema schema;
    private final Arena arena;
    private final ConcurrentSkipListMap<DeltaKey, RowChangeList> tree = new ConcurrentSkipListMap<>();
    private final AtomicLong count = new AtomicLong();

    public DeltaMemStore(Schema schema) {
        this(schema, DeltaStoreConfig.defaults());
    }

    public DeltaMemStore(Schema schema, DeltaStoreConfig config) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.arena = new Arena(config.getArenaInitialBlockSize(), config.getArenaMaxBlockSize(),
            config.getMemoryLimitBytes());
        LOG.debug("Created delta memstore for {}", schema);
    }

    /**
     * Records a change to a row made by the given transaction.
     *
     * @param txId Transaction making the change
     * @param rowIdx Index of the changed row in the base data
     * @param change Encoded change against this store's schema; it is not decoded
     *               here, so a malformed change only surfaces when a scan reaches it
     * @throws com.jtablet.common.memory.ArenaExhaustedException If the store's memory limit is reached
     * @throws IllegalStateException If the transaction already changed this row
     */
    public void update(TxId txId, int rowIdx, RowChangeList change) throws IOException {
        assert rowIdx >= 0 : "negative row index " + rowIdx;

        DeltaKey key = new DeltaKey(rowIdx, txId);
        // A rejected change must not take arena space. A concurrent insert of
        // the same key is still caught by putIfAbsent below.
        if (tree.containsKey(key)) {
            throw alreadyChanged(rowIdx, txId);
        }
        Slice copy = arena.allocateCopy(change.getSlice());
        if (tree.putIfAbsent(key, new RowChangeList(copy)) != null) {
            throw alreadyChanged(rowIdx, txId);
        }
        count.incrementAndGet();
    }

    @Override
    public DMSIterator newDeltaIterator(Schema projection, MvccSnapshot snapshot) {
        return new DMSIterator(this, projection, snapshot);
    }

    /**
     * Returns the number of delta entries, not the number of distinct rows.
     */
    public long count() {
        return count.get();
    }

    public boolean isEmpty() {
        return count.get() == 0;
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Returns the bytes held by this store's arena.
     */
    public long getMemoryFootprint() {
        return arena.getMemoryFootprint();
    }

    /**
     * Renders every entry in key order, one per line.
     */
    public String debugDump() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<DeltaKey, RowChangeList> entry : tree.entrySet()) {
            sb.append(entry.getKey()).append(": ");
            try {
                sb.append(entry.getValue().toString(schema));
            } catch (CorruptionException e) {
                sb.append("<corrupt: ").append(e.getMessage()).append('>');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static IllegalStateException alreadyChanged(int rowIdx, TxId txId) {
        return new IllegalStateException("Row " + rowIdx + " was already changed by " + txId);
    }

    /**
     * Returns the entries whose row index is at least {@code rowIdx}, in key order.
     */
    Iterator<Map.Entry<DeltaKey, RowChangeList>> entriesFrom(int rowIdx) {
        return tree.tailMap(new DeltaKey(rowIdx, TxId.MIN), true).entrySet().iterator();
    }
}
