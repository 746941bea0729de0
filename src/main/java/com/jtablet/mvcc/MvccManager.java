package com.jtablet.mvcc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.TreeSet;

/**
 * Hands out transaction ids and tracks which of them are still in flight.
 *
 * <p>One manager belongs to one tablet segment and lives as long as it does.
 * Every transaction started here must be committed exactly once;
 * {@link ScopedTransaction} takes care of that. There is no abort: an id that
 * is never committed stays in flight forever and pins every later snapshot's
 * explicit committed-id list.</p>
 *
 * <p>Thread-safe. Starts, commits and snapshots may interleave arbitrarily.</p>
 */
public class MvccManager {
    private static final Logger LOG = LoggerFactory.getLogger(MvccManager.class);

    private final TreeSet<Long> inFlight = new TreeSet<>();
    private long nextTxId = 1;

    /**
     * Allocates the next transaction id and records it as in flight.
     */
    public synchronized TxId startTransaction() {
        if (nextTxId == Long.MAX_VALUE) {
            throw new IllegalStateException("Transaction ids exhausted");
        }
        long id = nextTxId++;
        inFlight.add(id);
        LOG.trace("Started transaction {}", id);
        return new TxId(id);
    }

    /**
     * Marks an in-flight transaction committed. Snapshots taken from now on see it.
     *
     * @throws IllegalStateException If the id is unknown or already committed
     */
    public synchronized void commitTransaction(TxId txId) {
        if (!inFlight.remove(txId.getValue())) {
            LOG.error("Attempted to commit {} which is not in flight", txId);
            throw new IllegalStateException("Trying to commit transaction " + txId
                + " which is not in flight (unknown or already committed)");
        }
        LOG.trace("Committed transaction {}", txId);
    }

    /**
     * Captures which transactions are committed right now.
     */
    public synchronized MvccSnapshot takeSnapshot() {
        if (inFlight.isEmpty()) {
            return new MvccSnapshot(nextTxId, nextTxId, new long[0]);
        }
        long oldestInFlight = inFlight.first();
        long[] committed = new long[(int) (nextTxId - oldestInFlight - inFlight.size())];
        int n = 0;
        for (long id = oldestInFlight + 1; id < nextTxId; id++) {
            if (!inFlight.contains(id)) {
                committed[n++] = id;
            }
        }
        return new MvccSnapshot(oldestInFlight, nextTxId, committed);
    }

    public synchronized int countTransactionsInFlight() {
        return inFlight.size();
    }
}
