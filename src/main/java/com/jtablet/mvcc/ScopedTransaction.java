package com.jtablet.mvcc;

import java.util.Objects;

/**
 * A transaction that is started on construction and committed on {@link #close()}.
 * Use it with try-with-resources so the commit happens on every exit path:
 *
 * <pre>{@code
 * try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
 *     deltaMemStore.update(tx.getTxId(), rowIdx, change);
 * }
 * }</pre>
 *
 * <p>The commit also happens when the body throws, so a failed write still
 * becomes visible to later snapshots.</p>
 */
public class ScopedTransaction implements AutoCloseable {
    private final MvccManager manager;
    private final TxId txId;
    private boolean committed;

    public ScopedTransaction(MvccManager manager) {
        this.manager = Objects.requireNonNull(manager, "manager cannot be null");
        this.txId = manager.startTransaction();
    }

    public TxId getTxId() {
        return txId;
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * Commits the transaction. Further calls do nothing.
     */
    public void commit() {
        if (committed) {
            return;
        }
        committed = true;
        manager.commitTransaction(txId);
    }

    @Override
    public void close() {
        commit();
    }
}
