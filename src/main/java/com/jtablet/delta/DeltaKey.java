package com.jtablet.delta;

import com.jtablet.mvcc.TxId;

import java.util.Objects;

/**
 * Orders deltas by row index, then by transaction id, so that all deltas of a
 * row are adjacent and in commit order.
 */
public final class DeltaKey implements Comparable<DeltaKey> {
    private final int rowIdx;
    private final TxId txId;

    public DeltaKey(int rowIdx, TxId txId) {
        this.rowIdx = rowIdx;
        this.txId = Objects.requireNonNull(txId, "txId cannot be null");
    }

    public int getRowIdx() {
        return rowIdx;
    }

    public TxId getTxId() {
        return txId;
    }

    @Override
    public int compareTo(DeltaKey other) {
        int cmp = Integer.compare(rowIdx, other.rowIdx);
        if (cmp != 0) {
            return cmp;
        }
        return txId.compareTo(other.txId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeltaKey that = (DeltaKey) o;
        return rowIdx == that.rowIdx && txId.equals(that.txId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowIdx, txId);
    }

    @Override
    public String toString() {
        return "(row " + rowIdx + ", " + txId + ")";
    }
}
