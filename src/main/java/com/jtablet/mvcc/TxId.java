package com.jtablet.mvcc;

/**
 * Identifies a write transaction. Ids are handed out by {@link MvccManager} in
 * increasing order and define commit order, not wall-clock time.
 */
public final class TxId implements Comparable<TxId> {
    /** Smaller than every id the manager hands out. */
    public static final TxId MIN = new TxId(0);

    /** Larger than every id the manager hands out. */
    public static final TxId MAX = new TxId(Long.MAX_VALUE);

    private final long value;

    public TxId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Transaction id must not be negative: " + value);
        }
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(TxId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((TxId) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "tx" + value;
    }
}
