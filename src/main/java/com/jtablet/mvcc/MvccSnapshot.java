package com.jtablet.mvcc;

import java.util.Arrays;

/**
 * An immutable answer to "was this transaction committed?" captured at one
 * point in time.
 *
 * <p>A transaction {@code T} is committed in the snapshot iff
 * {@code T < allCommittedBefore}, or {@code T < noneCommittedAtOrAfter} and
 * {@code T} is one of the explicitly listed ids. When no transaction was in
 * flight at capture time the two bounds are equal and the list is empty.</p>
 */
public final class MvccSnapshot {
    private static final MvccSnapshot ALL = new MvccSnapshot(Long.MAX_VALUE, Long.MAX_VALUE, new long[0]);
    private static final MvccSnapshot NONE = new MvccSnapshot(0, 0, new long[0]);

    private final long allCommittedBefore;
    private final long noneCommittedAtOrAfter;
    // Sorted ascending, each in [allCommittedBefore, noneCommittedAtOrAfter).
    private final long[] committedTxIds;

    MvccSnapshot(long allCommittedBefore, long noneCommittedAtOrAfter, long[] committedTxIds) {
        this.allCommittedBefore = allCommittedBefore;
        this.noneCommittedAtOrAfter = noneCommittedAtOrAfter;
        this.committedTxIds = committedTxIds;
    }

    /**
     * Returns a snapshot in which every transaction is committed.
     */
    public static MvccSnapshot includingAllTransactions() {
        return ALL;
    }

    /**
     * Returns a snapshot in which no transaction is committed.
     */
    public static MvccSnapshot includingNoTransactions() {
        return NONE;
    }

    public boolean isCommitted(TxId txId) {
        long id = txId.getValue();
        if (id < allCommittedBefore) {
            return true;
        }
        if (id >= noneCommittedAtOrAfter) {
            return false;
        }
        return Arrays.binarySearch(committedTxIds, id) >= 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MvccSnapshot[committed={T|T < ").append(allCommittedBefore);
        if (committedTxIds.length > 0) {
            sb.append(" or (T in {");
            for (int i = 0; i < committedTxIds.length; i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(committedTxIds[i]);
            }
            sb.append("})");
        }
        return sb.append("}]").toString();
    }
}
