package com.jtablet.delta;

import com.jtablet.columnar.ColumnBlock;
import com.jtablet.columnar.SelectionVector;

import java.io.IOException;

/**
 * Applies deltas onto batches of base data, driven in lock-step with the
 * scanner that reads the base data.
 *
 * <p>Call order: {@link #init()} once, {@link #seekToOrdinal(int)}, then for each
 * batch one {@link #prepareBatch(int)} followed by any number of
 * {@link #applyUpdates(int, ColumnBlock)} and {@link #applyDeletes(SelectionVector)}
 * calls. Each {@code prepareBatch} moves past the rows of the previous batch.
 * Violating this order throws {@link IllegalStateException}.</p>
 *
 * <p>Once a method has thrown, the iterator must be discarded.</p>
 */
public interface DeltaIterator {
    /**
     * Prepares the iterator for use.
     *
     * @throws IOException If the underlying delta source cannot be opened
     */
    void init() throws IOException;

    /**
     * Positions the iterator so the next batch starts at the given row.
     *
     * @param rowIdx Row index the next batch starts at
     * @throws IOException If the underlying delta source cannot be read
     */
    void seekToOrdinal(int rowIdx) throws IOException;

    /**
     * Collects the visible deltas for the next {@code nrows} rows.
     *
     * @param nrows Number of rows in the batch
     * @throws com.jtablet.common.CorruptionException If a delta in the range cannot be decoded
     * @throws IOException If the underlying delta source cannot be read
     */
    void prepareBatch(int nrows) throws IOException;

    /**
     * Writes the prepared updates of one projected column into {@code dst}.
     * Cell {@code i} of {@code dst} is the {@code i}-th row of the batch.
     *
     * @param projectionColumnIdx Index of the column in the iterator's projection
     * @param dst Block holding the base values of the batch
     * @throws IOException If a copied value cannot be allocated
     */
    void applyUpdates(int projectionColumnIdx, ColumnBlock dst) throws IOException;

    /**
     * Unselects every row of the prepared batch that is deleted.
     *
     * @param selection Selection vector of the batch
     * @throws IOException If the underlying delta source cannot be read
     */
    void applyDeletes(SelectionVector selection) throws IOException;
}
