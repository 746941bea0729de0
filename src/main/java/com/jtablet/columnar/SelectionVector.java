package com.jtablet.columnar;

import java.util.BitSet;
import java.util.Objects;

/**
 * One bit per row of a batch telling whether the row is still part of the
 * scan result. Rows start out selected; delta iterators clear the bit of rows
 * deleted in the reader's snapshot.
 */
public class SelectionVector {
    private final int nrows;
    private final BitSet bits;

    public SelectionVector(int nrows) {
        if (nrows < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + nrows);
        }
        this.nrows = nrows;
        this.bits = new BitSet(nrows);
        bits.set(0, nrows);
    }

    public int nrows() {
        return nrows;
    }

    public boolean isRowSelected(int row) {
        Objects.checkIndex(row, nrows);
        return bits.get(row);
    }

    public void setRowUnselected(int row) {
        Objects.checkIndex(row, nrows);
        bits.clear(row);
    }

    public void setAllTrue() {
        bits.set(0, nrows);
    }

    public int countSelected() {
        return bits.cardinality();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(nrows);
        for (int i = 0; i < nrows; i++) {
            sb.append(bits.get(i) ? '1' : '0');
        }
        return sb.toString();
    }
}
