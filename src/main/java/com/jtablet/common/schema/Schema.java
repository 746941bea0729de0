package com.jtablet.common.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents the schema of a tablet: an ordered list of columns, the first
 * {@code numKeyColumns} of which form the primary key.
 * Schemas are immutable and shared freely between writers and readers.
 */
public class Schema {
    private final List<ColumnSchema> columns;
    private final int numKeyColumns;
    private final int byteSize;

    public Schema(List<ColumnSchema> columns, int numKeyColumns) {
        Objects.requireNonNull(columns, "columns cannot be null");
        if (numKeyColumns < 0 || numKeyColumns > columns.size()) {
            throw new IllegalArgumentException("Bad number of key columns " + numKeyColumns
                + " for " + columns.size() + " columns");
        }
        for (int i = 0; i < columns.size(); i++) {
            for (int j = 0; j < i; j++) {
                if (columns.get(i).getName().equals(columns.get(j).getName())) {
                    throw new IllegalArgumentException("Column '" + columns.get(i).getName()
                        + "' already exists in the schema");
                }
            }
        }
        this.columns = new ArrayList<>(columns);
        this.numKeyColumns = numKeyColumns;
        this.byteSize = columns.stream().mapToInt(c -> c.getType().getSlotSize()).sum();
    }

    public List<ColumnSchema> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public ColumnSchema getColumn(int index) {
        if (index < 0 || index >= columns.size()) {
            throw new IllegalArgumentException("Column index " + index + " out of range for "
                + columns.size() + " columns");
        }
        return columns.get(index);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getNumKeyColumns() {
        return numKeyColumns;
    }

    /**
     * Returns the width of one row in a row-major layout.
     */
    public int getByteSize() {
        return byteSize;
    }

    /**
     * Finds a column by name.
     *
     * @param name The column name
     * @return The column index, or -1 if there is no such column
     */
    public int findColumn(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public int getColumnIndex(String name) {
        int idx = findColumn(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Column '" + name + "' does not exist");
        }
        return idx;
    }

    /**
     * Builds a schema made of the named columns of this one, with no key columns.
     */
    public Schema project(String... columnNames) {
        List<ColumnSchema> projected = new ArrayList<>();
        for (String name : columnNames) {
            projected.add(columns.get(getColumnIndex(name)));
        }
        return new Schema(projected, 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Schema [");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(columns.get(i));
            if (i < numKeyColumns) {
                sb.append(" (key)");
            }
        }
        sb.append("]");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema that = (Schema) o;
        return numKeyColumns == that.numKeyColumns && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, numKeyColumns);
    }

    /**
     * Builder class for creating Schema instances.
     */
    public static class Builder {
        private final List<ColumnSchema> columns = new ArrayList<>();
        private int numKeyColumns;

        public Builder addKeyColumn(String name, Type type) {
            if (numKeyColumns != columns.size()) {
                throw new IllegalStateException("Key columns must precede all other columns");
            }
            columns.add(new ColumnSchema(name, type));
            numKeyColumns++;
            return this;
        }

        public Builder addColumn(String name, Type type) {
            columns.add(new ColumnSchema(name, type));
            return this;
        }

        public Schema build() {
            return new Schema(columns, numKeyColumns);
        }
    }
}
