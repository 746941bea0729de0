package com.jtablet.common.schema;

import java.util.Objects;

/**
 * Represents a single column of a tablet schema.
 */
public class ColumnSchema {
    private final String name;
    private final Type type;

    public ColumnSchema(String name, Type type) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    /**
     * Renders a cell value of this column for debug output.
     */
    public String stringifyCell(Object value) {
        if (type == Type.STRING) {
            return "\"" + value + "\"";
        }
        if (type == Type.BINARY) {
            StringBuilder sb = new StringBuilder("0x");
            for (byte b : (byte[]) value) {
                sb.append(String.format("%02x", b & 0xFF));
            }
            return sb.toString();
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnSchema that = (ColumnSchema) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + "[" + type.toString().toLowerCase() + "]";
    }
}
