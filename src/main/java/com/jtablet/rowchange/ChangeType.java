package com.jtablet.rowchange;

/**
 * Represents the kind of change a row change list carries. The value is the
 * header byte of the encoded list.
 */
public enum ChangeType {
    UPDATE(1),
    DELETE(2);

    private final int value;

    ChangeType(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static ChangeType fromValue(int value) {
        for (ChangeType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change type value: " + value);
    }
}
