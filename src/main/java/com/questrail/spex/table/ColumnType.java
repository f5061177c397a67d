package com.questrail.spex.table;

/**
 * Element types a {@link Column} can carry.
 *
 * <p>The single-letter codes are the binary table TFORM codes; they are
 * kept here so that both the in-memory and the FITS store agree on the
 * declared type of a column.</p>
 */
public enum ColumnType
{
    LOGICAL('L'),
    BYTE('B'),
    SHORT('I'),
    INT('J'),
    LONG('K'),
    FLOAT('E'),
    DOUBLE('D'),
    STRING('A');

    private final char code;

    ColumnType(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public boolean isInteger() {
        return this == BYTE || this == SHORT || this == INT || this == LONG;
    }

    public boolean isFloating() {
        return this == FLOAT || this == DOUBLE;
    }

    /**
     * Resolves a TFORM type letter.
     *
     * @throws IllegalArgumentException for letters without a column type here
     */
    public static ColumnType fromCode(char code) {
        for (ColumnType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported column type code: " + code);
    }
}
