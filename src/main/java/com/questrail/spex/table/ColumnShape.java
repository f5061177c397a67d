package com.questrail.spex.table;

/**
 * How many elements each row of a {@link Column} holds.
 */
public enum ColumnShape
{
    /** One element per row. */
    SCALAR,
    /** The same number of elements in every row. */
    FIXED,
    /** A per-row element count (heap-stored in FITS). */
    VARIABLE
}
