package com.questrail.spex.api;

/**
 * Indicates that two response matrices (or a matrix and an effective-area
 * curve) cannot be combined, e.g. because their capability flags differ.
 */
public final class IncompatibleMatrixException extends SpexException
{
    public IncompatibleMatrixException(String message) {
        super(message);
    }

    public IncompatibleMatrixException(String message, Throwable cause) {
        super(message, cause);
    }
}
