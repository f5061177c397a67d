package com.questrail.spex.api;

/**
 * Indicates that declared and actual table lengths disagree, or that a
 * freshly produced table fails its own consistency check. Never repaired
 * silently.
 */
public final class ArrayLengthMismatchException extends SpexException
{
    public ArrayLengthMismatchException(String message) {
        super(message);
    }

    public ArrayLengthMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
