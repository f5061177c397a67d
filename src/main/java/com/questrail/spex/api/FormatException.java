package com.questrail.spex.api;

/**
 * Indicates a malformed or missing table, column or header keyword in a
 * source or target file, or an I/O failure while reading or writing one.
 */
public final class FormatException extends SpexException
{
    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
