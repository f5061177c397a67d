package com.questrail.spex.api;

/**
 * Indicates that a channel shift would move a response group outside the
 * channel range of its component.
 */
public final class ChannelOutOfRangeException extends SpexException
{
    public ChannelOutOfRangeException(String message) {
        super(message);
    }

    public ChannelOutOfRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
