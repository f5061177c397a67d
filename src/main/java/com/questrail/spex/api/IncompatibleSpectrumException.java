package com.questrail.spex.api;

/**
 * Indicates that spectra cannot be combined or transformed together, e.g.
 * a background with a different channel count than its source spectrum.
 */
public final class IncompatibleSpectrumException extends SpexException
{
    public IncompatibleSpectrumException(String message) {
        super(message);
    }

    public IncompatibleSpectrumException(String message, Throwable cause) {
        super(message, cause);
    }
}
