package com.questrail.spex.api;

/**
 * Indicates a model energy bin whose upper bound does not exceed its lower
 * bound.
 */
public final class DiscontinuousEnergyGridException extends SpexException
{
    public DiscontinuousEnergyGridException(String message) {
        super(message);
    }

    public DiscontinuousEnergyGridException(String message, Throwable cause) {
        super(message, cause);
    }
}
