package com.questrail.spex.observability;

import java.time.Clock;
import java.time.Instant;

/**
 * Record representing a failed conversion.
 */
public record ConversionErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
    public static ConversionErrorEvent of(Clock clock, String message, Throwable cause) {
        return new ConversionErrorEvent(clock.instant(), message, cause);
    }
}
