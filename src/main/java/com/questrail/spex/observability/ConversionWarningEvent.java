package com.questrail.spex.observability;

import java.time.Clock;
import java.time.Instant;

/**
 * Record representing a recoverable anomaly in the input data.
 */
public record ConversionWarningEvent(
    Instant timestamp,
    String message
) {
    public static ConversionWarningEvent of(Clock clock, String message) {
        return new ConversionWarningEvent(clock.instant(), message);
    }
}
