package com.questrail.spex.observability;

import java.time.Clock;
import java.time.Instant;

/**
 * A named processing stage ("Read source spectrum", "Convert response", ...)
 * and its outcome.
 */
public record ConversionStageEvent(
    Instant timestamp,
    String stage,
    Outcome outcome
) {
    public enum Outcome { STARTED, COMPLETED }

    public static ConversionStageEvent started(Clock clock, String stage) {
        return new ConversionStageEvent(clock.instant(), stage, Outcome.STARTED);
    }

    public static ConversionStageEvent completed(Clock clock, String stage) {
        return new ConversionStageEvent(clock.instant(), stage, Outcome.COMPLETED);
    }
}
