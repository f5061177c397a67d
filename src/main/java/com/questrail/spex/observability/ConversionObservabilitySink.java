package com.questrail.spex.observability;

import java.time.Clock;

/**
 * Receives the non-fatal events of a conversion.
 * Implementations can provide logging or collect events for inspection.
 */
public interface ConversionObservabilitySink {
    /**
     * Called when a processing stage starts or completes.
     * @param event the stage event
     */
    void onStage(ConversionStageEvent event);

    /**
     * Called for a recoverable condition; processing continues.
     * @param event the warning details
     */
    void onWarning(ConversionWarningEvent event);

    /**
     * Called when bad channels were removed from a region.
     * @param event counts of kept and removed channels, groups and elements
     */
    void onChannelsCleaned(ChannelCleaningEvent event);

    /**
     * Called when a conversion fails, before the exception propagates.
     * @param event the error event
     */
    void onError(ConversionErrorEvent event);

    /**
     * Time source for the events sent to this sink.
     */
    default Clock clock() {
        return Clock.systemUTC();
    }
}
