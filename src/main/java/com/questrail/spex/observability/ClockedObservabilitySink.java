package com.questrail.spex.observability;

import java.time.Clock;
import java.util.Objects;

/**
 * Forwards every event to a delegate and stamps new events with a fixed
 * time source.
 */
public final class ClockedObservabilitySink implements ConversionObservabilitySink {
    private final ConversionObservabilitySink delegate;
    private final Clock clock;

    public ClockedObservabilitySink(ConversionObservabilitySink delegate, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onStage(ConversionStageEvent event) {
        delegate.onStage(event);
    }

    @Override
    public void onWarning(ConversionWarningEvent event) {
        delegate.onWarning(event);
    }

    @Override
    public void onChannelsCleaned(ChannelCleaningEvent event) {
        delegate.onChannelsCleaned(event);
    }

    @Override
    public void onError(ConversionErrorEvent event) {
        delegate.onError(event);
    }

    @Override
    public Clock clock() {
        return clock;
    }
}
