package com.questrail.spex.observability;

/**
 * No-op implementation of ConversionObservabilitySink.
 */
public final class NullObservabilitySink implements ConversionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStage(ConversionStageEvent event) {}

    @Override
    public void onWarning(ConversionWarningEvent event) {}

    @Override
    public void onChannelsCleaned(ChannelCleaningEvent event) {}

    @Override
    public void onError(ConversionErrorEvent event) {}
}
