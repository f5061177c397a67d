package com.questrail.spex.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConversionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConversionObservabilitySink implements ConversionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConversionObservabilitySink.class);

    @Override
    public void onStage(ConversionStageEvent event) {
        if (event.outcome() == ConversionStageEvent.Outcome.STARTED) {
            log.debug("{} ...", event.stage());
        } else {
            log.info("{} ... OK", event.stage());
        }
    }

    @Override
    public void onWarning(ConversionWarningEvent event) {
        log.warn("{}", event.message());
    }

    @Override
    public void onChannelsCleaned(ChannelCleaningEvent event) {
        if (!event.changed()) {
            log.info("Region {}: no bad channels found", event.region());
            return;
        }
        log.info("Region {}: {} good channels, {} bad channels removed",
            event.region(), event.goodChannels(), event.badChannels());
        log.info("Region {}: {} response groups and {} response elements removed",
            event.region(), event.droppedGroups(), event.droppedElements());
    }

    @Override
    public void onError(ConversionErrorEvent event) {
        log.error("Conversion failed: {}", event.message(), event.cause());
    }
}
