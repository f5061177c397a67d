package com.questrail.spex.observability;

import com.questrail.spex.api.SectorRegion;

import java.time.Instant;

/**
 * Outcome of bad-channel removal for one region.
 */
public record ChannelCleaningEvent(
    Instant timestamp,
    SectorRegion region,
    int goodChannels,
    int badChannels,
    int droppedGroups,
    int droppedElements
) {
    public boolean changed() {
        return badChannels > 0 || droppedGroups > 0 || droppedElements > 0;
    }
}
