package com.questrail.spex.model;

import java.util.BitSet;
import java.util.Objects;

/**
 * Row selection of one region inside a {@link Spectrum}.
 *
 * @param regions  rows of the per-region channel count table
 * @param channels rows of the per-channel arrays
 */
public record SpectrumMasks(BitSet regions, BitSet channels)
{
    public SpectrumMasks {
        Objects.requireNonNull(regions, "regions");
        Objects.requireNonNull(channels, "channels");
        regions = (BitSet) regions.clone();
        channels = (BitSet) channels.clone();
    }

    @Override
    public BitSet regions() {
        return (BitSet) regions.clone();
    }

    @Override
    public BitSet channels() {
        return (BitSet) channels.clone();
    }
}
