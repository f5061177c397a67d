package com.questrail.spex.clean;

import com.questrail.spex.api.ArrayLengthMismatchException;
import com.questrail.spex.api.SectorRegion;
import com.questrail.spex.mapping.Masks;
import com.questrail.spex.model.Region;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.Spectrum.Flag;
import com.questrail.spex.model.Spectrum.Quantity;
import com.questrail.spex.observability.ChannelCleaningEvent;
import com.questrail.spex.observability.ConversionObservabilitySink;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * BadChannelCleaner
 * -----------------------------------------------------------------------------
 * Removes channels that carry no information from a {@link Region}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>a channel is kept when at least one group has a positive response
 *       value at it and the spectrum marks it used</li>
 *   <li>the kept channels of a group are renumbered contiguously: the new
 *       first channel is one plus the number of kept channels before it</li>
 *   <li>a group without kept channels is dropped</li>
 *   <li>response values of dropped channels are dropped</li>
 * </ul>
 * The spectrum loses the same channels; every component's channel count and
 * group count follow.
 */
public final class BadChannelCleaner
{
    private final ConversionObservabilitySink sink;

    public BadChannelCleaner(ConversionObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @throws ArrayLengthMismatchException if the region is not a single
     *         consistent region, or if the cleaned region fails its check
     */
    public Region clean(Region region) {
        Objects.requireNonNull(region, "region");
        Spectrum spo = region.spectrum();
        ResponseMatrix res = region.response();
        requireConsistent(spo, res);

        int nchan = spo.channelCount();
        int[] ic1 = res.firstChannels();
        int[] ic2 = res.lastChannels();
        int[] nc = res.groupChannelCounts();
        double[] values = res.values();
        int nGroup = nc.length;

        // Channels with a positive response anywhere
        BitSet keep = new BitSet(nchan);
        int ir = 0;
        for (int g = 0; g < nGroup; g++) {
            for (int j = 0; j < nc[g]; j++) {
                int ic = ic1[g] + j - 1;
                if (ic < 0 || ic >= nchan || ic1[g] + j > ic2[g]) {
                    throw new ArrayLengthMismatchException("Group " + (g + 1) + " addresses channel "
                            + (ic + 1) + " outside 1.." + nchan);
                }
                if (values[ir] > 0.0) {
                    keep.set(ic);
                }
                ir++;
            }
        }
        keep.and(Masks.of(spo.used()));

        // Cumulative count of kept channels before each channel
        int[] keptBefore = new int[nchan + 1];
        for (int c = 0; c < nchan; c++) {
            keptBefore[c + 1] = keptBefore[c] + (keep.get(c) ? 1 : 0);
        }

        BitSet groupMask = new BitSet(nGroup);
        BitSet valueMask = new BitSet(values.length);
        int[] newFirst = new int[nGroup];
        int[] newLast = new int[nGroup];
        int[] newCount = new int[nGroup];
        ir = 0;
        for (int g = 0; g < nGroup; g++) {
            int kept = 0;
            for (int j = 0; j < nc[g]; j++) {
                int ic = ic1[g] + j - 1;
                if (keep.get(ic)) {
                    if (kept == 0) {
                        newFirst[g] = keptBefore[ic] + 1;
                    }
                    kept++;
                    valueMask.set(ir);
                }
                ir++;
            }
            if (kept > 0) {
                groupMask.set(g);
                newLast[g] = newFirst[g] + kept - 1;
                newCount[g] = kept;
            }
        }

        int good = keep.cardinality();
        int[] groupOffsets = res.componentGroupOffsets();
        int[] componentChannels = new int[res.componentCount()];
        int[] componentGroups = new int[res.componentCount()];
        for (int k = 0; k < componentGroups.length; k++) {
            componentChannels[k] = good;
            componentGroups[k] = groupMask.get(groupOffsets[k], groupOffsets[k + 1]).cardinality();
        }

        ResponseMatrix.Builder rb = res.toBuilder()
                .components(componentChannels, componentGroups, res.sectors(), res.regions())
                .groups(Masks.select(res.lowEnergies(), groupMask),
                        Masks.select(res.highEnergies(), groupMask),
                        Masks.select(newFirst, groupMask),
                        Masks.select(newLast, groupMask),
                        Masks.select(newCount, groupMask))
                .values(Masks.select(values, valueMask));
        if (res.hasAreaScaling()) {
            rb.relativeAreas(Masks.select(res.relativeAreas(), groupMask));
        }
        if (res.hasResponseDerivative()) {
            rb.derivatives(Masks.select(res.derivatives(), valueMask));
        }
        ResponseMatrix cleanedResponse = rb.build();

        Spectrum.Builder sb = Spectrum.builder()
                .channelsPerRegion(new int[] { good })
                .backscaleRatioPresent(spo.backscaleRatioPresent());
        for (Quantity q : Quantity.values()) {
            sb.set(q, Masks.select(spo.values(q), keep));
        }
        for (Flag f : Flag.values()) {
            sb.set(f, Masks.select(spo.flags(f), keep));
        }
        Spectrum cleanedSpectrum = sb.build();

        Region cleaned = new Region(cleanedSpectrum, cleanedResponse, region.label());
        cleaned.check().orThrow("Cleaned region");

        List<SectorRegion> keys = res.regionKeys();
        sink.onChannelsCleaned(new ChannelCleaningEvent(
                sink.clock().instant(),
                keys.isEmpty() ? SectorRegion.of(1, 1) : keys.get(0),
                good,
                nchan - good,
                nGroup - groupMask.cardinality(),
                values.length - valueMask.cardinality()));
        return cleaned;
    }

    private static void requireConsistent(Spectrum spo, ResponseMatrix res) {
        if (spo.regionCount() != 1) {
            throw new ArrayLengthMismatchException("Bad channels can only be removed from a single region, found "
                    + spo.regionCount());
        }
        if (Masks.sum(res.groupChannelCounts()) != res.valueCount()) {
            throw new ArrayLengthMismatchException("Mismatch between the number of response elements in the"
                    + " group and response tables");
        }
        if (Masks.sum(res.componentGroupCounts()) != res.groupCount()) {
            throw new ArrayLengthMismatchException("Mismatch between the number of groups in the component"
                    + " and group tables");
        }
        int nchan = spo.channelCount();
        for (int n : res.componentChannelCounts()) {
            if (n != nchan) {
                throw new ArrayLengthMismatchException("Mismatch in number of channels between response ("
                        + n + ") and spectrum (" + nchan + ")");
            }
        }
    }
}
