package com.questrail.spex.model;

import com.questrail.spex.api.ArrayLengthMismatchException;
import com.questrail.spex.api.CheckResult;
import com.questrail.spex.api.IncompatibleSpectrumException;
import com.questrail.spex.api.RegionNotFoundException;
import com.questrail.spex.mapping.Masks;

import java.util.BitSet;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Spectrum
 * -----------------------------------------------------------------------------
 * Flat, multi-region spectrum in the SPEX layout.
 *
 * <p>Every per-channel array holds the channels of all regions back to back,
 * in region order. {@link #channelsPerRegion()} defines where one region ends
 * and the next begins. Regions are numbered from 1 by position.</p>
 *
 * <h2>Invariant</h2>
 * {@code sum(channelsPerRegion) == length of every per-channel array}. The
 * invariant is verified by {@link #check()} rather than enforced on
 * construction so that a reader can report an inconsistent file instead of
 * failing half-way.
 *
 * <h2>Immutability</h2>
 * Every operation returns a new instance. Array accessors return copies.
 */
public final class Spectrum
{
    /**
     * Per-channel numeric arrays.
     */
    public enum Quantity
    {
        /** Lower channel energy (keV). */
        LOWER_ENERGY,
        /** Upper channel energy (keV). */
        UPPER_ENERGY,
        /** Exposure time (s). */
        EXPOSURE_TIME,
        /** Background-subtracted source rate (c/s). */
        SOURCE_RATE,
        SOURCE_RATE_ERROR,
        /** Subtracted background rate (c/s). */
        BACKGROUND_RATE,
        BACKGROUND_RATE_ERROR,
        /** Background exposure times backscale over source exposure times backscale. */
        BACKSCALE_RATIO,
        SOURCE_SYSTEMATIC,
        BACKGROUND_SYSTEMATIC
    }

    /**
     * Per-channel boolean arrays.
     */
    public enum Flag
    {
        USED,
        FIRST_OF_BIN,
        LAST_OF_BIN
    }

    private static final Spectrum EMPTY = builder().build();

    private final int[] channelsPerRegion;
    private final Map<Quantity, double[]> quantities;
    private final Map<Flag, boolean[]> flags;
    private final boolean backscaleRatioPresent;

    private Spectrum(int[] channelsPerRegion,
                     Map<Quantity, double[]> quantities,
                     Map<Flag, boolean[]> flags,
                     boolean backscaleRatioPresent) {
        this.channelsPerRegion = channelsPerRegion;
        this.quantities = quantities;
        this.flags = flags;
        this.backscaleRatioPresent = backscaleRatioPresent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.channelsPerRegion = channelsPerRegion.clone();
        quantities.forEach((q, v) -> b.quantities.put(q, v.clone()));
        flags.forEach((f, v) -> b.flags.put(f, v.clone()));
        b.backscaleRatioPresent = backscaleRatioPresent;
        return b;
    }

    public static Spectrum empty() {
        return EMPTY;
    }

    /**
     * Single-region spectrum of {@code channelCount} channels with every
     * numeric value zero and every flag set.
     */
    public static Spectrum zeroed(int channelCount) {
        if (channelCount < 0) {
            throw new IllegalArgumentException("channelCount must be >= 0");
        }
        Builder b = builder().channelsPerRegion(new int[] { channelCount });
        for (Quantity q : Quantity.values()) {
            b.set(q, new double[channelCount]);
        }
        for (Flag f : Flag.values()) {
            b.set(f, Masks.filled(channelCount, true));
        }
        return b.build();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public boolean isEmpty() {
        return channelsPerRegion.length == 0;
    }

    public int regionCount() {
        return channelsPerRegion.length;
    }

    public int[] channelsPerRegion() {
        return channelsPerRegion.clone();
    }

    /**
     * Total number of channels over all regions.
     */
    public int channelCount() {
        return Masks.sum(channelsPerRegion);
    }

    /**
     * Number of channels of region {@code region} (1-based).
     */
    public int channelCount(int region) {
        requireRegion(region);
        return channelsPerRegion[region - 1];
    }

    public boolean backscaleRatioPresent() {
        return backscaleRatioPresent;
    }

    public double[] values(Quantity quantity) {
        return quantities.get(quantity).clone();
    }

    public boolean[] flags(Flag flag) {
        return flags.get(flag).clone();
    }

    public double[] lowerEnergy() {
        return values(Quantity.LOWER_ENERGY);
    }

    public double[] upperEnergy() {
        return values(Quantity.UPPER_ENERGY);
    }

    public double[] exposureTime() {
        return values(Quantity.EXPOSURE_TIME);
    }

    public double[] sourceRate() {
        return values(Quantity.SOURCE_RATE);
    }

    public double[] sourceRateError() {
        return values(Quantity.SOURCE_RATE_ERROR);
    }

    public double[] backgroundRate() {
        return values(Quantity.BACKGROUND_RATE);
    }

    public double[] backgroundRateError() {
        return values(Quantity.BACKGROUND_RATE_ERROR);
    }

    public double[] backscaleRatio() {
        return values(Quantity.BACKSCALE_RATIO);
    }

    public double[] sourceSystematic() {
        return values(Quantity.SOURCE_SYSTEMATIC);
    }

    public double[] backgroundSystematic() {
        return values(Quantity.BACKGROUND_SYSTEMATIC);
    }

    public boolean[] used() {
        return flags(Flag.USED);
    }

    public boolean[] firstOfBin() {
        return flags(Flag.FIRST_OF_BIN);
    }

    public boolean[] lastOfBin() {
        return flags(Flag.LAST_OF_BIN);
    }

    // ---------------------------------------------------------------------
    // Region operations
    // ---------------------------------------------------------------------

    /**
     * Masks selecting region {@code region} (1-based position).
     *
     * <p>The channel slice starts at the sum of the channel counts of the
     * preceding regions.</p>
     *
     * @throws RegionNotFoundException if the region does not exist
     */
    public SpectrumMasks regionMask(int region) {
        requireRegion(region);
        int first = Masks.sum(channelsPerRegion, 0, region - 1);
        int last = first + channelsPerRegion[region - 1];
        BitSet regions = new BitSet(channelsPerRegion.length);
        regions.set(region - 1);
        return new SpectrumMasks(regions, Masks.range(first, last));
    }

    /**
     * Single-region spectrum holding region {@code region}.
     *
     * @throws ArrayLengthMismatchException if the extracted spectrum fails {@link #check()}
     */
    public Spectrum extractRegion(int region) {
        SpectrumMasks masks = regionMask(region);
        Spectrum extracted = select(masks.regions(), masks.channels());
        extracted.check().orThrow("Extracted spectrum region " + region);
        return extracted;
    }

    /**
     * Appends region {@code region} of {@code other} as a new last region.
     *
     * <p>An empty spectrum adopts the {@code Exp_Rate} presence flag of
     * {@code other}; otherwise the column is present if either side had it.</p>
     */
    public Spectrum concatenate(Spectrum other, int region) {
        Objects.requireNonNull(other, "other");
        SpectrumMasks masks = other.regionMask(region);
        Spectrum slice = other.select(masks.regions(), masks.channels());

        Builder b = builder()
                .channelsPerRegion(Masks.concat(channelsPerRegion, slice.channelsPerRegion))
                .backscaleRatioPresent(isEmpty()
                        ? other.backscaleRatioPresent
                        : backscaleRatioPresent || other.backscaleRatioPresent);
        for (Quantity q : Quantity.values()) {
            b.quantities.put(q, Masks.concat(quantities.get(q), slice.quantities.get(q)));
        }
        for (Flag f : Flag.values()) {
            b.flags.put(f, Masks.concat(flags.get(f), slice.flags.get(f)));
        }
        return b.build();
    }

    /**
     * Removes region {@code region}; later regions move down one position.
     */
    public Spectrum deleteRegion(int region) {
        SpectrumMasks masks = regionMask(region);
        return select(Masks.complement(masks.regions(), channelsPerRegion.length),
                Masks.complement(masks.channels(), channelCount()));
    }

    /**
     * Reverses every per-channel array. Used for instruments that store
     * channels in wavelength order.
     *
     * @throws IncompatibleSpectrumException for multi-region spectra
     */
    public Spectrum swapChannelOrder() {
        if (channelsPerRegion.length != 1) {
            throw new IncompatibleSpectrumException(
                    "Channel order can only be swapped for a single region, found " + channelsPerRegion.length);
        }
        Builder b = builder()
                .channelsPerRegion(channelsPerRegion.clone())
                .backscaleRatioPresent(backscaleRatioPresent);
        quantities.forEach((q, v) -> b.quantities.put(q, Masks.reversed(v)));
        flags.forEach((f, v) -> b.flags.put(f, Masks.reversed(v)));
        return b.build();
    }

    /**
     * Verifies array lengths, positive bin widths, finite rates and errors,
     * and the sign of lower energies, errors, systematics and exposure
     * times. Never throws.
     */
    public CheckResult check() {
        int total = channelCount();
        for (Quantity q : Quantity.values()) {
            if (quantities.get(q).length != total) {
                return CheckResult.failed(q + " array length " + quantities.get(q).length
                        + " is not consistent with the channel count " + total);
            }
        }
        for (Flag f : Flag.values()) {
            if (flags.get(f).length != total) {
                return CheckResult.failed(f + " array length " + flags.get(f).length
                        + " is not consistent with the channel count " + total);
            }
        }

        double[] lo = quantities.get(Quantity.LOWER_ENERGY);
        double[] hi = quantities.get(Quantity.UPPER_ENERGY);
        double[] rate = quantities.get(Quantity.SOURCE_RATE);
        double[] err = quantities.get(Quantity.SOURCE_RATE_ERROR);
        double[] bRate = quantities.get(Quantity.BACKGROUND_RATE);
        double[] bErr = quantities.get(Quantity.BACKGROUND_RATE_ERROR);
        double[] ssys = quantities.get(Quantity.SOURCE_SYSTEMATIC);
        double[] bsys = quantities.get(Quantity.BACKGROUND_SYSTEMATIC);
        double[] tints = quantities.get(Quantity.EXPOSURE_TIME);
        int offset = 0;
        for (int r = 0; r < channelsPerRegion.length; r++) {
            for (int c = 0; c < channelsPerRegion[r]; c++) {
                int i = offset + c;
                String where = "Bin " + (c + 1) + " in spectrum region " + (r + 1);
                if (hi[i] <= lo[i]) {
                    return CheckResult.failed(where + " does not have a positive width");
                }
                if (lo[i] < 0.0) {
                    return CheckResult.failed(where + " has a negative lower limit");
                }
                if (!Double.isFinite(rate[i]) || !Double.isFinite(bRate[i])) {
                    return CheckResult.failed(where + " has a rate that is not a finite number");
                }
                if (!Double.isFinite(err[i]) || !Double.isFinite(bErr[i])) {
                    return CheckResult.failed(where + " has an error that is not a finite number");
                }
                if (err[i] < 0.0) {
                    return CheckResult.failed(where + " has a negative error");
                }
                if (ssys[i] < 0.0) {
                    return CheckResult.failed(where + " has a negative systematic error");
                }
                if (bsys[i] < 0.0) {
                    return CheckResult.failed(where + " has a negative background systematic error");
                }
                if (tints[i] < 0.0) {
                    return CheckResult.failed(where + " has a negative exposure time");
                }
            }
            offset += channelsPerRegion[r];
        }
        return CheckResult.passed();
    }

    private Spectrum select(BitSet regionRows, BitSet channelRows) {
        Builder b = builder()
                .channelsPerRegion(Masks.select(channelsPerRegion, regionRows))
                .backscaleRatioPresent(backscaleRatioPresent);
        quantities.forEach((q, v) -> b.quantities.put(q, Masks.select(v, channelRows)));
        flags.forEach((f, v) -> b.flags.put(f, Masks.select(v, channelRows)));
        return b.build();
    }

    private void requireRegion(int region) {
        if (region < 1 || region > channelsPerRegion.length) {
            throw new RegionNotFoundException(region);
        }
    }

    @Override
    public String toString() {
        return "Spectrum[regions=" + channelsPerRegion.length + ", channels=" + channelCount() + "]";
    }

    /**
     * Builder for {@link Spectrum}. Arrays are copied; missing arrays default
     * to empty.
     */
    public static final class Builder {
        private int[] channelsPerRegion = new int[0];
        private final Map<Quantity, double[]> quantities = new EnumMap<>(Quantity.class);
        private final Map<Flag, boolean[]> flags = new EnumMap<>(Flag.class);
        private boolean backscaleRatioPresent;

        private Builder() {}

        public Builder channelsPerRegion(int[] channelsPerRegion) {
            this.channelsPerRegion = channelsPerRegion.clone();
            return this;
        }

        public Builder set(Quantity quantity, double[] values) {
            quantities.put(Objects.requireNonNull(quantity, "quantity"), values.clone());
            return this;
        }

        public Builder set(Flag flag, boolean[] values) {
            flags.put(Objects.requireNonNull(flag, "flag"), values.clone());
            return this;
        }

        public Builder backscaleRatioPresent(boolean present) {
            this.backscaleRatioPresent = present;
            return this;
        }

        public Spectrum build() {
            Map<Quantity, double[]> q = new EnumMap<>(Quantity.class);
            for (Quantity quantity : Quantity.values()) {
                q.put(quantity, quantities.getOrDefault(quantity, new double[0]).clone());
            }
            Map<Flag, boolean[]> f = new EnumMap<>(Flag.class);
            for (Flag flag : Flag.values()) {
                f.put(flag, flags.getOrDefault(flag, new boolean[0]).clone());
            }
            return new Spectrum(channelsPerRegion.clone(), q, f, backscaleRatioPresent);
        }
    }
}
