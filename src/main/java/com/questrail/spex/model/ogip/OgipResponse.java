package com.questrail.spex.model.ogip;

import com.questrail.spex.api.CheckResult;
import com.questrail.spex.mapping.Masks;

import java.util.Objects;

/**
 * OgipResponse
 * -----------------------------------------------------------------------------
 * Redistribution matrix as read from an OGIP RMF or RSP file.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>channel bounds from {@code EBOUNDS}: one entry per detector channel</li>
 *   <li>model energy bins from the matrix table: bounds and a group count per bin</li>
 *   <li>groups flattened over all bins in bin order: first channel
 *       ({@code F_CHAN}) and channel count ({@code N_CHAN})</li>
 *   <li>matrix elements flattened over all groups in group order</li>
 * </ul>
 */
public final class OgipResponse
{
    private final int[] channels;
    private final double[] channelLowEnergy;
    private final double[] channelHighEnergy;
    private final double[] lowEnergy;
    private final double[] highEnergy;
    private final int[] groupsPerBin;
    private final int[] groupFirstChannel;
    private final int[] groupChannelCount;
    private final double[] matrix;
    private final String energyUnit;
    private final int order;
    private final boolean areaIncluded;

    private OgipResponse(Builder b) {
        this.channels = b.channels.clone();
        this.channelLowEnergy = b.channelLowEnergy.clone();
        this.channelHighEnergy = b.channelHighEnergy.clone();
        this.lowEnergy = b.lowEnergy.clone();
        this.highEnergy = b.highEnergy.clone();
        this.groupsPerBin = b.groupsPerBin.clone();
        this.groupFirstChannel = b.groupFirstChannel.clone();
        this.groupChannelCount = b.groupChannelCount.clone();
        this.matrix = b.matrix.clone();
        this.energyUnit = b.energyUnit;
        this.order = b.order;
        this.areaIncluded = b.areaIncluded;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int channelCount() {
        return channels.length;
    }

    /**
     * First channel number listed in {@code EBOUNDS}, 0 or 1 in practice.
     */
    public int firstChannel() {
        return channels.length == 0 ? 0 : channels[0];
    }

    public int energyBinCount() {
        return lowEnergy.length;
    }

    public int totalGroups() {
        return groupFirstChannel.length;
    }

    public int totalElements() {
        return matrix.length;
    }

    public int[] channels() {
        return channels.clone();
    }

    public double[] channelLowEnergy() {
        return channelLowEnergy.clone();
    }

    public double[] channelHighEnergy() {
        return channelHighEnergy.clone();
    }

    public double[] lowEnergy() {
        return lowEnergy.clone();
    }

    public double[] highEnergy() {
        return highEnergy.clone();
    }

    public int[] groupsPerBin() {
        return groupsPerBin.clone();
    }

    public int[] groupFirstChannel() {
        return groupFirstChannel.clone();
    }

    public int[] groupChannelCount() {
        return groupChannelCount.clone();
    }

    public double[] matrix() {
        return matrix.clone();
    }

    /** Unit of the energy columns, {@code keV} expected. */
    public String energyUnit() {
        return energyUnit;
    }

    /** Grating order (ORDER keyword), 0 when absent. */
    public int order() {
        return order;
    }

    /** True for a {@code SPECRESP MATRIX} that already includes the effective area. */
    public boolean areaIncluded() {
        return areaIncluded;
    }

    public CheckResult check() {
        if (channels.length == 0) {
            return CheckResult.failed("Number of channels in response is zero");
        }
        if (channelLowEnergy.length != channels.length || channelHighEnergy.length != channels.length) {
            return CheckResult.failed("EBOUNDS columns differ in length");
        }
        if (lowEnergy.length == 0) {
            return CheckResult.failed("Number of energy bins in response is zero");
        }
        if (highEnergy.length != lowEnergy.length || groupsPerBin.length != lowEnergy.length) {
            return CheckResult.failed("Matrix energy columns differ in length");
        }
        if (Masks.sum(groupsPerBin) != groupFirstChannel.length || groupChannelCount.length != groupFirstChannel.length) {
            return CheckResult.failed("Group index arrays do not match the number of groups per energy bin");
        }
        if (Masks.sum(groupChannelCount) != matrix.length) {
            return CheckResult.failed("Matrix size " + matrix.length
                    + " does not correspond to index arrays (" + Masks.sum(groupChannelCount) + ")");
        }
        return CheckResult.passed();
    }

    /**
     * An effective-area curve matches when it has the same number of energy
     * bins and the same first and last upper bin boundary.
     */
    public CheckResult checkCompatible(OgipEffectiveArea area) {
        Objects.requireNonNull(area, "area");
        double[] arfHigh = area.highEnergy();
        if (arfHigh.length != highEnergy.length) {
            return CheckResult.failed("Size of ARF (" + arfHigh.length + ") and RMF ("
                    + highEnergy.length + ") are not the same");
        }
        if (arfHigh.length == 0) {
            return CheckResult.passed();
        }
        if (arfHigh[0] != highEnergy[0]) {
            return CheckResult.failed("First high-energy boundaries of ARF and RMF are not the same");
        }
        int last = arfHigh.length - 1;
        if (arfHigh[last] != highEnergy[last]) {
            return CheckResult.failed("Last high-energy boundaries of ARF and RMF are not the same");
        }
        return CheckResult.passed();
    }

    public static final class Builder {
        private int[] channels = new int[0];
        private double[] channelLowEnergy = new double[0];
        private double[] channelHighEnergy = new double[0];
        private double[] lowEnergy = new double[0];
        private double[] highEnergy = new double[0];
        private int[] groupsPerBin = new int[0];
        private int[] groupFirstChannel = new int[0];
        private int[] groupChannelCount = new int[0];
        private double[] matrix = new double[0];
        private String energyUnit = "keV";
        private int order;
        private boolean areaIncluded;

        private Builder() {}

        public Builder channelBounds(int[] channels, double[] low, double[] high) {
            this.channels = channels.clone();
            this.channelLowEnergy = low.clone();
            this.channelHighEnergy = high.clone();
            return this;
        }

        public Builder energyBins(double[] low, double[] high, int[] groupsPerBin) {
            this.lowEnergy = low.clone();
            this.highEnergy = high.clone();
            this.groupsPerBin = groupsPerBin.clone();
            return this;
        }

        public Builder groups(int[] firstChannel, int[] channelCount) {
            this.groupFirstChannel = firstChannel.clone();
            this.groupChannelCount = channelCount.clone();
            return this;
        }

        public Builder matrix(double[] matrix) {
            this.matrix = matrix.clone();
            return this;
        }

        public Builder energyUnit(String energyUnit) {
            this.energyUnit = Objects.requireNonNull(energyUnit, "energyUnit");
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder areaIncluded(boolean areaIncluded) {
            this.areaIncluded = areaIncluded;
            return this;
        }

        public OgipResponse build() {
            return new OgipResponse(this);
        }
    }
}
