package com.questrail.spex.model.ogip;

import com.questrail.spex.api.CheckResult;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * OgipSpectrum
 * -----------------------------------------------------------------------------
 * Per-channel spectrum as read from an OGIP PHA file (or one row of a type II
 * file). The same type carries source, background and correction spectra.
 *
 * <p>Rates are always in counts per second: COUNTS spectra are divided by
 * the exposure on read. Channel numbers are as stored, usually starting at 0
 * or 1.</p>
 */
public final class OgipSpectrum
{
    public static final double SIMULATION_EXPOSURE = 1000.0;

    private final int[] channels;
    private final double[] rates;
    private final double[] statErrors;
    private final double[] sysErrors;
    private final int[] quality;
    private final int[] grouping;
    private final double[] areaScaling;
    private final double[] backScaling;
    private final double exposure;
    private final double correctionScale;
    private final String spectrumType;
    private final boolean poissonErrors;
    private final String backgroundFile;
    private final String responseFile;
    private final String ancillaryFile;
    private final String correctionFile;

    private OgipSpectrum(Builder b) {
        this.channels = b.channels.clone();
        this.rates = b.rates.clone();
        this.statErrors = b.statErrors.clone();
        this.sysErrors = b.sysErrors.clone();
        this.quality = b.quality.clone();
        this.grouping = b.grouping.clone();
        this.areaScaling = b.areaScaling.clone();
        this.backScaling = b.backScaling.clone();
        this.exposure = b.exposure;
        this.correctionScale = b.correctionScale;
        this.spectrumType = b.spectrumType;
        this.poissonErrors = b.poissonErrors;
        this.backgroundFile = b.backgroundFile;
        this.responseFile = b.responseFile;
        this.ancillaryFile = b.ancillaryFile;
        this.correctionFile = b.correctionFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Placeholder spectrum over the channels of {@code response} for
     * simulations: {@value #SIMULATION_EXPOSURE} s of exposure, one count
     * per channel with a Poisson error of one count, good quality, no
     * grouping and unit area and background scaling.
     */
    public static OgipSpectrum simulationTemplate(OgipResponse response) {
        Objects.requireNonNull(response, "response");
        int n = response.channelCount();
        double[] oneCount = new double[n];
        Arrays.fill(oneCount, 1.0 / SIMULATION_EXPOSURE);
        double[] unit = new double[n];
        Arrays.fill(unit, 1.0);
        return builder()
                .channels(response.channels())
                .rates(oneCount)
                .statErrors(oneCount)
                .sysErrors(new double[n])
                .quality(new int[n])
                .grouping(new int[n])
                .areaScaling(unit)
                .backScaling(unit)
                .exposure(SIMULATION_EXPOSURE)
                .spectrumType("TOTAL")
                .poissonErrors(true)
                .build();
    }

    /**
     * Copy with every BACKSCAL value divided by {@code factor}.
     *
     * @throws IllegalArgumentException if {@code factor} is not positive
     */
    public OgipSpectrum withBackScalingDividedBy(double factor) {
        if (!(factor > 0.0)) {
            throw new IllegalArgumentException("Background scaling factor must be positive: " + factor);
        }
        double[] scaled = backScaling.clone();
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] /= factor;
        }
        return toBuilder().backScaling(scaled).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .channels(channels)
                .rates(rates)
                .statErrors(statErrors)
                .sysErrors(sysErrors)
                .quality(quality)
                .grouping(grouping)
                .areaScaling(areaScaling)
                .backScaling(backScaling)
                .exposure(exposure)
                .correctionScale(correctionScale)
                .spectrumType(spectrumType)
                .poissonErrors(poissonErrors)
                .backgroundFile(backgroundFile)
                .responseFile(responseFile)
                .ancillaryFile(ancillaryFile)
                .correctionFile(correctionFile);
    }

    public int channelCount() {
        return rates.length;
    }

    /**
     * First stored channel number, or 0 for an empty spectrum.
     */
    public int firstChannel() {
        return channels.length == 0 ? 0 : channels[0];
    }

    public int[] channels() {
        return channels.clone();
    }

    public double[] rates() {
        return rates.clone();
    }

    public double[] statErrors() {
        return statErrors.clone();
    }

    public double[] sysErrors() {
        return sysErrors.clone();
    }

    public int[] quality() {
        return quality.clone();
    }

    public int[] grouping() {
        return grouping.clone();
    }

    public double[] areaScaling() {
        return areaScaling.clone();
    }

    public double[] backScaling() {
        return backScaling.clone();
    }

    public double exposure() {
        return exposure;
    }

    /** CORRSCAL keyword, 1 when absent. */
    public double correctionScale() {
        return correctionScale;
    }

    /** HDUCLAS2: TOTAL, NET or BKG. */
    public String spectrumType() {
        return spectrumType;
    }

    public boolean poissonErrors() {
        return poissonErrors;
    }

    public Optional<String> backgroundFile() {
        return Optional.ofNullable(backgroundFile);
    }

    public Optional<String> responseFile() {
        return Optional.ofNullable(responseFile);
    }

    public Optional<String> ancillaryFile() {
        return Optional.ofNullable(ancillaryFile);
    }

    public Optional<String> correctionFile() {
        return Optional.ofNullable(correctionFile);
    }

    /**
     * Minimum content for a conversion: positive exposure, at least one
     * channel and per-channel arrays of equal length.
     */
    public CheckResult check() {
        if (exposure <= 0.0) {
            return CheckResult.failed("Exposure time of spectrum is zero or smaller");
        }
        int n = rates.length;
        if (n == 0) {
            return CheckResult.failed("Number of channels is zero");
        }
        if (channels.length != n || statErrors.length != n || sysErrors.length != n || quality.length != n
                || grouping.length != n || areaScaling.length != n || backScaling.length != n) {
            return CheckResult.failed("Spectrum columns differ in length");
        }
        return CheckResult.passed();
    }

    /**
     * Background and correction spectra must have the source's channel count.
     */
    public CheckResult checkCompatible(OgipSpectrum other) {
        Objects.requireNonNull(other, "other");
        if (other.channelCount() != channelCount()) {
            return CheckResult.failed("Number of channels not equal for both spectra: "
                    + channelCount() + " vs " + other.channelCount());
        }
        return CheckResult.passed();
    }

    public static final class Builder {
        private int[] channels = new int[0];
        private double[] rates = new double[0];
        private double[] statErrors = new double[0];
        private double[] sysErrors = new double[0];
        private int[] quality = new int[0];
        private int[] grouping = new int[0];
        private double[] areaScaling = new double[0];
        private double[] backScaling = new double[0];
        private double exposure;
        private double correctionScale = 1.0;
        private String spectrumType = "TOTAL";
        private boolean poissonErrors;
        private String backgroundFile;
        private String responseFile;
        private String ancillaryFile;
        private String correctionFile;

        private Builder() {}

        public Builder channels(int[] channels) {
            this.channels = channels.clone();
            return this;
        }

        public Builder rates(double[] rates) {
            this.rates = rates.clone();
            return this;
        }

        public Builder statErrors(double[] statErrors) {
            this.statErrors = statErrors.clone();
            return this;
        }

        public Builder sysErrors(double[] sysErrors) {
            this.sysErrors = sysErrors.clone();
            return this;
        }

        public Builder quality(int[] quality) {
            this.quality = quality.clone();
            return this;
        }

        public Builder grouping(int[] grouping) {
            this.grouping = grouping.clone();
            return this;
        }

        public Builder areaScaling(double[] areaScaling) {
            this.areaScaling = areaScaling.clone();
            return this;
        }

        public Builder backScaling(double[] backScaling) {
            this.backScaling = backScaling.clone();
            return this;
        }

        public Builder exposure(double exposure) {
            this.exposure = exposure;
            return this;
        }

        public Builder correctionScale(double correctionScale) {
            this.correctionScale = correctionScale;
            return this;
        }

        public Builder spectrumType(String spectrumType) {
            this.spectrumType = Objects.requireNonNull(spectrumType, "spectrumType");
            return this;
        }

        public Builder poissonErrors(boolean poissonErrors) {
            this.poissonErrors = poissonErrors;
            return this;
        }

        public Builder backgroundFile(String backgroundFile) {
            this.backgroundFile = backgroundFile;
            return this;
        }

        public Builder responseFile(String responseFile) {
            this.responseFile = responseFile;
            return this;
        }

        public Builder ancillaryFile(String ancillaryFile) {
            this.ancillaryFile = ancillaryFile;
            return this;
        }

        public Builder correctionFile(String correctionFile) {
            this.correctionFile = correctionFile;
            return this;
        }

        public OgipSpectrum build() {
            return new OgipSpectrum(this);
        }
    }
}
