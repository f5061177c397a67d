package com.questrail.spex.config;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated options for one OGIP to SPEX conversion.
 *
 * @param keepGrouping          carry OGIP GROUPING into the first/last-of-bin flags
 * @param removeBadChannels     run bad-channel cleaning on every converted region
 * @param writeExpRate          write the {@code Exp_Rate} column to the spectrum file
 * @param overwrite             replace existing output files
 * @param spectrumEnergyFloor   lower bound (keV) for non-positive channel energies
 * @param modelEnergyFloor      lower bound (keV) for non-positive model energies
 * @param forcePoissonErrors    use Poisson errors for type II spectra even if STAT_ERR is present
 * @param subtractBackground    subtract the type II background regions
 * @param history               HISTORY lines written to the output files
 */
public record ConversionConfig(
    boolean keepGrouping,
    boolean removeBadChannels,
    boolean writeExpRate,
    boolean overwrite,
    double spectrumEnergyFloor,
    double modelEnergyFloor,
    boolean forcePoissonErrors,
    boolean subtractBackground,
    List<String> history
) {
    public static final double DEFAULT_SPECTRUM_ENERGY_FLOOR = 1.0E-5;
    public static final double DEFAULT_MODEL_ENERGY_FLOOR = 1.0E-7;

    public ConversionConfig {
        Objects.requireNonNull(history, "history");
        history = List.copyOf(history);
        if (!(spectrumEnergyFloor > 0.0)) {
            throw new IllegalArgumentException("spectrumEnergyFloor must be positive");
        }
        if (!(modelEnergyFloor > 0.0)) {
            throw new IllegalArgumentException("modelEnergyFloor must be positive");
        }
    }

    public static ConversionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .withKeepGrouping(keepGrouping)
            .withRemoveBadChannels(removeBadChannels)
            .withWriteExpRate(writeExpRate)
            .withOverwrite(overwrite)
            .withSpectrumEnergyFloor(spectrumEnergyFloor)
            .withModelEnergyFloor(modelEnergyFloor)
            .withForcePoissonErrors(forcePoissonErrors)
            .withSubtractBackground(subtractBackground)
            .withHistory(history);
    }

    public static final class Builder {
        private boolean keepGrouping;
        private boolean removeBadChannels;
        private boolean writeExpRate;
        private boolean overwrite;
        private double spectrumEnergyFloor = DEFAULT_SPECTRUM_ENERGY_FLOOR;
        private double modelEnergyFloor = DEFAULT_MODEL_ENERGY_FLOOR;
        private boolean forcePoissonErrors = true;
        private boolean subtractBackground = true;
        private List<String> history = List.of();

        public Builder withKeepGrouping(boolean keepGrouping) {
            this.keepGrouping = keepGrouping;
            return this;
        }

        public Builder withRemoveBadChannels(boolean removeBadChannels) {
            this.removeBadChannels = removeBadChannels;
            return this;
        }

        public Builder withWriteExpRate(boolean writeExpRate) {
            this.writeExpRate = writeExpRate;
            return this;
        }

        public Builder withOverwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder withSpectrumEnergyFloor(double floor) {
            this.spectrumEnergyFloor = floor;
            return this;
        }

        public Builder withModelEnergyFloor(double floor) {
            this.modelEnergyFloor = floor;
            return this;
        }

        public Builder withForcePoissonErrors(boolean forcePoissonErrors) {
            this.forcePoissonErrors = forcePoissonErrors;
            return this;
        }

        public Builder withSubtractBackground(boolean subtractBackground) {
            this.subtractBackground = subtractBackground;
            return this;
        }

        public Builder withHistory(List<String> history) {
            this.history = history;
            return this;
        }

        public ConversionConfig build() {
            return new ConversionConfig(keepGrouping, removeBadChannels, writeExpRate, overwrite,
                spectrumEnergyFloor, modelEnergyFloor, forcePoissonErrors, subtractBackground, history);
        }
    }
}
