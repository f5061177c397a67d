package com.questrail.spex.convert;

import com.questrail.spex.api.DiscontinuousEnergyGridException;
import com.questrail.spex.api.IncompatibleMatrixException;
import com.questrail.spex.api.IncompatibleSpectrumException;
import com.questrail.spex.config.ConversionConfig;
import com.questrail.spex.mapping.Masks;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.Spectrum.Flag;
import com.questrail.spex.model.Spectrum.Quantity;
import com.questrail.spex.model.ogip.OgipEffectiveArea;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionWarningEvent;

import java.util.Objects;

/**
 * OgipToSpexConverter
 * -----------------------------------------------------------------------------
 * Converts OGIP spectra and responses into single-region SPEX objects
 * (sector 1, region 1).
 *
 * <h2>Spectrum arithmetic</h2>
 * Per channel {@code i}, with {@code tints = exposure * AREASCAL}:
 * <pre>
 *   ochan   = rate / AREASCAL                       (0 when tints &lt;= 0)
 *   var     = (STAT_ERR / AREASCAL)^2
 *   fb      = BACKSCAL / BACKSCAL_bkg               (0 when BACKSCAL_bkg &lt;= 0)
 *   mb      = rate_bkg * fb / AREASCAL_bkg          subtracted from ochan
 *   vb      = (err_bkg * fb / AREASCAL_bkg)^2       added to var
 *   Exp_Rate = exposure_bkg * AREASCAL_bkg / tints / fb
 * </pre>
 * A correction spectrum is subtracted like a background, scaled by its
 * {@code CORRSCAL}. Background, correction and Exp_Rate are zero in channels
 * with no exposure.
 *
 * <h2>Channel order</h2>
 * Instruments that store channels in wavelength order have decreasing
 * channel energies. Both conversions then reverse the channel order and
 * report it through the {@code swapped} flag of their result.
 */
public final class OgipToSpexConverter
{
    private static final double CM2_TO_M2 = 1.0E-4;

    private final ConversionConfig config;
    private final ConversionObservabilitySink sink;

    public OgipToSpexConverter(ConversionConfig config, ConversionObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Converts a source spectrum using the channel energies of {@code response}.
     *
     * @param background   background spectrum, or {@code null}
     * @param correction   correction spectrum, or {@code null}
     * @param keepGrouping carry the OGIP grouping into the first/last-of-bin flags
     * @throws IncompatibleSpectrumException if background, correction or
     *         response disagree with the source channel count
     */
    public ConvertedSpectrum convertSpectrum(OgipSpectrum source,
                                             OgipResponse response,
                                             OgipSpectrum background,
                                             OgipSpectrum correction,
                                             boolean keepGrouping) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(response, "response");
        source.check().orThrow("Source spectrum");

        int n = source.channelCount();
        requireSameChannels(source, background, "Background");
        requireSameChannels(source, correction, "Correction");
        if (response.channelCount() != n) {
            throw new IncompatibleSpectrumException("Spectrum has " + n + " channels but the response "
                    + response.channelCount());
        }

        double exposure = source.exposure();
        double[] rate = source.rates();
        double[] err = source.statErrors();
        double[] areaScal = source.areaScaling();
        double[] backScal = source.backScaling();
        int[] quality = source.quality();

        double[] tints = new double[n];
        double[] ochan = new double[n];
        double[] dochan = new double[n];
        double[] mbchan = new double[n];
        double[] dbchan = new double[n];
        double[] brat = new double[n];
        boolean[] used = Masks.filled(n, true);

        for (int i = 0; i < n; i++) {
            tints[i] = exposure * areaScal[i];
            if (tints[i] > 0.0) {
                ochan[i] = rate[i] / areaScal[i];
            }
            if (quality[i] != 0) {
                used[i] = false;
            }
        }

        if (background != null) {
            double[] bRate = background.rates();
            double[] bErr = background.statErrors();
            double[] bArea = background.areaScaling();
            double[] bBack = background.backScaling();
            int[] bQuality = background.quality();
            for (int i = 0; i < n; i++) {
                if (bQuality[i] != 0) {
                    used[i] = false;
                }
                if (tints[i] <= 0.0 || bArea[i] <= 0.0) {
                    continue;
                }
                double fb = bBack[i] > 0.0 ? backScal[i] / bBack[i] : 0.0;
                double mb = bRate[i] * fb / bArea[i];
                double eb = bErr[i] * fb / bArea[i];
                ochan[i] -= mb;
                mbchan[i] = mb;
                dbchan[i] = eb * eb;
                if (fb > 0.0 && exposure > 0.0 && tints[i] > 0.0) {
                    brat[i] = background.exposure() * bArea[i] / tints[i] / fb;
                }
            }
        }

        if (correction != null) {
            double[] cRate = correction.rates();
            double[] cErr = correction.statErrors();
            double[] cArea = correction.areaScaling();
            double[] cBack = correction.backScaling();
            int[] cQuality = correction.quality();
            double corrScale = correction.correctionScale();
            for (int i = 0; i < n; i++) {
                if (cQuality[i] != 0) {
                    used[i] = false;
                }
                if (tints[i] <= 0.0 || cArea[i] <= 0.0) {
                    continue;
                }
                double fc = cBack[i] > 0.0 ? backScal[i] / cBack[i] : 0.0;
                double mc = cRate[i] * fc * corrScale / cArea[i];
                double ec = cErr[i] * fc * corrScale / cArea[i];
                ochan[i] -= mc;
                mbchan[i] += mc;
                dbchan[i] += ec * ec;
            }
        }

        for (int i = 0; i < n; i++) {
            double sourceVariance = 0.0;
            if (tints[i] > 0.0) {
                double e = err[i] / areaScal[i];
                sourceVariance = e * e;
            }
            dochan[i] = Math.sqrt(sourceVariance + dbchan[i]);
            if (tints[i] <= 0.0) {
                mbchan[i] = 0.0;
                dbchan[i] = 0.0;
                brat[i] = 0.0;
            }
            dbchan[i] = Math.sqrt(dbchan[i]);
        }

        boolean[] first = Masks.filled(n, true);
        boolean[] last = Masks.filled(n, true);
        if (keepGrouping) {
            int[] grouping = source.grouping();
            for (int i = 0; i < n; i++) {
                first[i] = grouping[i] != -1;
                last[i] = i == n - 1 || grouping[i + 1] != -1;
            }
        }

        if (!"keV".equals(response.energyUnit())) {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                    "Energy units of keV are expected in the response file, found '" + response.energyUnit() + "'"));
        }
        double[] lower = response.channelLowEnergy();
        double[] upper = response.channelHighEnergy();
        boolean clamped = false;
        for (int i = 0; i < n; i++) {
            if (lower[i] <= 0.0) {
                lower[i] = config.spectrumEnergyFloor();
                clamped = true;
            }
        }
        if (clamped) {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                    "Lowest channel boundary energy is 0; set to " + config.spectrumEnergyFloor() + " keV"));
        }

        Spectrum spectrum = Spectrum.builder()
                .channelsPerRegion(new int[] { n })
                .set(Quantity.LOWER_ENERGY, lower)
                .set(Quantity.UPPER_ENERGY, upper)
                .set(Quantity.EXPOSURE_TIME, tints)
                .set(Quantity.SOURCE_RATE, ochan)
                .set(Quantity.SOURCE_RATE_ERROR, dochan)
                .set(Quantity.BACKGROUND_RATE, mbchan)
                .set(Quantity.BACKGROUND_RATE_ERROR, dbchan)
                .set(Quantity.BACKSCALE_RATIO, brat)
                .set(Quantity.SOURCE_SYSTEMATIC, new double[n])
                .set(Quantity.BACKGROUND_SYSTEMATIC, new double[n])
                .set(Flag.USED, used)
                .set(Flag.FIRST_OF_BIN, first)
                .set(Flag.LAST_OF_BIN, last)
                .backscaleRatioPresent(config.writeExpRate())
                .build();

        boolean swapped = n > 1 && lower[0] > lower[1];
        if (swapped) {
            spectrum = spectrum.swapChannelOrder();
        }
        spectrum.check().orThrow("Converted spectrum");
        return new ConvertedSpectrum(spectrum, swapped);
    }

    /**
     * Converts a response matrix, folding in the effective area when given.
     *
     * @param area effective area, or {@code null}
     * @throws IncompatibleMatrixException if {@code area} does not match the
     *         response energy grid
     * @throws DiscontinuousEnergyGridException for a model bin of zero or
     *         negative width
     */
    public ConvertedResponse convertResponse(OgipResponse response, OgipEffectiveArea area) {
        Objects.requireNonNull(response, "response");
        response.check().orThrow("Response matrix");
        if (area != null) {
            var compat = response.checkCompatible(area);
            if (compat.failed()) {
                throw new IncompatibleMatrixException(
                        "Effective area file is not consistent with the response: " + compat.message());
            }
        }

        int bins = response.energyBinCount();
        int groups = response.totalGroups();
        double[] lo = response.lowEnergy();
        double[] hi = response.highEnergy();
        int[] groupsPerBin = response.groupsPerBin();
        int[] fChan = response.groupFirstChannel();
        int[] nChan = response.groupChannelCount();
        double[] matrix = response.matrix();
        double[] effArea = area != null ? area.effectiveArea() : null;

        double[] eg1 = new double[groups];
        double[] eg2 = new double[groups];
        int[] ic1 = new int[groups];
        int[] ic2 = new int[groups];
        int[] nc = new int[groups];
        double[] values = new double[matrix.length];

        boolean clamped = false;
        int g = 0;
        int m = 0;
        for (int i = 0; i < bins; i++) {
            double low = lo[i];
            if (low <= 0.0) {
                low = config.modelEnergyFloor();
                clamped = true;
            }
            if (hi[i] <= low) {
                throw new DiscontinuousEnergyGridException(
                        "Discontinuous bins in energy array in energy bin " + (i + 1));
            }
            double factor = effArea != null ? effArea[i] : 1.0;
            for (int j = 0; j < groupsPerBin[i]; j++) {
                eg1[g] = low;
                eg2[g] = hi[i];
                nc[g] = nChan[g];
                ic1[g] = fChan[g];
                ic2[g] = fChan[g] + nChan[g] - 1;
                for (int k = 0; k < nc[g]; k++) {
                    values[m] = Math.max(0.0, matrix[m] * factor);
                    m++;
                }
                g++;
            }
        }
        if (clamped) {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                    "Lowest energy boundary is 0; set to " + config.modelEnergyFloor() + " keV"));
        }

        if (area == null || area.isSquareCentimetres()) {
            for (int k = 0; k < values.length; k++) {
                values[k] *= CM2_TO_M2;
            }
        }

        int channels = response.channelCount();
        ResponseMatrix result = ResponseMatrix.builder()
                .components(new int[] { channels }, new int[] { groups }, new int[] { 1 }, new int[] { 1 })
                .groups(eg1, eg2, ic1, ic2, nc)
                .values(values)
                .build();

        double[] chanLow = response.channelLowEnergy();
        boolean swapped = channels > 1 && chanLow[0] > chanLow[1];
        if (swapped) {
            result = result.swapChannelOrder();
        }
        return new ConvertedResponse(result, swapped);
    }

    private static void requireSameChannels(OgipSpectrum source, OgipSpectrum other, String what) {
        if (other == null) {
            return;
        }
        var compat = source.checkCompatible(other);
        if (compat.failed()) {
            throw new IncompatibleSpectrumException(what + " spectrum is not compatible with source spectrum: "
                    + compat.message());
        }
    }
}
