package com.questrail.spex.resolution;

import com.questrail.spex.api.SectorRegion;
import com.questrail.spex.model.Region;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ResolutionAnalyzer
 * -----------------------------------------------------------------------------
 * Measures the instrumental resolution of a {@link Region} from its response
 * matrix.
 *
 * <h2>Per model energy</h2>
 * Consecutive groups of a component with identical energy bounds describe one
 * model energy and are summed into one response column over the component's
 * channels. The column maximum is refined with a three-point parabola when
 * both neighbours exist and the fit is concave. From the peak the first
 * half-maximum crossing is searched outward on each side and interpolated
 * linearly between channel centres; a side without crossing ends at the outer
 * channel edge. Channel positions are converted to energies through the
 * channel bounds of the spectrum.
 *
 * <h2>Counts per element</h2>
 * The expected photon count in one resolution element is the number of
 * observed counts between the half-maximum energies divided by the fraction
 * of the column response in the same interval, at least 1.
 */
public final class ResolutionAnalyzer
{
    public ResolutionReport analyze(Region region) {
        Objects.requireNonNull(region, "region");
        region.check().orThrow("Region for resolution analysis");
        Spectrum spo = region.spectrum();
        ResponseMatrix res = region.response();

        double[] lower = spo.lowerEnergy();
        double[] upper = spo.upperEnergy();
        double[] counts = cumulativeCounts(spo);

        double[] eg1 = res.lowEnergies();
        double[] eg2 = res.highEnergies();
        int[] ic1 = res.firstChannels();
        int[] nc = res.groupChannelCounts();
        double[] values = res.values();
        int[] groupOffsets = res.componentGroupOffsets();
        int[] valueOffsets = res.groupValueOffsets();
        int[] channelCounts = res.componentChannelCounts();

        List<ResolutionElement> elements = new ArrayList<>();
        List<Double> expected = new ArrayList<>();
        double resolutionElements = 0.0;

        for (int k = 0; k < channelCounts.length; k++) {
            int n = channelCounts[k];
            int g = groupOffsets[k];
            while (g < groupOffsets[k + 1]) {
                double[] column = new double[n];
                int start = g;
                while (g < groupOffsets[k + 1] && eg1[g] == eg1[start] && eg2[g] == eg2[start]) {
                    for (int j = 0; j < nc[g]; j++) {
                        column[ic1[g] - 1 + j] += values[valueOffsets[g] + j];
                    }
                    g++;
                }
                ResolutionElement element = measure(column, lower, upper, eg1[start], eg2[start]);
                elements.add(element);
                if (element.isDegenerate()) {
                    expected.add(1.0);
                    continue;
                }
                resolutionElements += element.width() / element.fwhm();
                expected.add(expectedCounts(element, column, lower, upper, counts));
            }
        }

        double[] nr = new double[expected.size()];
        for (int i = 0; i < nr.length; i++) {
            nr[i] = expected.get(i);
        }
        List<SectorRegion> keys = res.regionKeys();
        SectorRegion key = keys.isEmpty() ? SectorRegion.of(1, 1) : keys.get(0);
        return new ResolutionReport(key, elements, nr, resolutionElements);
    }

    static ResolutionElement measure(double[] column, double[] lower, double[] upper,
                                     double modelLow, double modelHigh) {
        int n = column.length;
        if (n == 0) {
            return ResolutionElement.degenerate(modelLow, modelHigh);
        }
        int m = 0;
        for (int i = 1; i < n; i++) {
            if (column[i] > column[m]) {
                m = i;
            }
        }
        if (!(column[m] > 0.0)) {
            return ResolutionElement.degenerate(modelLow, modelHigh);
        }

        // Positions are in channel units: channel i spans [i, i + 1)
        double peakPosition = m + 0.5;
        double peak = column[m];
        if (m > 0 && m < n - 1) {
            double y0 = column[m - 1];
            double y1 = column[m];
            double y2 = column[m + 1];
            double curvature = y0 - 2.0 * y1 + y2;
            if (curvature < 0.0) {
                double offset = 0.5 * (y0 - y2) / curvature;
                peakPosition += offset;
                peak = y1 - 0.25 * (y0 - y2) * offset;
            }
        }

        double half = 0.5 * peak;
        double left = 0.0;
        for (int i = m - 1; i >= 0; i--) {
            if (column[i] <= half) {
                left = i + 0.5 + fraction(half, column[i], column[i + 1]);
                break;
            }
        }
        double right = n;
        for (int i = m + 1; i < n; i++) {
            if (column[i] <= half) {
                right = i - 0.5 + fraction(half, column[i - 1], column[i]);
                break;
            }
        }

        double low = energyAt(left, lower, upper);
        double high = energyAt(right, lower, upper);
        return new ResolutionElement(low, high, energyAt(peakPosition, lower, upper), peak,
                high - low, modelHigh - modelLow);
    }

    /**
     * Fraction of the way from a value {@code from} to {@code to} where
     * {@code level} is crossed.
     */
    private static double fraction(double level, double from, double to) {
        if (to == from) {
            return 0.5;
        }
        return Math.min(1.0, Math.max(0.0, (level - from) / (to - from)));
    }

    static double energyAt(double position, double[] lower, double[] upper) {
        int n = lower.length;
        if (position <= 0.0) {
            return lower[0];
        }
        if (position >= n) {
            return upper[n - 1];
        }
        int i = (int) Math.floor(position);
        double f = position - i;
        return lower[i] + f * (upper[i] - lower[i]);
    }

    /**
     * Cumulative source counts at each channel's upper energy, used channels only.
     */
    private static double[] cumulativeCounts(Spectrum spo) {
        double[] rate = spo.sourceRate();
        double[] exposure = spo.exposureTime();
        boolean[] used = spo.used();
        double[] cumulative = new double[rate.length];
        double sum = 0.0;
        for (int i = 0; i < rate.length; i++) {
            if (used[i]) {
                sum += rate[i] * exposure[i];
            }
            cumulative[i] = sum;
        }
        return cumulative;
    }

    private static double expectedCounts(ResolutionElement element, double[] column,
                                         double[] lower, double[] upper, double[] counts) {
        double total = 0.0;
        double[] response = new double[column.length];
        for (int i = 0; i < column.length; i++) {
            total += column[i];
            response[i] = total;
        }
        for (int i = 0; i < response.length; i++) {
            response[i] /= total;
        }
        double inside = interpolate(element.highEnergy(), lower, upper, counts)
                - interpolate(element.lowEnergy(), lower, upper, counts);
        double responseInside = interpolate(element.highEnergy(), lower, upper, response)
                - interpolate(element.lowEnergy(), lower, upper, response);
        if (!(responseInside > 0.0)) {
            return 1.0;
        }
        return Math.max(1.0, inside / responseInside);
    }

    /**
     * Linear interpolation of a cumulative curve given at the channel upper
     * energies, starting from 0 at the lower edge of the first channel.
     */
    static double interpolate(double energy, double[] lower, double[] upper, double[] cumulative) {
        int n = upper.length;
        if (energy <= lower[0]) {
            return 0.0;
        }
        double previousEnergy = lower[0];
        double previousValue = 0.0;
        for (int i = 0; i < n; i++) {
            if (energy <= upper[i]) {
                double span = upper[i] - previousEnergy;
                double f = span > 0.0 ? (energy - previousEnergy) / span : 1.0;
                return previousValue + f * (cumulative[i] - previousValue);
            }
            previousEnergy = upper[i];
            previousValue = cumulative[i];
        }
        return cumulative[n - 1];
    }
}
