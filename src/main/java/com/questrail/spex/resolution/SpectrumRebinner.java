package com.questrail.spex.resolution;

import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.Spectrum.Flag;

import java.util.Objects;

/**
 * Groups the channels of a single-region spectrum into data bins at least as
 * wide as the optimal data bin width at the start of each bin.
 *
 * <p>Only the first/last-of-bin flags change. The response matrix is left as
 * it is: rebinning the model energy grid to the optimal model bin width is
 * not implemented.</p>
 */
public final class SpectrumRebinner
{
    public Spectrum rebin(Spectrum spectrum, ResolutionReport report) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(report, "report");
        spectrum.check().orThrow("Spectrum to rebin");
        if (spectrum.regionCount() != 1) {
            throw new IllegalArgumentException("Only single-region spectra can be rebinned, found "
                    + spectrum.regionCount());
        }

        double[] lower = spectrum.lowerEnergy();
        double[] upper = spectrum.upperEnergy();
        int n = lower.length;
        boolean[] first = new boolean[n];
        boolean[] last = new boolean[n];

        int start = 0;
        while (start < n) {
            double width = report.dataBinWidthAt(lower[start]);
            int end = start;
            while (end < n - 1 && upper[end] - lower[start] < width) {
                end++;
            }
            first[start] = true;
            last[end] = true;
            start = end + 1;
        }

        return spectrum.toBuilder()
                .set(Flag.FIRST_OF_BIN, first)
                .set(Flag.LAST_OF_BIN, last)
                .build();
    }
}
