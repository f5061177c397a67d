package com.questrail.spex.resolution;

/**
 * OptimalBinning
 * -----------------------------------------------------------------------------
 * Optimal data and model bin widths relative to the instrumental FWHM,
 * following the approximation of Kaastra &amp; Bleeker (2016, A&amp;A 587, A151).
 *
 * <h2>Inputs</h2>
 * <ul>
 *   <li>{@code Nr}: expected number of photons within one resolution element</li>
 *   <li>{@code R}: number of resolution elements over the spectrum,
 *       {@code sum(model bin width / FWHM)}</li>
 * </ul>
 *
 * <h2>Formulas</h2>
 * <pre>
 *   x        = ln(Nr (1 + 0.2 ln R))
 *   d / FWHM = 0.08 + 7/x + 1.8/x^2   for x &gt; 2.119, else 1 (at most 1)
 *   D / FWHM = min(1, 0.65 Nr^(-1/4))
 * </pre>
 */
public final class OptimalBinning
{
    static final double X_THRESHOLD = 2.119;

    private OptimalBinning() {}

    public record BinWidths(double dataBinWidth, double modelBinWidth) {}

    /**
     * Data bin width in units of the FWHM.
     */
    public static double dataBinFraction(double expectedCounts, double resolutionElements) {
        double nr = Math.max(1.0, expectedCounts);
        double r = Math.max(1.0, resolutionElements);
        double x = Math.log(nr * (1.0 + 0.2 * Math.log(r)));
        if (x <= X_THRESHOLD) {
            return 1.0;
        }
        return Math.min(1.0, 0.08 + 7.0 / x + 1.8 / (x * x));
    }

    /**
     * Model bin width in units of the FWHM.
     */
    public static double modelBinFraction(double expectedCounts) {
        double nr = Math.max(1.0, expectedCounts);
        return Math.min(1.0, 0.65 * Math.pow(nr, -0.25));
    }

    /**
     * Absolute widths (keV) for one element; both zero for a degenerate one.
     */
    public static BinWidths widths(ResolutionElement element, double expectedCounts, double resolutionElements) {
        if (element.isDegenerate()) {
            return new BinWidths(0.0, 0.0);
        }
        return new BinWidths(
                element.fwhm() * dataBinFraction(expectedCounts, resolutionElements),
                element.fwhm() * modelBinFraction(expectedCounts));
    }
}
