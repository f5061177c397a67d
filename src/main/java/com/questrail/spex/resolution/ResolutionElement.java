package com.questrail.spex.resolution;

/**
 * Spread of the response to one model energy.
 *
 * @param lowEnergy  lower half-maximum energy (keV)
 * @param highEnergy upper half-maximum energy (keV)
 * @param centroid   energy of the response peak (keV)
 * @param peak       response value at the peak
 * @param fwhm       {@code highEnergy - lowEnergy}, 0 for a degenerate element
 * @param width      width of the model energy bin (keV)
 */
public record ResolutionElement(
    double lowEnergy,
    double highEnergy,
    double centroid,
    double peak,
    double fwhm,
    double width
) {
    /**
     * Element of a model energy without any response.
     */
    static ResolutionElement degenerate(double modelLow, double modelHigh) {
        double mid = 0.5 * (modelLow + modelHigh);
        return new ResolutionElement(mid, mid, mid, 0.0, 0.0, modelHigh - modelLow);
    }

    public boolean isDegenerate() {
        return !(fwhm > 0.0);
    }
}
