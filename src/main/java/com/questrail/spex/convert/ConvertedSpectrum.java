package com.questrail.spex.convert;

import com.questrail.spex.model.Spectrum;

import java.util.Objects;

/**
 * A converted spectrum and whether its channel order was reversed.
 */
public record ConvertedSpectrum(Spectrum spectrum, boolean swapped)
{
    public ConvertedSpectrum {
        Objects.requireNonNull(spectrum, "spectrum");
    }
}
