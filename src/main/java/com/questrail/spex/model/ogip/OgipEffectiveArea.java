package com.questrail.spex.model.ogip;

import com.questrail.spex.api.CheckResult;

import java.util.Locale;
import java.util.Objects;

/**
 * Effective-area curve from an OGIP ARF file.
 *
 * <p>{@code areaUnit} is the raw TUNIT of the SPECRESP column. Grating
 * ARFs carry their order and arm ({@code TG_M}, {@code TG_PART}); both are 0
 * otherwise.</p>
 */
public record OgipEffectiveArea(double[] lowEnergy,
                                double[] highEnergy,
                                double[] effectiveArea,
                                String energyUnit,
                                String areaUnit,
                                int order,
                                int part)
{
    public OgipEffectiveArea {
        lowEnergy = Objects.requireNonNull(lowEnergy, "lowEnergy").clone();
        highEnergy = Objects.requireNonNull(highEnergy, "highEnergy").clone();
        effectiveArea = Objects.requireNonNull(effectiveArea, "effectiveArea").clone();
        Objects.requireNonNull(energyUnit, "energyUnit");
        Objects.requireNonNull(areaUnit, "areaUnit");
    }

    @Override
    public double[] lowEnergy() {
        return lowEnergy.clone();
    }

    @Override
    public double[] highEnergy() {
        return highEnergy.clone();
    }

    @Override
    public double[] effectiveArea() {
        return effectiveArea.clone();
    }

    public int binCount() {
        return effectiveArea.length;
    }

    /** True for {@code cm2} and {@code cm**2}. */
    public boolean isSquareCentimetres() {
        String u = areaUnit.trim().toLowerCase(Locale.ROOT);
        return u.equals("cm2") || u.equals("cm**2") || u.equals("cm^2");
    }

    public CheckResult check() {
        if (effectiveArea.length == 0) {
            return CheckResult.failed("Effective area file has no energy bins");
        }
        if (lowEnergy.length != effectiveArea.length || highEnergy.length != effectiveArea.length) {
            return CheckResult.failed("Effective area columns differ in length");
        }
        return CheckResult.passed();
    }
}
