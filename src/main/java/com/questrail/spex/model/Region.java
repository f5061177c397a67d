package com.questrail.spex.model;

import com.questrail.spex.api.CheckResult;
import com.questrail.spex.api.SectorRegion;

import java.util.Objects;

/**
 * One spectrum paired with the response component(s) that describe it.
 *
 * <p>The spectrum holds exactly one region and every response component has
 * the same channel count as that spectrum; {@link #check()} verifies both.
 * The label is free text (an instrument or annulus name) and is never
 * written to file.</p>
 */
public record Region(Spectrum spectrum, ResponseMatrix response, String label)
{
    public Region {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(response, "response");
        label = Objects.requireNonNullElse(label, "");
    }

    public Region(Spectrum spectrum, ResponseMatrix response) {
        this(spectrum, response, "");
    }

    public Region withLabel(String label) {
        return new Region(spectrum, response, label);
    }

    /**
     * Copy whose response components all carry {@code key}.
     */
    public Region withKey(SectorRegion key) {
        return new Region(spectrum, response.relabel(key.sector(), key.region()), label);
    }

    public int channelCount() {
        return spectrum.channelCount();
    }

    /**
     * Verifies that the spectrum is a single region whose channel count
     * matches every response component, then checks both halves.
     */
    public CheckResult check() {
        if (spectrum.regionCount() != 1) {
            return CheckResult.failed("Region spectrum holds " + spectrum.regionCount() + " regions, expected 1");
        }
        int nchan = spectrum.channelCount();
        for (int n : response.componentChannelCounts()) {
            if (n != nchan) {
                return CheckResult.failed("Number of channels in spectrum (" + nchan
                        + ") is not equal to number of channels in response (" + n + ")");
            }
        }
        CheckResult spo = spectrum.check();
        if (spo.failed()) {
            return spo;
        }
        return response.check();
    }
}
