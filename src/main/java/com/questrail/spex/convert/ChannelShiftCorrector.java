package com.questrail.spex.convert;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionWarningEvent;

import java.util.Objects;

/**
 * ChannelShiftCorrector
 * -----------------------------------------------------------------------------
 * Detects an off-by-N channel numbering in responses whose channels start at
 * 0 and shifts the converted matrix so that it lines up with the converted
 * spectrum.
 *
 * <h2>Detection</h2>
 * The first energy bin of the OGIP matrix that has a group gives a reference
 * model energy (its midpoint) and a reference channel (its first group's
 * F_CHAN) with that channel's mid energy. In the converted objects the
 * target group is the first whose energy bin contains the model energy and
 * the target channel the first whose bounds contain the channel energy. The
 * shift is the difference between the 1-based target channel and the
 * target group's first channel.
 */
public final class ChannelShiftCorrector
{
    private final ConversionObservabilitySink sink;

    public ChannelShiftCorrector(ConversionObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Shift that aligns {@code converted} with {@code spectrum}.
     *
     * @throws FormatException if a reference bin, channel or target cannot be found
     */
    public int detectShift(OgipResponse source, ResponseMatrix converted, Spectrum spectrum) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(converted, "converted");
        Objects.requireNonNull(spectrum, "spectrum");

        int[] groupsPerBin = source.groupsPerBin();
        int bin = -1;
        for (int i = 0; i < groupsPerBin.length; i++) {
            if (groupsPerBin[i] > 0) {
                bin = i;
                break;
            }
        }
        if (bin < 0) {
            throw new FormatException("Response matrix has no groups; cannot detect a channel shift");
        }
        double modelEnergy = (source.lowEnergy()[bin] + source.highEnergy()[bin]) / 2.0;

        // groups of earlier bins are empty, so the bin's first group is group 0
        int fchan = source.groupFirstChannel()[0];
        int[] channels = source.channels();
        int j = -1;
        for (int i = 0; i < channels.length; i++) {
            if (channels[i] == fchan) {
                j = i;
                break;
            }
        }
        if (j < 0) {
            throw new FormatException("First group channel " + fchan + " not listed in EBOUNDS");
        }
        double channelEnergy = (source.channelLowEnergy()[j] + source.channelHighEnergy()[j]) / 2.0;

        double[] eg1 = converted.lowEnergies();
        double[] eg2 = converted.highEnergies();
        int s = -1;
        for (int i = 0; i < eg1.length; i++) {
            if (eg1[i] < modelEnergy && eg2[i] > modelEnergy) {
                s = i;
                break;
            }
        }
        if (s < 0) {
            throw new FormatException("No response group contains model energy " + modelEnergy + " keV");
        }

        double[] lower = spectrum.lowerEnergy();
        double[] upper = spectrum.upperEnergy();
        int t = -1;
        for (int i = 0; i < lower.length; i++) {
            if (lower[i] < channelEnergy && upper[i] > channelEnergy) {
                t = i;
                break;
            }
        }
        if (t < 0) {
            throw new FormatException("No spectrum channel contains energy " + channelEnergy + " keV");
        }
        return t + 1 - converted.firstChannels()[s];
    }

    /**
     * Runs {@link #detectShift} and applies a non-zero shift.
     *
     * <p>Only responses whose first channel is 0 are examined. Swapped
     * spectra are left alone with a warning.</p>
     */
    public ResponseMatrix detectAndCorrectShift(OgipResponse source,
                                                ConvertedResponse converted,
                                                ConvertedSpectrum spectrum) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(converted, "converted");
        Objects.requireNonNull(spectrum, "spectrum");
        if (source.firstChannel() != 0) {
            return converted.response();
        }
        if (spectrum.swapped()) {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                    "Not auto-detecting shifts in the response array for swapped channel order"));
            return converted.response();
        }
        int delta = detectShift(source, converted.response(), spectrum.spectrum());
        if (delta == 0) {
            return converted.response();
        }
        sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                "Shift in response array detected; shifting channel indices by " + delta));
        return converted.response().shiftChannels(delta);
    }
}
