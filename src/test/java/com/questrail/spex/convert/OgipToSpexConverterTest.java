package com.questrail.spex.convert;

import com.questrail.spex.SpexFixtures;
import com.questrail.spex.api.DiscontinuousEnergyGridException;
import com.questrail.spex.api.IncompatibleMatrixException;
import com.questrail.spex.api.IncompatibleSpectrumException;
import com.questrail.spex.config.ConversionConfig;
import com.questrail.spex.mapping.Masks;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.ogip.OgipEffectiveArea;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OgipToSpexConverterTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final OgipToSpexConverter converter = new OgipToSpexConverter(ConversionConfig.defaults(), sink);

    private static double[] reversed(double[] values) {
        return Masks.reversed(values);
    }

    @Test
    void sourceRatesAndExposurePassThrough()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(3, 0.01), 1000.0)
                .statErrors(Masks.filled(3, 0.001))
                .build();

        ConvertedSpectrum converted = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(3, 1).build(), null, null, false);
        Spectrum s = converted.spectrum();

        assertFalse(converted.swapped());
        assertArrayEquals(new double[] { 1000.0, 1000.0, 1000.0 }, s.exposureTime(), 1e-9);
        assertArrayEquals(Masks.filled(3, 0.01), s.sourceRate(), 1e-12);
        assertArrayEquals(Masks.filled(3, 0.001), s.sourceRateError(), 1e-12);
        assertArrayEquals(new double[3], s.backgroundRate());
        assertArrayEquals(SpexFixtures.lowerEnergies(3), s.lowerEnergy());
        assertArrayEquals(Masks.filled(3, true), s.used());
        assertFalse(s.backscaleRatioPresent());
    }

    @Test
    void backgroundIsSubtractedAndErrorsAddInQuadrature()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 1.0), 1000.0)
                .statErrors(Masks.filled(2, 0.1))
                .build();
        OgipSpectrum background = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 0.01), 10000.0)
                .statErrors(Masks.filled(2, 0.01))
                .build();

        Spectrum s = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(2, 1).build(), background, null, false).spectrum();

        assertArrayEquals(Masks.filled(2, 0.99), s.sourceRate(), 1e-12);
        assertArrayEquals(Masks.filled(2, 0.01), s.backgroundRate(), 1e-12);
        assertArrayEquals(Masks.filled(2, Math.sqrt(0.01 + 0.0001)), s.sourceRateError(), 1e-12);
        assertArrayEquals(Masks.filled(2, 0.01), s.backgroundRateError(), 1e-12);
        assertArrayEquals(Masks.filled(2, 10.0), s.backscaleRatio(), 1e-9);
    }

    @Test
    void backgroundIsScaledByTheExtractionAreas()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(1, 1.0), 100.0).build();
        OgipSpectrum background = SpexFixtures.ogipSpectrum(1, Masks.filled(1, 0.5), 100.0)
                .backScaling(Masks.filled(1, 10.0))
                .build();

        Spectrum s = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(1, 1).build(), background, null, false).spectrum();

        assertEquals(0.95, s.sourceRate()[0], 1e-12);
        assertEquals(10.0, s.backscaleRatio()[0], 1e-9);
    }

    @Test
    void correctionIsSubtractedWithItsScale()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(1, 1.0), 100.0).build();
        OgipSpectrum correction = SpexFixtures.ogipSpectrum(1, Masks.filled(1, 0.2), 100.0)
                .correctionScale(0.5)
                .build();

        Spectrum s = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(1, 1).build(), null, correction, false).spectrum();

        assertEquals(0.9, s.sourceRate()[0], 1e-12);
        assertEquals(0.1, s.backgroundRate()[0], 1e-12);
    }

    @Test
    void channelsWithoutExposureGetNoBackgroundOrCorrection()
    {
        double[] scaling = { 1.0, 0.0, 1.0 };
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(3, 1.0), 100.0)
                .statErrors(Masks.filled(3, 0.1))
                .areaScaling(scaling)
                .build();
        OgipSpectrum background = SpexFixtures.ogipSpectrum(1, Masks.filled(3, 0.2), 100.0)
                .statErrors(Masks.filled(3, 0.02))
                .areaScaling(scaling)
                .build();
        OgipSpectrum correction = SpexFixtures.ogipSpectrum(1, Masks.filled(3, 0.1), 100.0)
                .areaScaling(scaling)
                .correctionScale(0.5)
                .build();

        Spectrum s = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(3, 1).build(), background, correction, false).spectrum();

        assertTrue(s.check().ok());
        assertEquals(0.0, s.exposureTime()[1]);
        assertEquals(0.0, s.sourceRate()[1]);
        assertEquals(0.0, s.sourceRateError()[1]);
        assertEquals(0.0, s.backgroundRate()[1]);
        assertEquals(0.0, s.backgroundRateError()[1]);
        assertEquals(0.0, s.backscaleRatio()[1]);
        assertEquals(0.75, s.sourceRate()[0], 1e-12);
        assertEquals(0.75, s.sourceRate()[2], 1e-12);
        for (double v : s.sourceRate()) {
            assertTrue(Double.isFinite(v));
        }
    }

    @Test
    void backgroundWithoutAreaIsIgnored()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 1.0), 100.0).build();
        OgipSpectrum background = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 0.5), 100.0)
                .areaScaling(new double[] { 0.0, 1.0 })
                .build();

        Spectrum s = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(2, 1).build(), background, null, false).spectrum();

        assertArrayEquals(new double[] { 1.0, 0.5 }, s.sourceRate(), 1e-12);
        assertArrayEquals(new double[] { 0.0, 0.5 }, s.backgroundRate(), 1e-12);
    }

    @Test
    void badQualityChannelsAreNotUsed()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(3, 1.0), 100.0)
                .quality(new int[] { 0, 5, 0 })
                .build();

        Spectrum s = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(3, 1).build(), null, null, false).spectrum();

        assertArrayEquals(new boolean[] { true, false, true }, s.used());
    }

    @Test
    void groupingBecomesBinFlags()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(4, 1.0), 100.0)
                .grouping(new int[] { 1, -1, -1, 1 })
                .build();

        Spectrum grouped = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(4, 1).build(), null, null, true).spectrum();
        Spectrum ungrouped = converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(4, 1).build(), null, null, false).spectrum();

        assertArrayEquals(new boolean[] { true, false, false, true }, grouped.firstOfBin());
        assertArrayEquals(new boolean[] { false, false, true, true }, grouped.lastOfBin());
        assertArrayEquals(Masks.filled(4, true), ungrouped.firstOfBin());
    }

    @Test
    void wavelengthOrderedChannelsAreSwapped()
    {
        OgipResponse response = SpexFixtures.diagonalResponse(3, 1)
                .channelBounds(SpexFixtures.channels(3, 1),
                        reversed(SpexFixtures.lowerEnergies(3)), reversed(SpexFixtures.upperEnergies(3)))
                .build();
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, new double[] { 1.0, 2.0, 3.0 }, 100.0).build();

        ConvertedSpectrum spectrum = converter.convertSpectrum(source, response, null, null, false);
        ConvertedResponse matrix = converter.convertResponse(response, null);

        assertTrue(spectrum.swapped());
        assertTrue(matrix.swapped());
        assertArrayEquals(new double[] { 3.0, 2.0, 1.0 }, spectrum.spectrum().sourceRate(), 1e-12);
        assertArrayEquals(SpexFixtures.lowerEnergies(3), spectrum.spectrum().lowerEnergy(), 1e-12);
        assertArrayEquals(new int[] { 3, 2, 1 }, matrix.response().firstChannels());
    }

    @Test
    void zeroChannelEnergyIsRaisedToTheFloor()
    {
        double[] lower = SpexFixtures.lowerEnergies(2);
        lower[0] = 0.0;
        OgipResponse response = SpexFixtures.diagonalResponse(2, 1)
                .channelBounds(SpexFixtures.channels(2, 1), lower, SpexFixtures.upperEnergies(2))
                .build();
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 1.0), 100.0).build();

        Spectrum s = converter.convertSpectrum(source, response, null, null, false).spectrum();

        assertEquals(ConversionConfig.DEFAULT_SPECTRUM_ENERGY_FLOOR, s.lowerEnergy()[0]);
        assertTrue(sink.hasWarningContaining("Lowest channel boundary energy is 0"));
    }

    @Test
    void mismatchedChannelCountsAreRejected()
    {
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(3, 1.0), 100.0).build();
        OgipSpectrum background = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 1.0), 100.0).build();

        assertThrows(IncompatibleSpectrumException.class, () -> converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(3, 1).build(), background, null, false));
        assertThrows(IncompatibleSpectrumException.class, () -> converter.convertSpectrum(
                source, SpexFixtures.diagonalResponse(2, 1).build(), null, null, false));
    }

    @Test
    void responseIsConvertedToSquareMetres()
    {
        ConvertedResponse converted = converter.convertResponse(SpexFixtures.diagonalResponse(3, 1).build(), null);
        ResponseMatrix m = converted.response();

        assertEquals(1, m.componentCount());
        assertArrayEquals(new int[] { 3 }, m.componentChannelCounts());
        assertArrayEquals(new int[] { 1, 2, 3 }, m.firstChannels());
        assertArrayEquals(new int[] { 1, 2, 3 }, m.lastChannels());
        assertArrayEquals(Masks.filled(3, 1.0E-4), m.values(), 1e-15);
        assertTrue(m.check().ok());
    }

    @Test
    void effectiveAreaMultipliesTheMatrix()
    {
        OgipEffectiveArea area = new OgipEffectiveArea(SpexFixtures.lowerEnergies(3), SpexFixtures.upperEnergies(3),
                new double[] { 100.0, 200.0, 300.0 }, "keV", "cm**2", 0, 0);

        ResponseMatrix m = converter.convertResponse(SpexFixtures.diagonalResponse(3, 1).build(), area).response();

        assertArrayEquals(new double[] { 0.01, 0.02, 0.03 }, m.values(), 1e-12);
    }

    @Test
    void effectiveAreaMustMatchTheEnergyGrid()
    {
        OgipEffectiveArea area = new OgipEffectiveArea(SpexFixtures.lowerEnergies(2), SpexFixtures.upperEnergies(2),
                new double[] { 100.0, 200.0 }, "keV", "cm**2", 0, 0);

        assertThrows(IncompatibleMatrixException.class,
                () -> converter.convertResponse(SpexFixtures.diagonalResponse(3, 1).build(), area));
    }

    @Test
    void modelEnergyFloorAndEmptyBins()
    {
        double[] lo = SpexFixtures.lowerEnergies(2);
        double[] hi = SpexFixtures.upperEnergies(2);
        lo[0] = 0.0;
        OgipResponse response = SpexFixtures.diagonalResponse(2, 1)
                .energyBins(lo, hi, new int[] { 1, 1 })
                .build();

        ResponseMatrix m = converter.convertResponse(response, null).response();
        assertEquals(ConversionConfig.DEFAULT_MODEL_ENERGY_FLOOR, m.lowEnergies()[0]);
        assertTrue(sink.hasWarningContaining("Lowest energy boundary is 0"));

        OgipResponse degenerate = SpexFixtures.diagonalResponse(2, 1)
                .energyBins(new double[] { 1.0, 1.1 }, new double[] { 1.0, 1.2 }, new int[] { 1, 1 })
                .build();
        assertThrows(DiscontinuousEnergyGridException.class, () -> converter.convertResponse(degenerate, null));
    }

    @Test
    void nonKevUnitsAreReported()
    {
        OgipResponse response = SpexFixtures.diagonalResponse(2, 1).energyUnit("eV").build();
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 1.0), 100.0).build();

        converter.convertSpectrum(source, response, null, null, false);

        assertTrue(sink.hasWarningContaining("keV"));
    }
}
