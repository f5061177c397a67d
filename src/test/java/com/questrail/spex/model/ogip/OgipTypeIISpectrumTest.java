package com.questrail.spex.model.ogip;

import com.questrail.spex.SpexFixtures;
import com.questrail.spex.api.FormatException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class OgipTypeIISpectrumTest
{
    private static OgipTypeIISpectrum.Order order(int order, GratingPart part, double[] rates, double[] errors,
                                                  int[] quality, OgipTypeIISpectrum.OrderBackground background) {
        OgipSpectrum s = SpexFixtures.ogipSpectrum(1, rates, 1000.0)
                .statErrors(errors)
                .quality(quality)
                .build();
        return new OgipTypeIISpectrum.Order(s, order, part.code(), Optional.ofNullable(background));
    }

    @Test
    void ordersOfOneArmAreSummed()
    {
        OgipTypeIISpectrum pha2 = new OgipTypeIISpectrum(List.of(
                order(-1, GratingPart.MEG, new double[] { 1.0, 2.0 }, new double[] { 3.0, 0.0 }, new int[] { 0, 0 },
                        new OgipTypeIISpectrum.OrderBackground(new double[] { 0.1, 0.1 }, new double[] { 0.3, 0.0 }, 5.0)),
                order(1, GratingPart.MEG, new double[] { 0.5, 1.0 }, new double[] { 4.0, 0.0 }, new int[] { 0, 1 },
                        new OgipTypeIISpectrum.OrderBackground(new double[] { 0.2, 0.1 }, new double[] { 0.4, 0.0 }, 5.0)),
                order(1, GratingPart.HEG, new double[] { 100.0, 100.0 }, new double[2], new int[2], null)),
                "CHANDRA", "ACIS", "HETG");

        OgipTypeIISpectrum.CombinedOrders combined = pha2.combineOrders(GratingPart.MEG);

        assertEquals(2, combined.orderCount());
        OgipSpectrum source = combined.source();
        assertArrayEquals(new double[] { 1.5, 3.0 }, source.rates(), 1e-12);
        assertEquals(5.0, source.statErrors()[0], 1e-12);
        assertArrayEquals(new int[] { 0, 1 }, source.quality());
        assertArrayEquals(new int[] { 0, 0 }, source.grouping());
        assertArrayEquals(new double[] { 1.0, 1.0 }, source.areaScaling(), 1e-12);

        OgipSpectrum background = combined.background().orElseThrow();
        assertArrayEquals(new double[] { 0.3, 0.2 }, background.rates(), 1e-12);
        assertEquals(0.5, background.statErrors()[0], 1e-12);
        assertArrayEquals(new double[] { 5.0, 5.0 }, background.backScaling(), 1e-12);
        assertEquals(1000.0, background.exposure());
    }

    @Test
    void missingOrSingleOrderArmsCannotBeCombined()
    {
        OgipTypeIISpectrum pha2 = new OgipTypeIISpectrum(List.of(
                order(1, GratingPart.HEG, new double[] { 1.0 }, new double[1], new int[1], null)),
                "CHANDRA", "ACIS", "HETG");

        assertThrows(FormatException.class, () -> pha2.combineOrders(GratingPart.HEG));
        assertThrows(FormatException.class, () -> pha2.combineOrders(GratingPart.LEG));
    }

    @Test
    void ordersMustAgreeInChannelCount()
    {
        OgipTypeIISpectrum pha2 = new OgipTypeIISpectrum(List.of(
                order(-1, GratingPart.LEG, new double[] { 1.0, 1.0 }, new double[2], new int[2], null),
                order(1, GratingPart.LEG, new double[] { 1.0 }, new double[1], new int[1], null)),
                "CHANDRA", "HRC", "LETG");

        assertThrows(FormatException.class, () -> pha2.combineOrders(GratingPart.LEG));
    }
}
