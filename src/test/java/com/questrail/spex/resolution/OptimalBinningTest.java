package com.questrail.spex.resolution;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OptimalBinningTest
{
    @Test
    void fewCountsGiveFwhmWideBins()
    {
        assertEquals(1.0, OptimalBinning.dataBinFraction(1.0, 1.0));
        assertEquals(1.0, OptimalBinning.dataBinFraction(0.0, 0.0));
        // x = ln(8) = 2.079 stays below the threshold
        assertEquals(1.0, OptimalBinning.dataBinFraction(8.0, 1.0));
    }

    @Test
    void manyCountsFollowTheApproximation()
    {
        double x = Math.log(1.0E6 * (1.0 + 0.2 * Math.log(100.0)));
        double expected = 0.08 + 7.0 / x + 1.8 / (x * x);

        assertEquals(expected, OptimalBinning.dataBinFraction(1.0E6, 100.0), 1e-12);
        assertTrue(OptimalBinning.dataBinFraction(1.0E6, 100.0) < OptimalBinning.dataBinFraction(1.0E3, 100.0));
    }

    @Test
    void modelBinsShrinkWithTheFourthRootOfCounts()
    {
        assertEquals(0.65, OptimalBinning.modelBinFraction(1.0), 1e-12);
        assertEquals(0.065, OptimalBinning.modelBinFraction(1.0E4), 1e-12);
    }

    @Test
    void widthsScaleWithTheFwhm()
    {
        ResolutionElement element = new ResolutionElement(1.0, 1.5, 1.25, 1.0, 0.5, 0.1);

        OptimalBinning.BinWidths w = OptimalBinning.widths(element, 1.0, 1.0);
        assertEquals(0.5, w.dataBinWidth(), 1e-12);
        assertEquals(0.325, w.modelBinWidth(), 1e-12);

        OptimalBinning.BinWidths none = OptimalBinning.widths(ResolutionElement.degenerate(1.0, 1.1), 100.0, 10.0);
        assertEquals(0.0, none.dataBinWidth());
        assertEquals(0.0, none.modelBinWidth());
    }
}
