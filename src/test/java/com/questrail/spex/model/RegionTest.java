package com.questrail.spex.model;

import com.questrail.spex.SpexFixtures;
import com.questrail.spex.api.SectorRegion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RegionTest
{
    @Test
    void channelCountsMustAgree()
    {
        assertTrue(SpexFixtures.diagonalRegion(3).check().ok());

        Region mismatched = new Region(SpexFixtures.spexSpectrum(3), SpexFixtures.diagonalMatrix(2, 1.0));
        assertTrue(mismatched.check().failed());
        assertTrue(mismatched.check().message().contains("not equal"));
    }

    @Test
    void multiRegionSpectrumIsRejected()
    {
        Spectrum two = SpexFixtures.spexSpectrum(2).concatenate(SpexFixtures.spexSpectrum(2), 1);
        assertTrue(new Region(two, SpexFixtures.diagonalMatrix(2, 1.0)).check().failed());
    }

    @Test
    void withKeyRelabelsEveryComponent()
    {
        Region r = SpexFixtures.diagonalRegion(2).withLabel("RGS1").withKey(SectorRegion.of(2, 5));
        assertEquals("RGS1", r.label());
        assertEquals(List.of(SectorRegion.of(2, 5)), r.response().regionKeys());
        assertEquals("", new Region(Spectrum.empty(), ResponseMatrix.empty(), null).label());
    }
}
