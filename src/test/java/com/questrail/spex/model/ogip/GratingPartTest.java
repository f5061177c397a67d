package com.questrail.spex.model.ogip;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GratingPartTest
{
    @Test
    void parsesArmAndInstrumentNames()
    {
        assertEquals(GratingPart.HEG, GratingPart.parse("heg"));
        assertEquals(GratingPart.MEG, GratingPart.parse(" METG "));
        assertEquals(GratingPart.LEG, GratingPart.parse("LETG"));
        assertThrows(IllegalArgumentException.class, () -> GratingPart.parse("RGS"));
    }

    @Test
    void codesMatchTheTgPartColumn()
    {
        assertEquals(GratingPart.MEG, GratingPart.fromCode(2));
        assertEquals(3, GratingPart.LEG.code());
        assertThrows(IllegalArgumentException.class, () -> GratingPart.fromCode(0));
    }
}
