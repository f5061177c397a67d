package com.questrail.spex.table.fits;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FitsHeaderCodecTest
{
    @Test
    void cardTextBecomesTypedValues()
    {
        assertEquals(Boolean.TRUE, FitsHeaderCodec.parseValue("T"));
        assertEquals(Boolean.FALSE, FitsHeaderCodec.parseValue("F"));
        assertEquals(-42L, FitsHeaderCodec.parseValue("-42"));
        assertEquals(1.5e3, FitsHeaderCodec.parseValue("1.5D3"));
        assertEquals(0.25, FitsHeaderCodec.parseValue("0.25"));
        assertEquals("(1, 2)", FitsHeaderCodec.parseValue("(1, 2)"));
    }

    @Test
    void longCommentaryIsSplitIntoCards()
    {
        String line = "x".repeat(150);

        List<String> chunks = FitsHeaderCodec.chunks(line);

        assertEquals(3, chunks.size());
        assertEquals(line, String.join("", chunks));
        assertEquals(List.of("short"), FitsHeaderCodec.chunks("short"));
        assertTrue(FitsHeaderCodec.STRUCTURAL.matcher("TZERO12").matches());
        assertFalse(FitsHeaderCodec.STRUCTURAL.matcher("EXPOSURE").matches());
    }
}
