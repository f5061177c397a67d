package com.questrail.spex.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConversionConfigTest
{
    @Test
    void defaultsMatchTheConverterConventions()
    {
        ConversionConfig c = ConversionConfig.defaults();

        assertFalse(c.keepGrouping());
        assertFalse(c.removeBadChannels());
        assertFalse(c.writeExpRate());
        assertFalse(c.overwrite());
        assertTrue(c.forcePoissonErrors());
        assertTrue(c.subtractBackground());
        assertEquals(1.0E-5, c.spectrumEnergyFloor());
        assertEquals(1.0E-7, c.modelEnergyFloor());
        assertTrue(c.history().isEmpty());
    }

    @Test
    void nonPositiveFloorsAreRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> ConversionConfig.builder().withSpectrumEnergyFloor(0.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ConversionConfig.builder().withModelEnergyFloor(-1.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ConversionConfig.builder().withModelEnergyFloor(Double.NaN).build());
    }

    @Test
    void toBuilderKeepsEverySetting()
    {
        ConversionConfig c = ConversionConfig.builder()
                .withKeepGrouping(true)
                .withRemoveBadChannels(true)
                .withOverwrite(true)
                .withForcePoissonErrors(false)
                .withHistory(List.of("converted by hand"))
                .build();

        assertEquals(c, c.toBuilder().build());
        assertTrue(c.toBuilder().withWriteExpRate(true).build().writeExpRate());
    }

    @Test
    void historyIsCopied()
    {
        List<String> lines = new ArrayList<>(List.of("first"));
        ConversionConfig c = ConversionConfig.builder().withHistory(lines).build();
        lines.add("second");

        assertEquals(List.of("first"), c.history());
        assertThrows(UnsupportedOperationException.class, () -> c.history().add("third"));
    }
}
