package com.questrail.spex.convert;

import com.questrail.spex.SpexFixtures;
import com.questrail.spex.config.ConversionConfig;
import com.questrail.spex.mapping.Masks;
import com.questrail.spex.model.Region;
import com.questrail.spex.model.ogip.OgipEffectiveArea;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.observability.ChannelCleaningEvent;
import com.questrail.spex.observability.ConversionStageEvent;
import com.questrail.spex.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OgipRegionConverterTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void zeroBasedInputBecomesAConsistentRegion()
    {
        OgipRegionConverter converter = new OgipRegionConverter(ConversionConfig.defaults(), sink);
        OgipSpectrum source = SpexFixtures.ogipSpectrum(0, Masks.filled(4, 1.0), 100.0).build();

        Region region = converter.convert(source, SpexFixtures.diagonalResponse(4, 0).build(), null, null, null);

        assertTrue(region.check().ok());
        assertArrayEquals(new int[] { 1, 2, 3, 4 }, region.response().firstChannels());
        assertTrue(sink.hasEventOfType(ConversionStageEvent.class));
        assertFalse(sink.hasEventOfType(ChannelCleaningEvent.class));
    }

    @Test
    void badChannelsAreRemovedWhenRequested()
    {
        ConversionConfig config = ConversionConfig.builder().withRemoveBadChannels(true).build();
        OgipRegionConverter converter = new OgipRegionConverter(config, sink);
        OgipResponse response = SpexFixtures.diagonalResponse(3, 1).matrix(new double[] { 1.0, 0.0, 1.0 }).build();
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, new double[] { 1.0, 2.0, 3.0 }, 100.0).build();

        Region region = converter.convert(source, response, null, null, null);

        assertEquals(2, region.channelCount());
        assertArrayEquals(new double[] { 1.0, 3.0 }, region.spectrum().sourceRate(), 1e-12);
        ChannelCleaningEvent event = sink.getCleaningEvents().get(0);
        assertEquals(2, event.goodChannels());
        assertEquals(1, event.badChannels());
        assertEquals(1, event.droppedGroups());
    }

    @Test
    void areaOnTopOfAnRspIsReported()
    {
        OgipRegionConverter converter = new OgipRegionConverter(ConversionConfig.defaults(), sink);
        OgipResponse rsp = SpexFixtures.diagonalResponse(2, 1).areaIncluded(true).build();
        OgipEffectiveArea area = new OgipEffectiveArea(SpexFixtures.lowerEnergies(2), SpexFixtures.upperEnergies(2),
                new double[] { 1.0, 1.0 }, "keV", "cm**2", 0, 0);
        OgipSpectrum source = SpexFixtures.ogipSpectrum(1, Masks.filled(2, 1.0), 100.0).build();

        converter.convert(source, rsp, null, null, area);

        assertTrue(sink.hasWarningContaining("already includes the effective area"));
    }
}
