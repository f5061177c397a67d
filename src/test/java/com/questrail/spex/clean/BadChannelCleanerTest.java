package com.questrail.spex.clean;

import com.questrail.spex.SpexFixtures;
import com.questrail.spex.api.ArrayLengthMismatchException;
import com.questrail.spex.api.SectorRegion;
import com.questrail.spex.mapping.Masks;
import com.questrail.spex.model.Region;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.Spectrum.Flag;
import com.questrail.spex.observability.ChannelCleaningEvent;
import com.questrail.spex.observability.ClockedObservabilitySink;
import com.questrail.spex.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class BadChannelCleanerTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final BadChannelCleaner cleaner = new BadChannelCleaner(sink);

    @Test
    void cleaningEventTakesItsTimeFromTheSinkClock()
    {
        Instant at = Instant.parse("2024-03-01T12:00:00Z");
        BadChannelCleaner clocked = new BadChannelCleaner(
                new ClockedObservabilitySink(sink, Clock.fixed(at, ZoneOffset.UTC)));

        clocked.clean(new Region(SpexFixtures.spexSpectrum(3), SpexFixtures.diagonalMatrix(3, 1.0), "pn"));

        assertEquals(at, sink.getCleaningEvents().get(0).timestamp());
    }

    @Test
    void channelWithoutResponseIsRemoved()
    {
        ResponseMatrix m = SpexFixtures.diagonalMatrix(4, 1.0).toBuilder()
                .values(new double[] { 1.0, 0.0, 1.0, 1.0 })
                .build();
        Region region = new Region(SpexFixtures.spexSpectrum(4), m, "pn");

        Region cleaned = cleaner.clean(region);

        assertEquals(3, cleaned.channelCount());
        assertEquals("pn", cleaned.label());
        assertArrayEquals(new int[] { 3 }, cleaned.response().componentChannelCounts());
        assertArrayEquals(new int[] { 3 }, cleaned.response().componentGroupCounts());
        assertArrayEquals(new int[] { 1, 2, 3 }, cleaned.response().firstChannels());
        assertArrayEquals(new double[] { 1.1, 1.3, 1.4 }, cleaned.spectrum().upperEnergy(), 1e-12);

        ChannelCleaningEvent event = sink.getCleaningEvents().get(0);
        assertEquals(SectorRegion.of(1, 1), event.region());
        assertEquals(1, event.badChannels());
        assertEquals(1, event.droppedElements());
        assertTrue(event.changed());
    }

    @Test
    void unusedChannelsAreRemovedFromWideGroups()
    {
        ResponseMatrix m = ResponseMatrix.builder()
                .components(new int[] { 4 }, new int[] { 1 }, new int[] { 1 }, new int[] { 1 })
                .groups(new double[] { 1.0 }, new double[] { 2.0 }, new int[] { 1 }, new int[] { 4 }, new int[] { 4 })
                .values(new double[] { 0.1, 0.2, 0.3, 0.4 })
                .derivatives(new double[] { 1.0, 2.0, 3.0, 4.0 })
                .build();
        Spectrum s = SpexFixtures.spexSpectrum(4).toBuilder()
                .set(Flag.USED, new boolean[] { true, false, true, true })
                .build();

        Region cleaned = cleaner.clean(new Region(s, m));

        ResponseMatrix r = cleaned.response();
        assertArrayEquals(new int[] { 1 }, r.firstChannels());
        assertArrayEquals(new int[] { 3 }, r.lastChannels());
        assertArrayEquals(new double[] { 0.1, 0.3, 0.4 }, r.values());
        assertArrayEquals(new double[] { 1.0, 3.0, 4.0 }, r.derivatives());
    }

    @Test
    void cleanRegionIsUnchanged()
    {
        Region region = SpexFixtures.diagonalRegion(3);

        Region cleaned = cleaner.clean(region);

        assertArrayEquals(region.response().values(), cleaned.response().values());
        assertFalse(sink.getCleaningEvents().get(0).changed());
    }

    @Test
    void multiRegionSpectraAreRejected()
    {
        Spectrum two = SpexFixtures.spexSpectrum(2).concatenate(SpexFixtures.spexSpectrum(2), 1);
        assertThrows(ArrayLengthMismatchException.class,
                () -> cleaner.clean(new Region(two, SpexFixtures.diagonalMatrix(4, 1.0))));
        assertThrows(ArrayLengthMismatchException.class,
                () -> cleaner.clean(new Region(SpexFixtures.spexSpectrum(3), SpexFixtures.diagonalMatrix(2, 1.0))));
    }

    @Test
    void randomMatricesStayConsistent()
    {
        Random random = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            int n = 2 + random.nextInt(20);
            int bins = 1 + random.nextInt(15);
            List<Integer> first = new ArrayList<>();
            List<Integer> count = new ArrayList<>();
            List<Double> values = new ArrayList<>();
            boolean[] responding = new boolean[n];
            for (int b = 0; b < bins; b++) {
                int f = 1 + random.nextInt(n);
                int c = random.nextInt(n - f + 2);
                first.add(f);
                count.add(c);
                for (int j = 0; j < c; j++) {
                    double v = random.nextInt(3) == 0 ? 0.0 : random.nextDouble();
                    values.add(v);
                    if (v > 0.0) {
                        responding[f - 1 + j] = true;
                    }
                }
            }
            boolean[] used = new boolean[n];
            for (int i = 0; i < n; i++) {
                used[i] = random.nextInt(4) != 0;
            }

            int[] ic1 = first.stream().mapToInt(Integer::intValue).toArray();
            int[] nc = count.stream().mapToInt(Integer::intValue).toArray();
            int[] ic2 = new int[bins];
            for (int b = 0; b < bins; b++) {
                ic2[b] = ic1[b] + nc[b] - 1;
            }
            ResponseMatrix m = ResponseMatrix.builder()
                    .components(new int[] { n }, new int[] { bins }, new int[] { 1 }, new int[] { 1 })
                    .groups(SpexFixtures.lowerEnergies(bins), SpexFixtures.upperEnergies(bins), ic1, ic2, nc)
                    .values(values.stream().mapToDouble(Double::doubleValue).toArray())
                    .build();
            Spectrum s = SpexFixtures.spexSpectrum(n).toBuilder().set(Flag.USED, used).build();
            assertTrue(m.check().ok(), m.check().message());

            Region cleaned = cleaner.clean(new Region(s, m));

            int expected = 0;
            for (int i = 0; i < n; i++) {
                if (responding[i] && used[i]) {
                    expected++;
                }
            }
            assertEquals(expected, cleaned.channelCount());
            assertTrue(cleaned.check().ok(), cleaned.check().message());
            ResponseMatrix r = cleaned.response();
            assertEquals(Masks.sum(r.groupChannelCounts()), r.valueCount());
            for (int g = 0; g < r.groupCount(); g++) {
                assertTrue(r.groupChannelCounts()[g] > 0);
            }
        }
    }
}
