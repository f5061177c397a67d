package com.questrail.spex.io;

import com.questrail.spex.OgipTables;
import com.questrail.spex.api.FormatException;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.observability.RecordingObservabilitySink;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.ColumnType;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.InMemoryTabularStore;
import com.questrail.spex.table.Table;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PhaFormatTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private static InMemoryTabularStore storeWith(Table table) {
        InMemoryTabularStore store = new InMemoryTabularStore();
        store.write(table);
        return store;
    }

    @Test
    void countsAreDividedByExposure()
    {
        Table table = Table.builder("SPECTRUM")
                .header(Header.builder()
                        .put("HDUCLAS3", "COUNT")
                        .put("EXPOSURE", 10.0)
                        .put("POISSERR", false)
                        .build())
                .column(Column.ofInts("CHANNEL", ColumnType.INT, new int[] { 1, 2 }))
                .column(Column.ofDoubles("COUNTS", ColumnType.DOUBLE, new double[] { 10.0, 20.0 }))
                .column(Column.ofDoubles("STAT_ERR", ColumnType.FLOAT, new double[] { 1.0, 2.0 }))
                .build();

        OgipSpectrum s = PhaFormat.read(storeWith(table), sink);

        assertArrayEquals(new double[] { 1.0, 2.0 }, s.rates(), 1e-12);
        assertArrayEquals(new double[] { 0.1, 0.2 }, s.statErrors(), 1e-12);
        assertArrayEquals(new int[] { 0, 0 }, s.quality());
        assertArrayEquals(new double[] { 1.0, 1.0 }, s.backScaling());
        assertEquals(1, s.firstChannel());
        assertTrue(sink.getWarnings().isEmpty());
    }

    @Test
    void poissonErrorsFollowTheRate()
    {
        Table table = Table.builder("SPECTRUM")
                .header(Header.builder()
                        .put("HDUCLAS3", "RATE")
                        .put("EXPOSURE", 100.0)
                        .put("POISSERR", true)
                        .put("BACKSCAL", 0.5)
                        .put("BACKFILE", "none")
                        .put("RESPFILE", "source.rmf")
                        .build())
                .column(Column.ofInts("CHANNEL", ColumnType.INT, new int[] { 0, 1 }))
                .column(Column.ofDoubles("RATE", ColumnType.DOUBLE, new double[] { 4.0, 9.0 }))
                .build();

        OgipSpectrum s = PhaFormat.read(storeWith(table), sink);

        assertArrayEquals(new double[] { 4.0, 9.0 }, s.rates(), 1e-12);
        assertArrayEquals(new double[] { 0.2, 0.3 }, s.statErrors(), 1e-12);
        assertArrayEquals(new double[] { 0.5, 0.5 }, s.backScaling());
        assertTrue(s.backgroundFile().isEmpty());
        assertEquals("source.rmf", s.responseFile().orElseThrow());
        assertEquals(0, s.firstChannel());
    }

    @Test
    void rateColumnIsDetectedWithoutHduclas3()
    {
        Table table = Table.builder("SPECTRUM")
                .header(Header.builder().put("EXPOSURE", 50.0).put("POISSERR", true).build())
                .column(Column.ofInts("CHANNEL", ColumnType.INT, new int[] { 1 }))
                .column(Column.ofDoubles("RATE", ColumnType.DOUBLE, new double[] { 2.0 }))
                .build();

        assertArrayEquals(new double[] { 2.0 }, PhaFormat.read(storeWith(table), sink).rates(), 1e-12);
    }

    @Test
    void missingErrorsAndChannelCountMismatchAreWarnings()
    {
        Table table = Table.builder("SPECTRUM")
                .header(Header.builder()
                        .put("HDUCLAS3", "COUNT")
                        .put("EXPOSURE", 10.0)
                        .put("DETCHANS", 4L)
                        .build())
                .column(Column.ofInts("CHANNEL", ColumnType.INT, new int[] { 1, 2 }))
                .column(Column.ofDoubles("COUNTS", ColumnType.DOUBLE, new double[] { 1.0, 1.0 }))
                .build();

        OgipSpectrum s = PhaFormat.read(storeWith(table), sink);

        assertArrayEquals(new double[2], s.statErrors());
        assertTrue(sink.hasWarningContaining("STAT_ERR"));
        assertTrue(sink.hasWarningContaining("DETCHANS"));
    }

    @Test
    void nonPositiveExposureIsRejected()
    {
        Table table = OgipTables.countsSpectrum(1, new double[] { 1.0 }, 0.0);
        assertThrows(FormatException.class, () -> PhaFormat.read(storeWith(table), sink));
    }

    @Test
    void missingSpectrumTableIsAFormatError()
    {
        assertThrows(FormatException.class, () -> PhaFormat.read(new InMemoryTabularStore(), sink));
    }
}
