package com.questrail.spex.io;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.model.ogip.OgipTypeIISpectrum;
import com.questrail.spex.observability.RecordingObservabilitySink;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.ColumnType;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.InMemoryTabularStore;
import com.questrail.spex.table.Table;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class Pha2FormatTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private static InMemoryTabularStore store(boolean withStatErr, boolean withBackground) {
        Table.Builder t = Table.builder("SPECTRUM")
                .header(Header.builder()
                        .put("HDUCLAS3", "COUNT")
                        .put("EXPOSURE", 10.0)
                        .put("BACKSCUP", 2.0)
                        .put("BACKSCDN", 3.0)
                        .put("TELESCOP", "CHANDRA")
                        .put("INSTRUME", "ACIS")
                        .put("GRATING", "HETG")
                        .build())
                .column(Column.ofInts("TG_M", ColumnType.SHORT, new int[] { -1, 1 }))
                .column(Column.ofInts("TG_PART", ColumnType.SHORT, new int[] { 2, 2 }))
                .column(Column.ofIntRows("CHANNEL", ColumnType.SHORT, new int[][] { { 1, 2 }, { 1, 2 } }, false))
                .column(Column.ofDoubleRows("COUNTS", ColumnType.FLOAT, new double[][] { { 40.0, 90.0 }, { 10.0, 0.0 } }, false));
        if (withStatErr) {
            t.column(Column.ofDoubleRows("STAT_ERR", ColumnType.FLOAT, new double[][] { { 2.0, 3.0 }, { 1.0, 1.0 } }, false));
        }
        if (withBackground) {
            t.column(Column.ofDoubleRows("BACKGROUND_UP", ColumnType.FLOAT, new double[][] { { 1.0, 2.0 }, { 0.0, 0.0 } }, false))
                    .column(Column.ofDoubleRows("BACKGROUND_DOWN", ColumnType.FLOAT, new double[][] { { 3.0, 2.0 }, { 0.0, 1.0 } }, false));
        }
        InMemoryTabularStore store = new InMemoryTabularStore();
        store.write(t.build());
        return store;
    }

    @Test
    void oneOrderPerRow()
    {
        OgipTypeIISpectrum pha2 = Pha2Format.read(store(true, true), true, true, sink);

        assertEquals(2, pha2.spectrumCount());
        assertEquals("HETG", pha2.grating());
        OgipTypeIISpectrum.Order minusOne = pha2.orders().get(0);
        assertEquals(-1, minusOne.order());
        assertEquals(2, minusOne.part());

        OgipSpectrum s = minusOne.spectrum();
        assertArrayEquals(new double[] { 4.0, 9.0 }, s.rates(), 1e-12);
        assertArrayEquals(new double[] { Math.sqrt(0.4), Math.sqrt(0.9) }, s.statErrors(), 1e-12);

        OgipTypeIISpectrum.OrderBackground b = minusOne.background().orElseThrow();
        assertArrayEquals(new double[] { 0.4, 0.4 }, b.rates(), 1e-12);
        assertEquals(5.0, b.backScaling());
    }

    @Test
    void statErrColumnIsUsedWithoutForcedPoisson()
    {
        OgipTypeIISpectrum pha2 = Pha2Format.read(store(true, false), false, false, sink);

        assertArrayEquals(new double[] { 0.2, 0.3 }, pha2.orders().get(0).spectrum().statErrors(), 1e-6);
        assertTrue(pha2.orders().get(0).background().isEmpty());
    }

    @Test
    void statErrIsRequiredWithoutPoissonErrors()
    {
        assertThrows(FormatException.class, () -> Pha2Format.read(store(false, false), false, false, sink));
    }

    @Test
    void missingBackgroundColumnsAreAWarning()
    {
        OgipTypeIISpectrum pha2 = Pha2Format.read(store(false, false), true, true, sink);

        assertTrue(pha2.orders().get(1).background().isEmpty());
        assertTrue(sink.hasWarningContaining("BACKGROUND_UP"));
    }
}
