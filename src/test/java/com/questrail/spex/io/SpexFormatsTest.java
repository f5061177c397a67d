package com.questrail.spex.io;

import com.questrail.spex.SpexFixtures;
import com.questrail.spex.api.ArrayLengthMismatchException;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.Spectrum.Quantity;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.ColumnType;
import com.questrail.spex.table.InMemoryTabularStore;
import com.questrail.spex.table.Table;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SpexFormatsTest
{
    @Test
    void spectrumTablesCarryRegionsAndUnits()
    {
        Spectrum s = SpexFixtures.spexSpectrum(3).concatenate(SpexFixtures.spexSpectrum(2), 1);
        InMemoryTabularStore store = new InMemoryTabularStore();

        SpoFormat.write(s, store);

        assertArrayEquals(new int[] { 3, 2 }, store.read(SpoFormat.REGIONS_TABLE).column("NCHAN").asInts());
        Table t = store.read(SpoFormat.SPECTRUM_TABLE);
        assertEquals(5, t.rowCount());
        assertEquals("keV", t.column("Lower_Energy").unit().orElseThrow());
        assertEquals(ColumnType.DOUBLE, t.column("Lower_Energy").type());
        assertEquals(ColumnType.FLOAT, t.column("Source_Rate").type());
        assertFalse(t.hasColumn("Exp_Rate"));

        Spectrum back = SpoFormat.read(store);
        assertArrayEquals(s.channelsPerRegion(), back.channelsPerRegion());
        assertArrayEquals(s.sourceRateError(), back.sourceRateError());
        assertArrayEquals(new double[] { 1, 1, 1, 1, 1 }, back.backscaleRatio());
        assertFalse(back.backscaleRatioPresent());
    }

    @Test
    void expRateIsWrittenOnlyWhenPresent()
    {
        Spectrum s = SpexFixtures.spexSpectrum(2).toBuilder()
                .set(Quantity.BACKSCALE_RATIO, new double[] { 0.5, 0.25 })
                .backscaleRatioPresent(true)
                .build();
        InMemoryTabularStore store = new InMemoryTabularStore();

        SpoFormat.write(s, store);
        Spectrum back = SpoFormat.read(store);

        assertTrue(back.backscaleRatioPresent());
        assertArrayEquals(new double[] { 0.5, 0.25 }, back.backscaleRatio());
    }

    @Test
    void invalidSpectrumIsNotWritten()
    {
        Spectrum broken = SpexFixtures.spexSpectrum(2).toBuilder()
                .set(Quantity.SOURCE_RATE_ERROR, new double[] { -1.0, 0.0 })
                .build();
        InMemoryTabularStore store = new InMemoryTabularStore();

        assertThrows(ArrayLengthMismatchException.class, () -> SpoFormat.write(broken, store));
        assertTrue(store.tableNames().isEmpty());
    }

    @Test
    void responseTablesCarryCountsAndFlags()
    {
        ResponseMatrix m = ResponseMatrix.empty()
                .appendAllComponents(SpexFixtures.diagonalMatrix(3, 0.5), 1, 1)
                .appendAllComponents(SpexFixtures.diagonalMatrix(2, 0.25), 2, 1);
        InMemoryTabularStore store = new InMemoryTabularStore();

        ResFormat.write(m, store);

        Table icomp = store.read(ResFormat.COMPONENT_TABLE);
        assertEquals(2, icomp.header().getInt("NSECTOR").orElseThrow());
        assertEquals(1, icomp.header().getInt("NREGION").orElseThrow());
        assertEquals(2, icomp.header().getInt("NCOMP").orElseThrow());
        assertFalse(icomp.header().getBoolean("AREASCAL").orElseThrow());
        assertFalse(store.read(ResFormat.GROUP_TABLE).hasColumn("RELAREA"));

        ResponseMatrix back = ResFormat.read(store);
        assertArrayEquals(m.sectors(), back.sectors());
        assertArrayEquals(m.firstChannels(), back.firstChannels());
        assertArrayEquals(m.values(), back.values());
        assertTrue(back.check().ok());
    }

    @Test
    void legacyResponseColumnNamesAreAccepted()
    {
        ResponseMatrix m = SpexFixtures.diagonalMatrix(2, 1.0).toBuilder()
                .derivatives(new double[] { 0.1, 0.2 })
                .build();
        InMemoryTabularStore store = new InMemoryTabularStore();
        ResFormat.write(m, store);
        store.write(Table.builder(ResFormat.RESPONSE_TABLE)
                .column(Column.ofDoubles("RESP", ColumnType.FLOAT, new double[] { 1.0, 1.0 }))
                .column(Column.ofDoubles("DRESP", ColumnType.FLOAT, new double[] { 0.1, 0.2 }))
                .build());

        ResponseMatrix back = ResFormat.read(store);
        assertTrue(back.hasResponseDerivative());
        assertArrayEquals(new double[] { 0.1, 0.2 }, back.derivatives());
    }
}
