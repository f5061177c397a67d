package com.questrail.spex;

import com.questrail.spex.mapping.Masks;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.ColumnType;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.Table;

import java.util.Arrays;

/**
 * Minimal OGIP tables as an instrument pipeline would write them. Channel
 * energies follow {@link SpexFixtures#lowerEnergies(int)}.
 */
public final class OgipTables
{
    private OgipTables() {}

    /**
     * Type I COUNTS spectrum with Poisson errors.
     */
    public static Table countsSpectrum(int firstChannel, double[] counts, double exposure) {
        return Table.builder("SPECTRUM")
                .header(Header.builder()
                        .put("HDUCLAS2", "TOTAL")
                        .put("HDUCLAS3", "COUNT")
                        .put("EXPOSURE", exposure)
                        .put("POISSERR", true)
                        .put("DETCHANS", (long) counts.length)
                        .build())
                .column(Column.ofInts("CHANNEL", ColumnType.INT, SpexFixtures.channels(counts.length, firstChannel)))
                .column(Column.ofDoubles("COUNTS", ColumnType.DOUBLE, counts))
                .build();
    }

    public static Table ebounds(int n, int firstChannel) {
        return Table.builder("EBOUNDS")
                .column(Column.ofInts("CHANNEL", ColumnType.INT, SpexFixtures.channels(n, firstChannel)))
                .column(Column.ofDoubles("E_MIN", ColumnType.DOUBLE, SpexFixtures.lowerEnergies(n)).withUnit("keV"))
                .column(Column.ofDoubles("E_MAX", ColumnType.DOUBLE, SpexFixtures.upperEnergies(n)).withUnit("keV"))
                .build();
    }

    /**
     * Diagonal redistribution matrix: energy bin {@code i} responds in channel
     * {@code i} only, with variable-length F_CHAN, N_CHAN and MATRIX cells.
     */
    public static Table diagonalMatrix(String tableName, int n, int firstChannel, double value) {
        int[][] fChan = new int[n][];
        int[][] nChan = new int[n][];
        double[][] matrix = new double[n][];
        for (int i = 0; i < n; i++) {
            fChan[i] = new int[] { firstChannel + i };
            nChan[i] = new int[] { 1 };
            matrix[i] = new double[] { value };
        }
        int[] nGrp = new int[n];
        Arrays.fill(nGrp, 1);
        return Table.builder(tableName)
                .column(Column.ofDoubles("ENERG_LO", ColumnType.DOUBLE, SpexFixtures.lowerEnergies(n)).withUnit("keV"))
                .column(Column.ofDoubles("ENERG_HI", ColumnType.DOUBLE, SpexFixtures.upperEnergies(n)).withUnit("keV"))
                .column(Column.ofInts("N_GRP", ColumnType.SHORT, nGrp))
                .column(Column.ofIntRows("F_CHAN", ColumnType.SHORT, fChan, true))
                .column(Column.ofIntRows("N_CHAN", ColumnType.SHORT, nChan, true))
                .column(Column.ofDoubleRows("MATRIX", ColumnType.FLOAT, matrix, true))
                .build();
    }

    public static Table effectiveArea(int n, double area) {
        return Table.builder("SPECRESP")
                .column(Column.ofDoubles("ENERG_LO", ColumnType.DOUBLE, SpexFixtures.lowerEnergies(n)).withUnit("keV"))
                .column(Column.ofDoubles("ENERG_HI", ColumnType.DOUBLE, SpexFixtures.upperEnergies(n)).withUnit("keV"))
                .column(Column.ofDoubles("SPECRESP", ColumnType.FLOAT, Masks.filled(n, area)).withUnit("cm**2"))
                .build();
    }
}
