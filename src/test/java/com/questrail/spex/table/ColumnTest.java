package com.questrail.spex.table;

import com.questrail.spex.api.FormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnTest
{
    @Test
    void integerColumnsReadAsDoublesAndBack()
    {
        Column c = Column.ofInts("CHANNEL", ColumnType.INT, new int[] { 0, 1, 2 });

        assertEquals(ColumnShape.SCALAR, c.shape());
        assertArrayEquals(new double[] { 0.0, 1.0, 2.0 }, c.asDoubles());
        assertArrayEquals(new int[] { 0, 1, 2 }, c.asInts());
    }

    @Test
    void nonIntegralDoublesAreNotReadAsIntegers()
    {
        Column c = Column.ofDoubles("X", ColumnType.DOUBLE, new double[] { 1.5 });
        assertThrows(FormatException.class, c::asInts);
    }

    @Test
    void vectorRowsOfOneElementReadAsScalars()
    {
        Column c = Column.ofDoubleRows("MATRIX", ColumnType.FLOAT,
                new double[][] { { 0.5 }, { 0.25 } }, false);

        assertEquals(ColumnShape.FIXED, c.shape());
        assertArrayEquals(new double[] { 0.5, 0.25 }, c.asDoubles());
    }

    @Test
    void scalarColumnsReadAsRowsOfOne()
    {
        Column c = Column.ofInts("F_CHAN", ColumnType.INT, new int[] { 4, 7 });
        int[][] rows = c.asIntRows();
        assertArrayEquals(new int[] { 4 }, rows[0]);
        assertArrayEquals(new int[] { 7 }, rows[1]);
    }

    @Test
    void variableRowsKeepTheirLengths()
    {
        Column c = Column.ofDoubleRows("MATRIX", ColumnType.FLOAT,
                new double[][] { { 1.0, 2.0 }, { 3.0 }, {} }, true);

        assertEquals(ColumnShape.VARIABLE, c.shape());
        assertEquals(2, c.width());
        assertEquals(0, c.asDoubleRows()[2].length);
    }

    @Test
    void fixedRowsMustAgreeInLength()
    {
        assertThrows(IllegalArgumentException.class, () -> Column.ofIntRows("N_CHAN", ColumnType.INT,
                new int[][] { { 1, 2 }, { 3 } }, false));
    }

    @Test
    void unitIsOptional()
    {
        Column c = Column.ofDoubles("E_MIN", ColumnType.FLOAT, new double[] { 1.0 });
        assertTrue(c.unit().isEmpty());
        assertEquals("keV", c.withUnit("keV").unit().orElseThrow());
    }
}
