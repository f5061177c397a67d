package com.questrail.spex.mapping;

import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

final class MasksTest
{
    @Test
    void rangeAndComplementPartitionTheRows()
    {
        BitSet inside = Masks.range(2, 5);
        BitSet outside = Masks.complement(inside, 7);

        assertEquals(3, inside.cardinality());
        assertEquals(4, outside.cardinality());
        BitSet union = (BitSet) inside.clone();
        union.or(outside);
        assertEquals(7, union.cardinality());
        assertFalse(inside.intersects(outside));
    }

    @Test
    void selectKeepsMarkedRowsInOrder()
    {
        BitSet mask = Masks.of(new boolean[] { true, false, true, false });

        assertArrayEquals(new double[] { 1.0, 3.0 }, Masks.select(new double[] { 1.0, 2.0, 3.0, 4.0 }, mask));
        assertArrayEquals(new int[] { 10, 30 }, Masks.select(new int[] { 10, 20, 30, 40 }, mask));
        assertArrayEquals(new boolean[] { false, true },
                Masks.select(new boolean[] { false, false, true, true }, mask));
    }

    @Test
    void reverseRangeOnlyTouchesTheRange()
    {
        double[] values = { 1, 2, 3, 4, 5 };
        Masks.reverseRange(values, 1, 4);
        assertArrayEquals(new double[] { 1, 4, 3, 2, 5 }, values);
    }

    @Test
    void sumsAndConcatenation()
    {
        int[] counts = { 3, 4, 5 };
        assertEquals(12, Masks.sum(counts));
        assertEquals(3, Masks.sum(counts, 0, 1));
        assertEquals(0, Masks.sum(counts, 0, 0));
        assertArrayEquals(new int[] { 3, 4, 5, 6 }, Masks.concat(counts, new int[] { 6 }));
        assertArrayEquals(new double[] { 2.0, 1.0 }, Masks.reversed(new double[] { 1.0, 2.0 }));
        assertArrayEquals(new double[] { 0.5, 0.5, 0.5 }, Masks.filled(3, 0.5));
    }
}
