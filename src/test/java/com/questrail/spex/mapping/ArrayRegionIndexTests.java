package com.questrail.spex.mapping;

import com.questrail.spex.api.RegionNotFoundException;
import com.questrail.spex.api.SectorRegion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArrayRegionIndexTests
{
    @Test
    void providesBidirectionalLookup() {
        ArrayRegionIndex index = new ArrayRegionIndex(List.of(
                SectorRegion.of(1, 1),
                SectorRegion.of(1, 2),
                SectorRegion.of(2, 1)
        ));

        assertEquals(0, index.indexOf(SectorRegion.of(1, 1)));
        assertEquals(2, index.indexOf(SectorRegion.of(2, 1)));
        assertEquals(SectorRegion.of(1, 2), index.keyAt(1));
        assertEquals(3, index.size());
        assertTrue(index.contains(SectorRegion.of(2, 1)));
        assertFalse(index.contains(SectorRegion.of(2, 2)));
    }

    @Test
    void withAppendsWithoutChangingTheOriginal() {
        ArrayRegionIndex empty = ArrayRegionIndex.empty();
        ArrayRegionIndex one = empty.with(SectorRegion.of(1, 1));

        assertEquals(0, empty.size());
        assertEquals(List.of(SectorRegion.of(1, 1)), one.keys());
    }

    @Test
    void duplicateKeysAreRejected() {
        ArrayRegionIndex one = ArrayRegionIndex.empty().with(SectorRegion.of(1, 1));
        assertThrows(IllegalArgumentException.class, () -> one.with(SectorRegion.of(1, 1)));
    }

    @Test
    void unknownKeyThrows() {
        ArrayRegionIndex one = ArrayRegionIndex.empty().with(SectorRegion.of(1, 1));

        RegionNotFoundException ex = assertThrows(RegionNotFoundException.class,
                () -> one.indexOf(SectorRegion.of(3, 4)));
        assertEquals(3, ex.sector());
        assertEquals(4, ex.region());
        assertThrows(IndexOutOfBoundsException.class, () -> one.keyAt(1));
    }
}
