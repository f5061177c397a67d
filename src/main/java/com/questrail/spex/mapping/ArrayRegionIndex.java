package com.questrail.spex.mapping;

import com.questrail.spex.api.RegionNotFoundException;
import com.questrail.spex.api.SectorRegion;

import java.util.*;

/**
 * ArrayRegionIndex
 * -----------------------------------------------------------------------------
 * A straightforward {@link RegionIndex} backed by:
 *
 * <ul>
 *   <li>a list for index -> key</li>
 *   <li>a map for key -> index</li>
 * </ul>
 *
 * Instances are immutable; {@link #with(SectorRegion)} returns a new index.
 */
public final class ArrayRegionIndex implements RegionIndex
{
    private static final ArrayRegionIndex EMPTY = new ArrayRegionIndex(List.of());

    private final List<SectorRegion> keyByIndex;
    private final Map<SectorRegion, Integer> indexByKey;

    /**
     * Creates an index from an ordered list of keys.
     *
     * The position in the list is the 0-based index.
     */
    public ArrayRegionIndex(List<SectorRegion> keysInIndexOrder) {
        Objects.requireNonNull(keysInIndexOrder, "keysInIndexOrder");

        this.keyByIndex = List.copyOf(keysInIndexOrder);

        Map<SectorRegion, Integer> tmp = new HashMap<>(keyByIndex.size() * 2);
        for (int i = 0; i < keyByIndex.size(); i++) {
            Integer prev = tmp.put(keyByIndex.get(i), i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate sector/region key in index: " + keyByIndex.get(i));
            }
        }
        this.indexByKey = Collections.unmodifiableMap(tmp);
    }

    public static ArrayRegionIndex empty() {
        return EMPTY;
    }

    /**
     * Returns a new index with {@code key} appended at the end.
     *
     * @throws IllegalArgumentException if the key is already present
     */
    public ArrayRegionIndex with(SectorRegion key) {
        Objects.requireNonNull(key, "key");
        List<SectorRegion> keys = new ArrayList<>(keyByIndex);
        keys.add(key);
        return new ArrayRegionIndex(keys);
    }

    @Override
    public int size() {
        return keyByIndex.size();
    }

    @Override
    public int indexOf(SectorRegion key) {
        Objects.requireNonNull(key, "key");
        Integer idx = indexByKey.get(key);
        if (idx == null) {
            throw new RegionNotFoundException(key.sector(), key.region());
        }
        return idx;
    }

    @Override
    public SectorRegion keyAt(int index) {
        if (index < 0 || index >= keyByIndex.size()) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + keyByIndex.size());
        }
        return keyByIndex.get(index);
    }

    @Override
    public List<SectorRegion> keys() {
        return keyByIndex;
    }

    @Override
    public String toString() {
        return "ArrayRegionIndex" + keyByIndex;
    }
}
