package com.questrail.spex.mapping;

import com.questrail.spex.api.RegionNotFoundException;
import com.questrail.spex.api.SectorRegion;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RegionIndex
 * -----------------------------------------------------------------------------
 * {@code RegionIndex} defines the mapping between semantic {@link SectorRegion}
 * keys and the dense, 0-based positions of regions inside a dataset.
 *
 * <h2>Why this exists</h2>
 * SPEX files address regions by (sector, region) pairs, both 1-based. Inside a
 * dataset the regions are simply kept in order. This interface isolates the
 * translation so that:
 * <ul>
 *   <li>Format code never assumes that region {@code n} is stored at {@code n-1}</li>
 *   <li>0-based vs 1-based conventions do not leak upward</li>
 *   <li>Renumbering stays an explicit operation</li>
 * </ul>
 *
 * <h2>Index Semantics</h2>
 * The index returned by {@link #indexOf(SectorRegion)} is always 0-based,
 * dense and stable within a given {@code RegionIndex} instance.
 */
public interface RegionIndex
{
    /**
     * Returns the number of keys in the index.
     */
    int size();

    /**
     * Returns the 0-based position of the given key.
     *
     * @throws RegionNotFoundException if the key is unknown to this index
     */
    int indexOf(SectorRegion key);

    /**
     * Reverse lookup: returns the key stored at the given position.
     *
     * @throws IndexOutOfBoundsException if index is out of range
     */
    SectorRegion keyAt(int index);

    /**
     * Returns all keys in index order.
     */
    List<SectorRegion> keys();

    /**
     * Returns true if this index contains the given key.
     */
    default boolean contains(SectorRegion key) {
        Objects.requireNonNull(key, "key");
        try {
            indexOf(key);
            return true;
        } catch (RegionNotFoundException ex) {
            return false;
        }
    }

    /**
     * Attempts to resolve the first key carrying the given region number,
     * regardless of its sector.
     */
    default Optional<SectorRegion> tryResolveByRegion(int region) {
        for (SectorRegion key : keys()) {
            if (key.region() == region) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
