package com.questrail.spex.model;

import com.questrail.spex.api.IncompatibleSpectrumException;
import com.questrail.spex.api.SectorRegion;
import com.questrail.spex.mapping.ArrayRegionIndex;
import com.questrail.spex.mapping.RegionIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dataset
 * -----------------------------------------------------------------------------
 * Ordered {@link Region}s with their (sector, region) keys.
 *
 * <p>A dataset is what a pair of {@code .spo}/{@code .res} files holds: the
 * n-th spectrum region belongs to the n-th distinct key of the response
 * components. Datasets grow by appending; the only other change is an
 * explicit {@link #renumbered()}.</p>
 */
public final class Dataset
{
    private static final Dataset EMPTY = new Dataset(List.of(), ArrayRegionIndex.empty());

    private final List<Region> regions;
    private final ArrayRegionIndex index;

    private Dataset(List<Region> regions, ArrayRegionIndex index) {
        this.regions = List.copyOf(regions);
        this.index = index;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    /**
     * Splits a flat spectrum and response into regions.
     *
     * @throws IncompatibleSpectrumException if the spectrum region count differs
     *         from the number of distinct response keys
     */
    public static Dataset of(Spectrum spectrum, ResponseMatrix response) {
        List<SectorRegion> keys = response.regionKeys();
        if (keys.size() != spectrum.regionCount()) {
            throw new IncompatibleSpectrumException("The spectrum has " + spectrum.regionCount()
                    + " regions, the response " + keys.size());
        }
        Dataset dataset = EMPTY;
        for (int i = 0; i < keys.size(); i++) {
            SectorRegion key = keys.get(i);
            Region region = new Region(spectrum.extractRegion(i + 1),
                    response.extractRegion(key.sector(), key.region()));
            dataset = dataset.append(region, key);
        }
        return dataset;
    }

    /**
     * Appends {@code region} under {@code key}; its response components are
     * relabelled to the key.
     *
     * @throws IllegalArgumentException if the key is already in use
     */
    public Dataset append(Region region, SectorRegion key) {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(key, "key");
        ArrayRegionIndex grown = index.with(key);
        List<Region> list = new ArrayList<>(regions);
        list.add(region.withKey(key));
        return new Dataset(list, grown);
    }

    /**
     * Appends {@code region} as the next region of sector 1.
     */
    public Dataset append(Region region) {
        return append(region, SectorRegion.of(1, regions.size() + 1));
    }

    /**
     * Copy with regions numbered 1..n in dataset order; sectors are kept.
     */
    public Dataset renumbered() {
        Dataset out = EMPTY;
        for (int i = 0; i < regions.size(); i++) {
            out = out.append(regions.get(i), SectorRegion.of(index.keyAt(i).sector(), i + 1));
        }
        return out;
    }

    public int size() {
        return regions.size();
    }

    public boolean isEmpty() {
        return regions.isEmpty();
    }

    public List<Region> regions() {
        return regions;
    }

    public RegionIndex index() {
        return index;
    }

    public Region region(SectorRegion key) {
        return regions.get(index.indexOf(key));
    }

    /**
     * All region spectra concatenated in dataset order.
     */
    public Spectrum toSpectrum() {
        Spectrum out = Spectrum.empty();
        for (Region r : regions) {
            out = out.concatenate(r.spectrum(), 1);
        }
        return out;
    }

    /**
     * All region responses concatenated in dataset order, labelled with
     * their keys.
     */
    public ResponseMatrix toResponse() {
        ResponseMatrix out = ResponseMatrix.empty();
        for (int i = 0; i < regions.size(); i++) {
            SectorRegion key = index.keyAt(i);
            out = out.appendAllComponents(regions.get(i).response(), key.sector(), key.region());
        }
        return out;
    }

    @Override
    public String toString() {
        return "Dataset" + index.keys();
    }
}
