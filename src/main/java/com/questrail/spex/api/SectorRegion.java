package com.questrail.spex.api;

/**
 * SectorRegion
 * -----------------------------------------------------------------------------
 * Key of a SPEX region: the (sector, region) pair under which a spectrum and
 * its response components are stored.
 *
 * <p>Both numbers are 1-based. A sector groups regions that share a model;
 * a region pairs one spectrum with one or more response components.</p>
 */
public record SectorRegion(int sector, int region) implements Comparable<SectorRegion>
{
    public SectorRegion {
        if (sector < 1) {
            throw new IllegalArgumentException("sector must be >= 1, was " + sector);
        }
        if (region < 1) {
            throw new IllegalArgumentException("region must be >= 1, was " + region);
        }
    }

    public static SectorRegion of(int sector, int region) {
        return new SectorRegion(sector, region);
    }

    @Override
    public int compareTo(SectorRegion other) {
        int c = Integer.compare(sector, other.sector);
        return c != 0 ? c : Integer.compare(region, other.region);
    }

    @Override
    public String toString() {
        return "sector " + sector + " / region " + region;
    }
}
