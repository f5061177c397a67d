package com.questrail.spex.api;

/**
 * Indicates a request for a (sector, region) key, or a region number, that
 * the addressed table does not contain. This is a caller error.
 */
public final class RegionNotFoundException extends SpexException
{
    private final int sector;
    private final int region;

    public RegionNotFoundException(int sector, int region) {
        super("Sector " + sector + " / region " + region + " not available");
        this.sector = sector;
        this.region = region;
    }

    public RegionNotFoundException(int region) {
        super("Region " + region + " not available");
        this.sector = 0;
        this.region = region;
    }

    /**
     * Requested sector, or 0 when only a region number was requested.
     */
    public int sector() {
        return sector;
    }

    public int region() {
        return region;
    }
}
