package com.questrail.spex.model.ogip;

import java.util.Locale;

/**
 * Grating arm as encoded in the {@code TG_PART} column of Chandra type II
 * spectra.
 */
public enum GratingPart
{
    HEG(1),
    MEG(2),
    LEG(3);

    private final int code;

    GratingPart(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Accepts {@code HEG}, {@code MEG}, {@code LEG} and the instrument names
     * {@code HETG}, {@code METG}, {@code LETG}, case-insensitive.
     */
    public static GratingPart parse(String text) {
        String t = text.trim().toUpperCase(Locale.ROOT);
        return switch (t) {
            case "HEG", "HETG" -> HEG;
            case "MEG", "METG" -> MEG;
            case "LEG", "LETG" -> LEG;
            default -> throw new IllegalArgumentException("Unknown grating part: " + text);
        };
    }

    public static GratingPart fromCode(int code) {
        for (GratingPart p : values()) {
            if (p.code == code) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown TG_PART value: " + code);
    }
}
