package com.questrail.spex.io;

import com.questrail.spex.mapping.Masks;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.Table;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Column-or-keyword lookups shared by the OGIP readers.
 *
 * <p>OGIP allows several per-channel quantities either as a column or, when
 * constant, as a header keyword of the same name.</p>
 */
final class OgipKeywords
{
    private OgipKeywords() {}

    static double[] doublesOrKeyword(Table table, String name, int n, double fallback) {
        Optional<double[]> col = table.findColumn(name).map(c -> c.asDoubles());
        return col.orElseGet(() -> Masks.filled(n, table.header().getDouble(name).orElse(fallback)));
    }

    static int[] intsOrKeyword(Table table, String name, int n) {
        Optional<int[]> col = table.findColumn(name).map(c -> c.asInts());
        if (col.isPresent()) {
            return col.get();
        }
        int value = table.header().getInt(name).orElse(0);
        int[] out = new int[n];
        Arrays.fill(out, value);
        return out;
    }

    /**
     * File reference keyword; {@code NONE} and blank values count as absent.
     */
    static String fileReference(Header header, String key) {
        String v = header.getString(key).orElse("");
        if (v.isBlank() || v.toUpperCase(Locale.ROOT).equals("NONE")) {
            return null;
        }
        return v;
    }

    /**
     * {@code RATE} or {@code COUNTS}, from HDUCLAS3; without the keyword a
     * table with a RATE column and no COUNTS column holds rates.
     */
    static boolean isRateSpectrum(Table table) {
        Optional<String> hduclas3 = table.header().getString("HDUCLAS3");
        if (hduclas3.isPresent()) {
            return hduclas3.get().trim().toUpperCase(Locale.ROOT).equals("RATE");
        }
        return table.hasColumn("RATE") && !table.hasColumn("COUNTS");
    }

    static double[] poissonErrors(double[] rates, double exposure) {
        double[] out = new double[rates.length];
        for (int i = 0; i < rates.length; i++) {
            out[i] = Math.sqrt(Math.max(rates[i], 0.0) / exposure);
        }
        return out;
    }
}
