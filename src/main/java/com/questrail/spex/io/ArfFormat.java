package com.questrail.spex.io;

import com.questrail.spex.model.ogip.OgipEffectiveArea;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionWarningEvent;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.Table;
import com.questrail.spex.table.TabularStore;

import java.util.Objects;

/**
 * Reads an OGIP effective-area curve from the {@code SPECRESP} table.
 * NaN areas are replaced by 0.
 */
public final class ArfFormat
{
    public static final String SPECRESP_TABLE = "SPECRESP";

    private ArfFormat() {}

    public static OgipEffectiveArea read(TabularStore store, ConversionObservabilitySink sink) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(sink, "sink");

        Table table = store.read(SPECRESP_TABLE);
        Column lo = table.column("ENERG_LO");
        Column area = table.column("SPECRESP");

        double[] values = area.asDoubles();
        int nans = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = 0.0;
                nans++;
            }
        }
        if (nans > 0) {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(), nans + " NaN values in effective area set to 0"));
        }

        String areaUnit = area.unit().or(() -> table.header().getString("TUNIT3")).orElse("");
        OgipEffectiveArea arf = new OgipEffectiveArea(
                lo.asDoubles(),
                table.column("ENERG_HI").asDoubles(),
                values,
                lo.unit().or(() -> table.header().getString("TUNIT1")).orElse("keV"),
                areaUnit,
                table.header().getInt("TG_M").orElse(0),
                table.header().getInt("TG_PART").orElse(0));
        if (!arf.isSquareCentimetres()) {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(), "ARF units '" + areaUnit + "' are not recognized"));
        }
        return arf;
    }
}
