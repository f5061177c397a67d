package com.questrail.spex.io;

import com.questrail.spex.mapping.Masks;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.Spectrum.Flag;
import com.questrail.spex.model.Spectrum.Quantity;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.ColumnType;
import com.questrail.spex.table.Table;
import com.questrail.spex.table.TabularStore;

import java.util.Objects;

/**
 * SpoFormat
 * -----------------------------------------------------------------------------
 * Maps a {@link Spectrum} to and from the tables of a SPEX {@code .spo} file.
 *
 * <h2>Tables</h2>
 * <ul>
 *   <li>{@code SPEX_REGIONS}: {@code NCHAN}, one row per region</li>
 *   <li>{@code SPEX_SPECTRUM}: one row per channel, all regions back to back</li>
 * </ul>
 * Energies are stored in double precision, all other quantities in single
 * precision. {@code Exp_Rate} is written only when
 * {@link Spectrum#backscaleRatioPresent()} is set; when absent on read it
 * defaults to 1.
 */
public final class SpoFormat
{
    public static final String REGIONS_TABLE = "SPEX_REGIONS";
    public static final String SPECTRUM_TABLE = "SPEX_SPECTRUM";

    static final String LOWER_ENERGY = "Lower_Energy";
    static final String UPPER_ENERGY = "Upper_Energy";
    static final String EXPOSURE_TIME = "Exposure_Time";
    static final String SOURCE_RATE = "Source_Rate";
    static final String ERR_SOURCE_RATE = "Err_Source_Rate";
    static final String BACK_RATE = "Back_Rate";
    static final String ERR_BACK_RATE = "Err_Back_Rate";
    static final String EXP_RATE = "Exp_Rate";
    static final String SYS_SOURCE = "Sys_Source";
    static final String SYS_BACK = "Sys_Back";
    static final String FIRST = "First";
    static final String LAST = "Last";
    static final String USED = "Used";

    private SpoFormat() {}

    public static Spectrum read(TabularStore store) {
        Objects.requireNonNull(store, "store");
        Table regions = store.read(REGIONS_TABLE);
        Table spectrum = store.read(SPECTRUM_TABLE);

        Spectrum.Builder b = Spectrum.builder()
                .channelsPerRegion(regions.column("NCHAN").asInts())
                .set(Quantity.LOWER_ENERGY, spectrum.column(LOWER_ENERGY).asDoubles())
                .set(Quantity.UPPER_ENERGY, spectrum.column(UPPER_ENERGY).asDoubles())
                .set(Quantity.EXPOSURE_TIME, spectrum.column(EXPOSURE_TIME).asDoubles())
                .set(Quantity.SOURCE_RATE, spectrum.column(SOURCE_RATE).asDoubles())
                .set(Quantity.SOURCE_RATE_ERROR, spectrum.column(ERR_SOURCE_RATE).asDoubles())
                .set(Quantity.BACKGROUND_RATE, spectrum.column(BACK_RATE).asDoubles())
                .set(Quantity.BACKGROUND_RATE_ERROR, spectrum.column(ERR_BACK_RATE).asDoubles())
                .set(Quantity.SOURCE_SYSTEMATIC, spectrum.column(SYS_SOURCE).asDoubles())
                .set(Quantity.BACKGROUND_SYSTEMATIC, spectrum.column(SYS_BACK).asDoubles())
                .set(Flag.USED, spectrum.column(USED).asBooleans())
                .set(Flag.FIRST_OF_BIN, spectrum.column(FIRST).asBooleans())
                .set(Flag.LAST_OF_BIN, spectrum.column(LAST).asBooleans());

        var expRate = spectrum.findColumn(EXP_RATE);
        b.set(Quantity.BACKSCALE_RATIO, expRate.map(Column::asDoubles)
                .orElseGet(() -> Masks.filled(spectrum.rowCount(), 1.0)));
        b.backscaleRatioPresent(expRate.isPresent());
        return b.build();
    }

    /**
     * Writes both tables.
     *
     * @throws com.questrail.spex.api.ArrayLengthMismatchException if the
     *         spectrum fails {@link Spectrum#check()}; nothing is written then
     */
    public static void write(Spectrum spectrum, TabularStore store) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(store, "store");
        spectrum.check().orThrow("Spectrum");

        Table regions = Table.builder(REGIONS_TABLE)
                .column(Column.ofInts("NCHAN", ColumnType.INT, spectrum.channelsPerRegion()))
                .build();

        Table.Builder t = Table.builder(SPECTRUM_TABLE)
                .column(Column.ofDoubles(LOWER_ENERGY, ColumnType.DOUBLE, spectrum.lowerEnergy()).withUnit("keV"))
                .column(Column.ofDoubles(UPPER_ENERGY, ColumnType.DOUBLE, spectrum.upperEnergy()).withUnit("keV"))
                .column(single(EXPOSURE_TIME, spectrum.exposureTime(), "s"))
                .column(single(SOURCE_RATE, spectrum.sourceRate(), "c/s"))
                .column(single(ERR_SOURCE_RATE, spectrum.sourceRateError(), "c/s"))
                .column(single(BACK_RATE, spectrum.backgroundRate(), "c/s"))
                .column(single(ERR_BACK_RATE, spectrum.backgroundRateError(), "c/s"));
        if (spectrum.backscaleRatioPresent()) {
            t.column(single(EXP_RATE, spectrum.backscaleRatio(), null));
        }
        t.column(single(SYS_SOURCE, spectrum.sourceSystematic(), null))
                .column(single(SYS_BACK, spectrum.backgroundSystematic(), null))
                .column(Column.ofBooleans(FIRST, spectrum.firstOfBin()))
                .column(Column.ofBooleans(LAST, spectrum.lastOfBin()))
                .column(Column.ofBooleans(USED, spectrum.used()));

        store.write(regions);
        store.write(t.build());
    }

    private static Column single(String name, double[] values, String unit) {
        Column c = Column.ofDoubles(name, ColumnType.FLOAT, values);
        return unit == null ? c : c.withUnit(unit);
    }
}
