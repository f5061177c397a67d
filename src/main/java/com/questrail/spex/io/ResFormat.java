package com.questrail.spex.io;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.ColumnType;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.Table;
import com.questrail.spex.table.TabularStore;

import java.util.Arrays;
import java.util.Objects;

/**
 * ResFormat
 * -----------------------------------------------------------------------------
 * Maps a {@link ResponseMatrix} to and from the tables of a SPEX
 * {@code .res} file.
 *
 * <h2>Tables</h2>
 * <ul>
 *   <li>{@code SPEX_RESP_ICOMP}: NCHAN, NEG, SECTOR, REGION and optional
 *       SHCOMP, one row per component. Header NSECTOR, NREGION, NCOMP and
 *       the flags SHARECOM, AREASCAL, RESPDER.</li>
 *   <li>{@code SPEX_RESP_GROUP}: EG1, EG2, IC1, IC2, NC and optional RELAREA</li>
 *   <li>{@code SPEX_RESP_RESP}: {@code Response} and optional
 *       {@code Response_Der}; older files use {@code RESP} / {@code DRESP}</li>
 * </ul>
 */
public final class ResFormat
{
    public static final String COMPONENT_TABLE = "SPEX_RESP_ICOMP";
    public static final String GROUP_TABLE = "SPEX_RESP_GROUP";
    public static final String RESPONSE_TABLE = "SPEX_RESP_RESP";

    private ResFormat() {}

    public static ResponseMatrix read(TabularStore store) {
        Objects.requireNonNull(store, "store");
        Table icomp = store.read(COMPONENT_TABLE);
        Table group = store.read(GROUP_TABLE);
        Table resp = store.read(RESPONSE_TABLE);
        Header h = icomp.header();

        boolean shared = h.getBoolean("SHARECOM").orElse(icomp.hasColumn("SHCOMP"));
        boolean areaScal = h.getBoolean("AREASCAL").orElse(group.hasColumn("RELAREA"));
        boolean respDer = h.getBoolean("RESPDER").orElse(resp.hasColumn("Response_Der") || resp.hasColumn("DRESP"));

        ResponseMatrix.Builder b = ResponseMatrix.builder()
                .components(icomp.column("NCHAN").asInts(), icomp.column("NEG").asInts(),
                        icomp.column("SECTOR").asInts(), icomp.column("REGION").asInts())
                .groups(group.column("EG1").asDoubles(), group.column("EG2").asDoubles(),
                        group.column("IC1").asInts(), group.column("IC2").asInts(), group.column("NC").asInts())
                .values(resp.findAnyColumn("Response", "RESP")
                        .orElseThrow(() -> new FormatException("Response column not found in " + RESPONSE_TABLE))
                        .asDoubles());
        if (shared) {
            b.sharedComponents(icomp.column("SHCOMP").asInts());
        }
        if (areaScal) {
            b.relativeAreas(group.column("RELAREA").asDoubles());
        }
        if (respDer) {
            b.derivatives(resp.findAnyColumn("Response_Der", "DRESP")
                    .orElseThrow(() -> new FormatException("Response derivative column not found in " + RESPONSE_TABLE))
                    .asDoubles());
        }
        return b.build();
    }

    /**
     * Writes the three tables.
     *
     * @throws com.questrail.spex.api.ArrayLengthMismatchException if the
     *         matrix fails {@link ResponseMatrix#check()}; nothing is written then
     */
    public static void write(ResponseMatrix response, TabularStore store) {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(store, "store");
        response.check().orThrow("Response matrix");

        int[] sectors = response.sectors();
        int[] regions = response.regions();
        Header icompHeader = Header.builder()
                .put("NSECTOR", (long) Arrays.stream(sectors).max().orElse(0))
                .put("NREGION", Arrays.stream(regions).distinct().count())
                .put("NCOMP", (long) response.componentCount())
                .put("SHARECOM", response.hasSharedComponents())
                .put("AREASCAL", response.hasAreaScaling())
                .put("RESPDER", response.hasResponseDerivative())
                .build();
        Table.Builder icomp = Table.builder(COMPONENT_TABLE)
                .header(icompHeader)
                .column(Column.ofInts("NCHAN", ColumnType.INT, response.componentChannelCounts()))
                .column(Column.ofInts("NEG", ColumnType.INT, response.componentGroupCounts()))
                .column(Column.ofInts("SECTOR", ColumnType.INT, sectors))
                .column(Column.ofInts("REGION", ColumnType.INT, regions));
        if (response.hasSharedComponents()) {
            icomp.column(Column.ofInts("SHCOMP", ColumnType.INT, response.sharedComponents()));
        }

        Table.Builder group = Table.builder(GROUP_TABLE)
                .column(Column.ofDoubles("EG1", ColumnType.DOUBLE, response.lowEnergies()).withUnit("keV"))
                .column(Column.ofDoubles("EG2", ColumnType.DOUBLE, response.highEnergies()).withUnit("keV"))
                .column(Column.ofInts("IC1", ColumnType.INT, response.firstChannels()))
                .column(Column.ofInts("IC2", ColumnType.INT, response.lastChannels()))
                .column(Column.ofInts("NC", ColumnType.INT, response.groupChannelCounts()));
        if (response.hasAreaScaling()) {
            group.column(Column.ofDoubles("RELAREA", ColumnType.FLOAT, response.relativeAreas()));
        }

        Table.Builder resp = Table.builder(RESPONSE_TABLE)
                .column(Column.ofDoubles("Response", ColumnType.FLOAT, response.values()).withUnit("m**2"));
        if (response.hasResponseDerivative()) {
            resp.column(Column.ofDoubles("Response_Der", ColumnType.FLOAT, response.derivatives()).withUnit("m**2"));
        }

        store.write(icomp.build());
        store.write(group.build());
        store.write(resp.build());
    }
}
