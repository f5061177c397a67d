package com.questrail.spex.io;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionWarningEvent;
import com.questrail.spex.table.Table;
import com.questrail.spex.table.TabularStore;

import java.util.Objects;

/**
 * RmfFormat
 * -----------------------------------------------------------------------------
 * Reads an OGIP redistribution matrix ({@code EBOUNDS} plus {@code MATRIX}
 * or {@code SPECRESP MATRIX}).
 *
 * <h2>Matrix cells</h2>
 * {@code F_CHAN}, {@code N_CHAN} and {@code MATRIX} may be scalar, fixed or
 * variable-length. Row {@code i} holds {@code N_GRP[i]} group entries; its
 * matrix cell holds the elements of those groups back to back. Trailing
 * padding in fixed-width cells is ignored.
 */
public final class RmfFormat
{
    public static final String EBOUNDS_TABLE = "EBOUNDS";
    public static final String MATRIX_TABLE = "MATRIX";
    public static final String FULL_MATRIX_TABLE = "SPECRESP MATRIX";

    private RmfFormat() {}

    public static OgipResponse read(TabularStore store, ConversionObservabilitySink sink) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(sink, "sink");

        Table ebounds = store.read(EBOUNDS_TABLE);
        int[] channels = ebounds.column("CHANNEL").asInts();
        double[] eMin = ebounds.column("E_MIN").asDoubles();
        double[] eMax = ebounds.column("E_MAX").asDoubles();

        Table matrix;
        boolean areaIncluded = false;
        if (store.contains(MATRIX_TABLE)) {
            matrix = store.read(MATRIX_TABLE);
        } else if (store.contains(FULL_MATRIX_TABLE)) {
            matrix = store.read(FULL_MATRIX_TABLE);
            areaIncluded = true;
            sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                    "This is an RSP file with the effective area included; do not combine it with an ARF"));
        } else {
            throw new FormatException("No MATRIX or SPECRESP MATRIX table in response file");
        }

        double[] lo = matrix.column("ENERG_LO").asDoubles();
        double[] hi = matrix.column("ENERG_HI").asDoubles();
        int[] nGrp = matrix.column("N_GRP").asInts();
        int[][] fChan = matrix.column("F_CHAN").asIntRows();
        int[][] nChan = matrix.column("N_CHAN").asIntRows();
        double[][] cells = matrix.column("MATRIX").asDoubleRows();

        int totalGroups = 0;
        for (int g : nGrp) {
            if (g < 0) {
                throw new FormatException("Negative N_GRP in response matrix");
            }
            totalGroups += g;
        }

        int[] groupFirst = new int[totalGroups];
        int[] groupCount = new int[totalGroups];
        int k = 0;
        int totalElements = 0;
        int[] elementsPerBin = new int[lo.length];
        for (int i = 0; i < lo.length; i++) {
            if (nGrp[i] > fChan[i].length || nGrp[i] > nChan[i].length) {
                throw new FormatException("Energy bin " + (i + 1) + " declares " + nGrp[i]
                        + " groups but F_CHAN/N_CHAN hold fewer entries");
            }
            for (int j = 0; j < nGrp[i]; j++) {
                groupFirst[k] = fChan[i][j];
                groupCount[k] = nChan[i][j];
                elementsPerBin[i] += nChan[i][j];
                k++;
            }
            if (elementsPerBin[i] > cells[i].length) {
                throw new FormatException("Energy bin " + (i + 1) + " needs " + elementsPerBin[i]
                        + " matrix elements but the MATRIX cell holds " + cells[i].length);
            }
            totalElements += elementsPerBin[i];
        }

        double[] values = new double[totalElements];
        int r = 0;
        for (int i = 0; i < lo.length; i++) {
            System.arraycopy(cells[i], 0, values, r, elementsPerBin[i]);
            r += elementsPerBin[i];
        }

        String energyUnit = matrix.column("ENERG_LO").unit()
                .or(() -> matrix.header().getString("TUNIT1"))
                .orElse("keV");

        OgipResponse response = OgipResponse.builder()
                .channelBounds(channels, eMin, eMax)
                .energyBins(lo, hi, nGrp)
                .groups(groupFirst, groupCount)
                .matrix(values)
                .energyUnit(energyUnit)
                .order(matrix.header().getInt("ORDER").orElse(0))
                .areaIncluded(areaIncluded)
                .build();

        var check = response.check();
        if (check.failed()) {
            throw new FormatException("Invalid response matrix: " + check.message());
        }
        return response;
    }
}
