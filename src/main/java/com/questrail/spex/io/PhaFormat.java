package com.questrail.spex.io;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionWarningEvent;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.Table;
import com.questrail.spex.table.TabularStore;

import java.util.Objects;
import java.util.Optional;

/**
 * PhaFormat
 * -----------------------------------------------------------------------------
 * Reads an OGIP type I spectrum from the {@code SPECTRUM} table.
 *
 * <h2>Conventions</h2>
 * <ul>
 *   <li>{@code HDUCLAS3 = COUNTS} spectra are divided by {@code EXPOSURE};
 *       STAT_ERR then is in counts and is divided as well</li>
 *   <li>{@code POISSERR = T} gives errors {@code sqrt(rate / exposure)}</li>
 *   <li>missing SYS_ERR, QUALITY and GROUPING default to 0</li>
 *   <li>AREASCAL and BACKSCAL come from a column or a keyword, default 1</li>
 * </ul>
 */
public final class PhaFormat
{
    public static final String SPECTRUM_TABLE = "SPECTRUM";

    private PhaFormat() {}

    /**
     * @throws FormatException if mandatory columns or keywords are missing,
     *                         or the spectrum fails {@link OgipSpectrum#check()}
     */
    public static OgipSpectrum read(TabularStore store, ConversionObservabilitySink sink) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(sink, "sink");

        Table table = store.read(SPECTRUM_TABLE);
        Header h = table.header();

        double exposure = h.requireDouble("EXPOSURE");
        if (exposure <= 0.0) {
            throw new FormatException("Exposure time of spectrum is zero or smaller");
        }
        boolean rateSpectrum = OgipKeywords.isRateSpectrum(table);
        boolean poisson = h.getBoolean("POISSERR").orElse(false);

        int[] channels = table.column("CHANNEL").asInts();
        int n = channels.length;

        double[] rates;
        if (rateSpectrum) {
            rates = table.column("RATE").asDoubles();
        } else {
            rates = table.column("COUNTS").asDoubles();
            for (int i = 0; i < n; i++) {
                rates[i] /= exposure;
            }
        }

        double[] statErrors;
        Optional<double[]> statColumn = table.findColumn("STAT_ERR").map(c -> c.asDoubles());
        if (poisson) {
            statErrors = OgipKeywords.poissonErrors(rates, exposure);
        } else if (statColumn.isPresent()) {
            statErrors = statColumn.get();
            if (!rateSpectrum) {
                for (int i = 0; i < n; i++) {
                    statErrors[i] /= exposure;
                }
            }
        } else {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(), "No Poisson errors, but no STAT_ERR column found"));
            statErrors = new double[n];
        }

        double[] sysErrors = table.findColumn("SYS_ERR").map(c -> c.asDoubles()).orElseGet(() -> new double[n]);
        if (rateSpectrum) {
            for (int i = 0; i < n; i++) {
                sysErrors[i] /= exposure;
            }
        }

        OgipSpectrum spectrum = OgipSpectrum.builder()
                .channels(channels)
                .rates(rates)
                .statErrors(statErrors)
                .sysErrors(sysErrors)
                .quality(OgipKeywords.intsOrKeyword(table, "QUALITY", n))
                .grouping(OgipKeywords.intsOrKeyword(table, "GROUPING", n))
                .areaScaling(OgipKeywords.doublesOrKeyword(table, "AREASCAL", n, 1.0))
                .backScaling(OgipKeywords.doublesOrKeyword(table, "BACKSCAL", n, 1.0))
                .exposure(exposure)
                .correctionScale(h.getDouble("CORRSCAL").orElse(1.0))
                .spectrumType(h.getString("HDUCLAS2").orElse("TOTAL"))
                .poissonErrors(poisson)
                .backgroundFile(OgipKeywords.fileReference(h, "BACKFILE"))
                .responseFile(OgipKeywords.fileReference(h, "RESPFILE"))
                .ancillaryFile(OgipKeywords.fileReference(h, "ANCRFILE"))
                .correctionFile(OgipKeywords.fileReference(h, "CORRFILE"))
                .build();

        h.getLong("DETCHANS").ifPresent(detChans -> {
            if (detChans != n) {
                sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                        "DETCHANS (" + detChans + ") differs from the number of rows (" + n + ")"));
            }
        });

        var check = spectrum.check();
        if (check.failed()) {
            throw new FormatException("Invalid spectrum: " + check.message());
        }
        return spectrum;
    }
}
