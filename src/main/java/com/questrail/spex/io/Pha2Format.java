package com.questrail.spex.io;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.mapping.Masks;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.model.ogip.OgipTypeIISpectrum;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionWarningEvent;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.Table;
import com.questrail.spex.table.TabularStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads an OGIP type II spectrum: one spectrum per row of {@code SPECTRUM}.
 *
 * <p>Grating products often ship Gehrels errors. With {@code forcePoisson}
 * the STAT_ERR column is ignored and Poisson errors are used instead.</p>
 */
public final class Pha2Format
{
    private Pha2Format() {}

    public static OgipTypeIISpectrum read(TabularStore store,
                                          boolean forcePoisson,
                                          boolean withBackground,
                                          ConversionObservabilitySink sink) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(sink, "sink");

        Table table = store.read(PhaFormat.SPECTRUM_TABLE);
        Header h = table.header();
        int rows = table.rowCount();
        if (rows == 0) {
            throw new FormatException("Type II spectrum file contains no spectra");
        }

        double exposure = h.requireDouble("EXPOSURE");
        if (exposure <= 0.0) {
            throw new FormatException("Exposure time of spectrum is zero or smaller");
        }
        boolean rateSpectrum = OgipKeywords.isRateSpectrum(table);
        boolean poisson = forcePoisson || h.getBoolean("POISSERR").orElse(false);

        int[] orders = table.column("TG_M").asInts();
        int[] parts = table.column("TG_PART").asInts();
        int[][] channels = table.column("CHANNEL").asIntRows();
        double[][] values = table.column(rateSpectrum ? "RATE" : "COUNTS").asDoubleRows();
        double[][] stat = rowsOf(table, "STAT_ERR");
        double[][] sys = rowsOf(table, "SYS_ERR");
        double[][] quality = rowsOf(table, "QUALITY");
        double[][] grouping = rowsOf(table, "GROUPING");
        double[][] areaScal = rowsOf(table, "AREASCAL");
        double[][] backScal = rowsOf(table, "BACKSCAL");

        if (!poisson && stat == null) {
            throw new FormatException("No Poisson errors, but no STAT_ERR column found");
        }

        double[][] bkgUp = null;
        double[][] bkgDown = null;
        double bkgScale = 1.0;
        if (withBackground) {
            bkgUp = rowsOf(table, "BACKGROUND_UP");
            bkgDown = rowsOf(table, "BACKGROUND_DOWN");
            if (bkgUp == null || bkgDown == null) {
                sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                        "Background requested but BACKGROUND_UP/BACKGROUND_DOWN columns are missing"));
                bkgUp = null;
                bkgDown = null;
            } else {
                bkgScale = h.requireDouble("BACKSCUP") + h.requireDouble("BACKSCDN");
            }
        }

        List<OgipTypeIISpectrum.Order> out = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            int n = channels[r].length;
            double[] rates = values[r].clone();
            if (!rateSpectrum) {
                for (int i = 0; i < n; i++) {
                    rates[i] /= exposure;
                }
            }
            double[] statErrors;
            if (poisson) {
                statErrors = OgipKeywords.poissonErrors(rates, exposure);
            } else {
                statErrors = stat[r].clone();
                if (!rateSpectrum) {
                    for (int i = 0; i < n; i++) {
                        statErrors[i] /= exposure;
                    }
                }
            }
            double[] sysErrors = sys != null ? sys[r].clone() : new double[n];
            if (rateSpectrum) {
                for (int i = 0; i < n; i++) {
                    sysErrors[i] /= exposure;
                }
            }

            OgipSpectrum spectrum = OgipSpectrum.builder()
                    .channels(channels[r])
                    .rates(rates)
                    .statErrors(statErrors)
                    .sysErrors(sysErrors)
                    .quality(intsOr(quality, r, n, h, "QUALITY"))
                    .grouping(intsOr(grouping, r, n, h, "GROUPING"))
                    .areaScaling(doublesOr(areaScal, r, n, h, "AREASCAL"))
                    .backScaling(doublesOr(backScal, r, n, h, "BACKSCAL"))
                    .exposure(exposure)
                    .correctionScale(h.getDouble("CORRSCAL").orElse(1.0))
                    .spectrumType(h.getString("HDUCLAS2").orElse("TOTAL"))
                    .poissonErrors(poisson)
                    .build();
            var check = spectrum.check();
            if (check.failed()) {
                throw new FormatException("Invalid spectrum in row " + (r + 1) + ": " + check.message());
            }

            Optional<OgipTypeIISpectrum.OrderBackground> background = Optional.empty();
            if (bkgUp != null) {
                double[] bkgRate = new double[n];
                for (int i = 0; i < n; i++) {
                    bkgRate[i] = (bkgUp[r][i] + bkgDown[r][i]) / exposure;
                }
                background = Optional.of(new OgipTypeIISpectrum.OrderBackground(
                        bkgRate, OgipKeywords.poissonErrors(bkgRate, exposure), bkgScale));
            }
            out.add(new OgipTypeIISpectrum.Order(spectrum, orders[r], parts[r], background));
        }

        return new OgipTypeIISpectrum(out,
                h.getString("TELESCOP").orElse(""),
                h.getString("INSTRUME").orElse(""),
                h.getString("GRATING").orElse(""));
    }

    private static double[][] rowsOf(Table table, String name) {
        return table.findColumn(name).map(Column::asDoubleRows).orElse(null);
    }

    private static int[] intsOr(double[][] rows, int r, int n, Header h, String keyword) {
        int[] out = new int[n];
        if (rows != null) {
            for (int i = 0; i < n; i++) {
                out[i] = (int) Math.round(rows[r].length == 1 ? rows[r][0] : rows[r][i]);
            }
            return out;
        }
        int value = h.getInt(keyword).orElse(0);
        for (int i = 0; i < n; i++) {
            out[i] = value;
        }
        return out;
    }

    private static double[] doublesOr(double[][] rows, int r, int n, Header h, String keyword) {
        if (rows != null) {
            return rows[r].length == 1 ? Masks.filled(n, rows[r][0]) : rows[r].clone();
        }
        return Masks.filled(n, h.getDouble(keyword).orElse(1.0));
    }
}
