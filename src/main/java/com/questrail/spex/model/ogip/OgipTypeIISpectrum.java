package com.questrail.spex.model.ogip;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.mapping.Masks;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * OgipTypeIISpectrum
 * -----------------------------------------------------------------------------
 * A PHA type II file: one spectrum per row, each row one grating order of one
 * grating arm.
 *
 * <h2>Background</h2>
 * Chandra grating files store the background as two extraction regions
 * ({@code BACKGROUND_UP}, {@code BACKGROUND_DOWN}) in counts. The reader
 * converts their sum to a rate per row; the combined background area is
 * {@code BACKSCUP + BACKSCDN}.
 */
public final class OgipTypeIISpectrum
{
    /**
     * One order of one arm. {@code background} is empty when the file was
     * read without background.
     */
    public record Order(OgipSpectrum spectrum, int order, int part, Optional<OrderBackground> background)
    {
        public Order {
            Objects.requireNonNull(spectrum, "spectrum");
            Objects.requireNonNull(background, "background");
        }
    }

    public record OrderBackground(double[] rates, double[] statErrors, double backScaling)
    {
        public OrderBackground {
            rates = Objects.requireNonNull(rates, "rates").clone();
            statErrors = Objects.requireNonNull(statErrors, "statErrors").clone();
        }

        @Override
        public double[] rates() {
            return rates.clone();
        }

        @Override
        public double[] statErrors() {
            return statErrors.clone();
        }
    }

    /** Result of {@link #combineOrders(GratingPart)}. */
    public record CombinedOrders(OgipSpectrum source, Optional<OgipSpectrum> background, int orderCount)
    {
        public CombinedOrders {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(background, "background");
        }
    }

    private final List<Order> orders;
    private final String telescope;
    private final String instrument;
    private final String grating;

    public OgipTypeIISpectrum(List<Order> orders, String telescope, String instrument, String grating) {
        this.orders = List.copyOf(Objects.requireNonNull(orders, "orders"));
        this.telescope = Objects.requireNonNull(telescope, "telescope");
        this.instrument = Objects.requireNonNull(instrument, "instrument");
        this.grating = Objects.requireNonNull(grating, "grating");
    }

    public List<Order> orders() {
        return orders;
    }

    public int spectrumCount() {
        return orders.size();
    }

    public String telescope() {
        return telescope;
    }

    public String instrument() {
        return instrument;
    }

    public String grating() {
        return grating;
    }

    /**
     * Sums all orders of one grating arm.
     *
     * <ul>
     *   <li>rates add; statistical and systematic errors add in quadrature</li>
     *   <li>a channel is bad when any order flags it bad</li>
     *   <li>grouping is dropped</li>
     *   <li>area and background scaling are averaged over the orders</li>
     * </ul>
     * The background spectrum, when present, gets unit area scaling and the
     * combined up/down extraction area as background scaling.
     *
     * @throws FormatException if the arm is absent, has a single order, or the
     *                         orders differ in channel count
     */
    public CombinedOrders combineOrders(GratingPart part) {
        Objects.requireNonNull(part, "part");
        List<Order> selected = new ArrayList<>();
        for (Order o : orders) {
            if (o.part() == part.code()) {
                selected.add(o);
            }
        }
        if (selected.isEmpty()) {
            throw new FormatException("Grating part " + part + " not found in spectrum file");
        }
        if (selected.size() == 1) {
            throw new FormatException("Only a single order found for " + part + "; nothing to combine");
        }

        OgipSpectrum first = selected.get(0).spectrum();
        int n = first.channelCount();
        double[] rate = new double[n];
        double[] err2 = new double[n];
        double[] sys2 = new double[n];
        int[] quality = new int[n];
        double[] areaScaling = new double[n];
        double[] backScaling = new double[n];
        double[] bkgRate = new double[n];
        double[] bkgErr2 = new double[n];
        boolean withBackground = selected.get(0).background().isPresent();

        for (Order o : selected) {
            OgipSpectrum s = o.spectrum();
            if (s.channelCount() != n) {
                throw new FormatException("Orders of " + part + " differ in number of channels");
            }
            double[] r = s.rates();
            double[] e = s.statErrors();
            double[] sy = s.sysErrors();
            int[] q = s.quality();
            double[] as = s.areaScaling();
            double[] bs = s.backScaling();
            for (int j = 0; j < n; j++) {
                rate[j] += r[j];
                err2[j] += e[j] * e[j];
                sys2[j] += sy[j] * sy[j];
                if (q[j] != 0) {
                    quality[j] = 1;
                }
                areaScaling[j] += as[j];
                backScaling[j] += bs[j];
            }
            if (withBackground) {
                OrderBackground b = o.background().orElseThrow(
                        () -> new FormatException("Background missing for order " + o.order()));
                double[] br = b.rates();
                double[] be = b.statErrors();
                for (int j = 0; j < n; j++) {
                    bkgRate[j] += br[j];
                    bkgErr2[j] += be[j] * be[j];
                }
            }
        }

        int count = selected.size();
        double[] statErr = new double[n];
        double[] sysErr = new double[n];
        double[] bkgErr = new double[n];
        for (int j = 0; j < n; j++) {
            statErr[j] = Math.sqrt(err2[j]);
            sysErr[j] = Math.sqrt(sys2[j]);
            bkgErr[j] = Math.sqrt(bkgErr2[j]);
            areaScaling[j] /= count;
            backScaling[j] /= count;
        }

        OgipSpectrum source = first.toBuilder()
                .rates(rate)
                .statErrors(statErr)
                .sysErrors(sysErr)
                .quality(quality)
                .grouping(new int[n])
                .areaScaling(areaScaling)
                .backScaling(backScaling)
                .build();

        Optional<OgipSpectrum> background = Optional.empty();
        if (withBackground) {
            double bkgScale = selected.get(0).background().get().backScaling();
            background = Optional.of(OgipSpectrum.builder()
                    .channels(first.channels())
                    .rates(bkgRate)
                    .statErrors(bkgErr)
                    .sysErrors(new double[n])
                    .quality(new int[n])
                    .grouping(new int[n])
                    .areaScaling(Masks.filled(n, 1.0))
                    .backScaling(Masks.filled(n, bkgScale))
                    .exposure(first.exposure())
                    .spectrumType("BKG")
                    .poissonErrors(true)
                    .build());
        }
        return new CombinedOrders(source, background, count);
    }
}
