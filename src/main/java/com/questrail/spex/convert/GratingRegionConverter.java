package com.questrail.spex.convert;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.clean.BadChannelCleaner;
import com.questrail.spex.config.ConversionConfig;
import com.questrail.spex.model.Region;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.ogip.GratingPart;
import com.questrail.spex.model.ogip.OgipEffectiveArea;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.model.ogip.OgipTypeIISpectrum;
import com.questrail.spex.model.ogip.OgipTypeIISpectrum.CombinedOrders;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionStageEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * GratingRegionConverter
 * -----------------------------------------------------------------------------
 * Converts one arm of a grating observation (a PHA type II file plus one
 * RMF/ARF pair per order) into a single SPEX {@link Region}.
 *
 * <p>The orders of the arm are summed into one spectrum. Each order's
 * response becomes one component of the region, all labelled sector 1,
 * region 1, in increasing order number. The channel grid of the spectrum is
 * taken from the response of the lowest order.</p>
 *
 * <p>Grating responses are numbered from channel 1, so no shift correction
 * is applied.</p>
 */
public final class GratingRegionConverter
{
    private final ConversionConfig config;
    private final ConversionObservabilitySink sink;
    private final OgipToSpexConverter converter;
    private final BadChannelCleaner cleaner;

    public GratingRegionConverter(ConversionConfig config, ConversionObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.converter = new OgipToSpexConverter(config, sink);
        this.cleaner = new BadChannelCleaner(sink);
    }

    /** A response and effective area of one grating order. */
    public record OrderResponse(OgipResponse response, OgipEffectiveArea area)
    {
        public OrderResponse {
            Objects.requireNonNull(response, "response");
            Objects.requireNonNull(area, "area");
        }
    }

    /**
     * Pairs responses and areas by position.
     *
     * @throws FormatException if the lists differ in length
     */
    public static List<OrderResponse> pair(List<OgipResponse> responses, List<OgipEffectiveArea> areas) {
        if (responses.size() != areas.size()) {
            throw new FormatException("Number of response files (" + responses.size()
                    + ") differs from number of effective area files (" + areas.size() + ")");
        }
        List<OrderResponse> pairs = new ArrayList<>(responses.size());
        for (int i = 0; i < responses.size(); i++) {
            pairs.add(new OrderResponse(responses.get(i), areas.get(i)));
        }
        return pairs;
    }

    /**
     * @throws FormatException if no responses are given, two responses carry
     *         the same order, or the arm cannot be combined
     */
    public Region convert(OgipTypeIISpectrum spectrum, GratingPart part, List<OrderResponse> orders) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(part, "part");
        Objects.requireNonNull(orders, "orders");
        if (orders.isEmpty()) {
            throw new FormatException("No responses given for grating part " + part);
        }
        Set<Integer> seen = new HashSet<>();
        for (OrderResponse o : orders) {
            if (!seen.add(o.response().order())) {
                throw new FormatException("Order " + o.response().order() + " given twice for " + part);
            }
        }
        List<OrderResponse> sorted = new ArrayList<>(orders);
        sorted.sort(Comparator.comparingInt(o -> o.response().order()));

        sink.onStage(ConversionStageEvent.started(sink.clock(), "Combine " + part + " orders"));
        CombinedOrders combined = spectrum.combineOrders(part);
        sink.onStage(ConversionStageEvent.completed(sink.clock(), "Combine " + part + " orders"));

        sink.onStage(ConversionStageEvent.started(sink.clock(), "Convert spectrum"));
        OgipSpectrum background = config.subtractBackground() ? combined.background().orElse(null) : null;
        ConvertedSpectrum converted = converter.convertSpectrum(
                combined.source(), sorted.get(0).response(), background, null, config.keepGrouping());
        sink.onStage(ConversionStageEvent.completed(sink.clock(), "Convert spectrum"));

        sink.onStage(ConversionStageEvent.started(sink.clock(), "Convert responses"));
        ResponseMatrix response = ResponseMatrix.empty();
        for (OrderResponse o : sorted) {
            ConvertedResponse component = converter.convertResponse(o.response(), o.area());
            response = response.appendAllComponents(component.response(), 1, 1);
        }
        sink.onStage(ConversionStageEvent.completed(sink.clock(), "Convert responses"));

        Region region = new Region(converted.spectrum(), response, part.name());
        region.check().orThrow("Converted " + part + " region");
        if (config.removeBadChannels()) {
            sink.onStage(ConversionStageEvent.started(sink.clock(), "Remove bad channels"));
            region = cleaner.clean(region);
            sink.onStage(ConversionStageEvent.completed(sink.clock(), "Remove bad channels"));
        }
        return region;
    }
}
