package com.questrail.spex.convert;

import com.questrail.spex.clean.BadChannelCleaner;
import com.questrail.spex.config.ConversionConfig;
import com.questrail.spex.model.Region;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.ogip.OgipEffectiveArea;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionStageEvent;
import com.questrail.spex.observability.ConversionWarningEvent;

import java.util.Objects;

/**
 * OgipRegionConverter
 * -----------------------------------------------------------------------------
 * Turns one OGIP source spectrum with its response (and optionally background,
 * correction and effective area) into one SPEX {@link Region}.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>spectrum conversion, including background and correction subtraction</li>
 *   <li>response conversion, including the effective area</li>
 *   <li>channel shift correction for responses numbered from channel 0</li>
 *   <li>bad-channel cleaning when {@link ConversionConfig#removeBadChannels()}</li>
 * </ol>
 */
public final class OgipRegionConverter
{
    private final ConversionConfig config;
    private final ConversionObservabilitySink sink;
    private final OgipToSpexConverter converter;
    private final ChannelShiftCorrector shiftCorrector;
    private final BadChannelCleaner cleaner;

    public OgipRegionConverter(ConversionConfig config, ConversionObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.converter = new OgipToSpexConverter(config, sink);
        this.shiftCorrector = new ChannelShiftCorrector(sink);
        this.cleaner = new BadChannelCleaner(sink);
    }

    /**
     * @param background background spectrum, or {@code null}
     * @param correction correction spectrum, or {@code null}
     * @param area       effective area, or {@code null}
     */
    public Region convert(OgipSpectrum source,
                          OgipResponse response,
                          OgipSpectrum background,
                          OgipSpectrum correction,
                          OgipEffectiveArea area) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(response, "response");
        if (response.areaIncluded() && area != null) {
            sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                    "Response already includes the effective area; the area file is applied on top of it"));
        }

        sink.onStage(ConversionStageEvent.started(sink.clock(), "Convert spectrum"));
        ConvertedSpectrum spectrum = converter.convertSpectrum(
                source, response, background, correction, config.keepGrouping());
        sink.onStage(ConversionStageEvent.completed(sink.clock(), "Convert spectrum"));

        sink.onStage(ConversionStageEvent.started(sink.clock(), "Convert response"));
        ConvertedResponse converted = converter.convertResponse(response, area);
        ResponseMatrix corrected = shiftCorrector.detectAndCorrectShift(response, converted, spectrum);
        sink.onStage(ConversionStageEvent.completed(sink.clock(), "Convert response"));

        Region region = new Region(spectrum.spectrum(), corrected);
        region.check().orThrow("Converted region");
        if (config.removeBadChannels()) {
            sink.onStage(ConversionStageEvent.started(sink.clock(), "Remove bad channels"));
            region = cleaner.clean(region);
            sink.onStage(ConversionStageEvent.completed(sink.clock(), "Remove bad channels"));
        }
        return region;
    }
}
