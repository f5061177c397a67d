package com.questrail.spex.runtime;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.api.SectorRegion;
import com.questrail.spex.api.SpexException;
import com.questrail.spex.config.ConversionConfig;
import com.questrail.spex.convert.GratingRegionConverter;
import com.questrail.spex.convert.GratingRegionConverter.OrderResponse;
import com.questrail.spex.convert.OgipRegionConverter;
import com.questrail.spex.io.ArfFormat;
import com.questrail.spex.io.Pha2Format;
import com.questrail.spex.io.PhaFormat;
import com.questrail.spex.io.ResFormat;
import com.questrail.spex.io.RmfFormat;
import com.questrail.spex.io.SpexFileNames;
import com.questrail.spex.io.SpoFormat;
import com.questrail.spex.model.Dataset;
import com.questrail.spex.model.Region;
import com.questrail.spex.model.ResponseMatrix;
import com.questrail.spex.model.Spectrum;
import com.questrail.spex.model.ogip.OgipEffectiveArea;
import com.questrail.spex.model.ogip.OgipResponse;
import com.questrail.spex.model.ogip.OgipSpectrum;
import com.questrail.spex.model.ogip.OgipTypeIISpectrum;
import com.questrail.spex.observability.ClockedObservabilitySink;
import com.questrail.spex.observability.ConversionErrorEvent;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionStageEvent;
import com.questrail.spex.observability.NullObservabilitySink;
import com.questrail.spex.resolution.ResolutionAnalyzer;
import com.questrail.spex.resolution.ResolutionReport;
import com.questrail.spex.table.TabularStore;
import com.questrail.spex.table.TabularStoreFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * SpexConversionRuntime
 * =============================================================================
 * Composition root for file-level conversions: reads OGIP files, converts
 * them to SPEX regions and writes {@code .spo} / {@code .res} pairs.
 *
 * <h2>Errors</h2>
 * Every public flow reports a failing {@link SpexException} to the
 * observability sink before rethrowing it. Output files are only written
 * once the whole dataset has been converted and checked, and neither file
 * of a pair is written when the other may not be replaced.
 */
public final class SpexConversionRuntime
{
    private final ConversionConfig config;
    private final ConversionObservabilitySink sink;
    private final TabularStoreFactory stores;
    private final Clock clock;

    private SpexConversionRuntime(ConversionConfig config,
                                  ConversionObservabilitySink sink,
                                  TabularStoreFactory stores,
                                  Clock clock) {
        this.config = config;
        this.sink = new ClockedObservabilitySink(sink, clock);
        this.stores = stores;
        this.clock = clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConversionConfig config() {
        return config;
    }

    // ---------------------------------------------------------------------
    // OGIP
    // ---------------------------------------------------------------------

    /**
     * Reads and converts one OGIP region.
     */
    public Region convertOgip(OgipInput input) {
        Objects.requireNonNull(input, "input");
        return reported("OGIP conversion of " + input.spectrum(), () -> {
            OgipSpectrum source = stage("Read source spectrum", () -> readSpectrum(input.spectrum()));
            OgipResponse response = stage("Read response", () -> readResponse(input.response()));
            OgipSpectrum background = input.background()
                    .map(p -> stage("Read background spectrum", () -> readSpectrum(p)))
                    .orElse(null);
            OgipSpectrum correction = input.correction()
                    .map(p -> stage("Read correction spectrum", () -> readSpectrum(p)))
                    .orElse(null);
            OgipEffectiveArea area = input.effectiveArea()
                    .map(p -> stage("Read effective area", () -> readArea(p)))
                    .orElse(null);
            return new OgipRegionConverter(config, sink).convert(source, response, background, correction, area);
        });
    }

    /**
     * Converts every input as one region of sector 1 and writes the dataset
     * to {@code outputPrefix.spo} and {@code outputPrefix.res}.
     */
    public SpexOutput convertOgip(List<OgipInput> inputs, Path outputPrefix) {
        Objects.requireNonNull(inputs, "inputs");
        Dataset dataset = Dataset.empty();
        for (OgipInput input : inputs) {
            dataset = dataset.append(convertOgip(input));
        }
        return write(dataset, outputPrefix);
    }

    // ---------------------------------------------------------------------
    // Simulation templates
    // ---------------------------------------------------------------------

    /**
     * Converts a response (and optional effective area and background)
     * into a region whose spectrum is the placeholder of
     * {@link OgipSpectrum#simulationTemplate}, for simulating observations
     * that have no source spectrum.
     */
    public Region simulate(SimulationInput input) {
        Objects.requireNonNull(input, "input");
        return reported("Simulation template for " + input.response(), () -> {
            OgipResponse response = stage("Read response", () -> readResponse(input.response()));
            OgipSpectrum background = input.background()
                    .map(p -> stage("Read background spectrum", () -> readSpectrum(p)))
                    .map(b -> b.withBackScalingDividedBy(input.backgroundScale()))
                    .orElse(null);
            OgipEffectiveArea area = input.effectiveArea()
                    .map(p -> stage("Read effective area", () -> readArea(p)))
                    .orElse(null);
            OgipSpectrum source = OgipSpectrum.simulationTemplate(response);
            return new OgipRegionConverter(config, sink).convert(source, response, background, null, area);
        });
    }

    public SpexOutput simulate(SimulationInput input, Path outputPrefix) {
        return write(Dataset.empty().append(simulate(input)), outputPrefix);
    }

    // ---------------------------------------------------------------------
    // Gratings
    // ---------------------------------------------------------------------

    /**
     * Reads a type II spectrum and its order responses and converts one
     * grating arm into a single region.
     */
    public Region convertGrating(GratingInput input) {
        Objects.requireNonNull(input, "input");
        return reported("Grating conversion of " + input.spectrum(), () -> {
            OgipTypeIISpectrum spectrum = stage("Read type II spectrum", () -> {
                try (TabularStore store = stores.open(input.spectrum())) {
                    return Pha2Format.read(store, config.forcePoissonErrors(), config.subtractBackground(), sink);
                }
            });
            List<OgipResponse> responses = new ArrayList<>();
            for (Path p : input.responses()) {
                responses.add(stage("Read response " + p.getFileName(), () -> readResponse(p)));
            }
            List<OgipEffectiveArea> areas = new ArrayList<>();
            for (Path p : input.effectiveAreas()) {
                areas.add(stage("Read effective area " + p.getFileName(), () -> readArea(p)));
            }
            List<OrderResponse> orders = GratingRegionConverter.pair(responses, areas);
            return new GratingRegionConverter(config, sink).convert(spectrum, input.part(), orders);
        });
    }

    public SpexOutput convertGrating(GratingInput input, Path outputPrefix) {
        return write(Dataset.empty().append(convertGrating(input)), outputPrefix);
    }

    // ---------------------------------------------------------------------
    // SPEX files
    // ---------------------------------------------------------------------

    /**
     * Writes all regions of {@code dataset} into one spectrum and one
     * response file named after {@code outputPrefix}.
     */
    public SpexOutput write(Dataset dataset, Path outputPrefix) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(outputPrefix, "outputPrefix");
        return reported("Writing " + outputPrefix, () -> {
            Spectrum spectrum = dataset.toSpectrum();
            ResponseMatrix response = dataset.toResponse();
            spectrum.check().orThrow("Combined spectrum");
            response.check().orThrow("Combined response");

            Path spo = SpexFileNames.spectrumFile(outputPrefix, sink);
            Path res = SpexFileNames.responseFile(outputPrefix, sink);
            requireWritable(spo);
            requireWritable(res);
            List<String> history = history();
            stage("Write " + spo.getFileName(), () -> {
                try (TabularStore store = stores.create(spo, config.overwrite(), history)) {
                    SpoFormat.write(spectrum, store);
                }
                return spo;
            });
            stage("Write " + res.getFileName(), () -> {
                try (TabularStore store = stores.create(res, config.overwrite(), history)) {
                    ResFormat.write(response, store);
                }
                return res;
            });
            return new SpexOutput(spo, res);
        });
    }

    /**
     * Reads a SPEX spectrum and response pair into a dataset.
     */
    public Dataset read(Path spectrumFile, Path responseFile) {
        Objects.requireNonNull(spectrumFile, "spectrumFile");
        Objects.requireNonNull(responseFile, "responseFile");
        return reported("Reading " + spectrumFile, () -> {
            Spectrum spectrum = stage("Read " + spectrumFile.getFileName(), () -> {
                try (TabularStore store = stores.open(spectrumFile)) {
                    return SpoFormat.read(store);
                }
            });
            ResponseMatrix response = stage("Read " + responseFile.getFileName(), () -> {
                try (TabularStore store = stores.open(responseFile)) {
                    return ResFormat.read(store);
                }
            });
            return Dataset.of(spectrum, response);
        });
    }

    /**
     * Resolution of one region of a SPEX file pair.
     */
    public ResolutionReport resolution(Path spectrumFile, Path responseFile, SectorRegion key) {
        Objects.requireNonNull(key, "key");
        Dataset dataset = read(spectrumFile, responseFile);
        return reported("Resolution of " + key, () -> stage("Compute resolution",
                () -> new ResolutionAnalyzer().analyze(dataset.region(key))));
    }

    // ---------------------------------------------------------------------

    private OgipSpectrum readSpectrum(Path path) {
        try (TabularStore store = stores.open(path)) {
            return PhaFormat.read(store, sink);
        }
    }

    private OgipResponse readResponse(Path path) {
        try (TabularStore store = stores.open(path)) {
            return RmfFormat.read(store, sink);
        }
    }

    private OgipEffectiveArea readArea(Path path) {
        try (TabularStore store = stores.open(path)) {
            return ArfFormat.read(store, sink);
        }
    }

    private void requireWritable(Path target) {
        if (!config.overwrite() && stores.exists(target)) {
            throw new FormatException("File " + target + " already exists; enable overwrite to replace it");
        }
    }

    private List<String> history() {
        List<String> lines = new ArrayList<>();
        lines.add("Created on: " + clock.instant());
        lines.addAll(config.history());
        return lines;
    }

    private <T> T stage(String name, Supplier<T> work) {
        sink.onStage(ConversionStageEvent.started(sink.clock(), name));
        T result = work.get();
        sink.onStage(ConversionStageEvent.completed(sink.clock(), name));
        return result;
    }

    private <T> T reported(String what, Supplier<T> work) {
        try {
            return work.get();
        } catch (SpexException ex) {
            sink.onError(ConversionErrorEvent.of(sink.clock(), what + " failed: " + ex.getMessage(), ex));
            throw ex;
        }
    }

    public static final class Builder {
        private ConversionConfig config = ConversionConfig.defaults();
        private ConversionObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private TabularStoreFactory stores = TabularStoreFactory.fits();
        private Clock clock = Clock.systemUTC();

        public Builder withConfig(ConversionConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ConversionObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withStoreFactory(TabularStoreFactory stores) {
            this.stores = stores;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SpexConversionRuntime build() {
            return new SpexConversionRuntime(
                    Objects.requireNonNull(config, "config"),
                    Objects.requireNonNull(sink, "sink"),
                    Objects.requireNonNull(stores, "stores"),
                    Objects.requireNonNull(clock, "clock"));
        }
    }
}
