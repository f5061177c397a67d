package com.questrail.spex.cli;

import com.questrail.spex.api.SectorRegion;
import com.questrail.spex.api.SpexException;
import com.questrail.spex.config.ConversionConfig;
import com.questrail.spex.model.ogip.GratingPart;
import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.Slf4jConversionObservabilitySink;
import com.questrail.spex.resolution.OptimalBinning;
import com.questrail.spex.resolution.ResolutionElement;
import com.questrail.spex.resolution.ResolutionReport;
import com.questrail.spex.runtime.GratingInput;
import com.questrail.spex.runtime.OgipInput;
import com.questrail.spex.runtime.SimulationInput;
import com.questrail.spex.runtime.SpexConversionRuntime;
import com.questrail.spex.runtime.SpexOutput;
import com.questrail.spex.table.TabularStoreFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SpexConvertCli
 * =============================================================================
 * Command line entry point.
 *
 * <h2>Subcommands</h2>
 * <pre>
 *   ogip       --pha F --rmf F [--bkg F] [--arf F] [--corr F] [--out PREFIX]
 *              [--keep-grouping] [--badchan] [--exp-rate] [--overwrite]
 *   grating    --pha2 F --part HEG|MEG|LEG --rmf F... --arf F... [--out PREFIX]
 *              [--no-bkg] [--no-poisson] [--keep-grouping] [--badchan] [--exp-rate] [--overwrite]
 *   simres     --rmf F [--arf F] [--bkg F [--backscale X]] [--out PREFIX]
 *              [--keep-grouping] [--badchan] [--exp-rate] [--overwrite]
 *   resolution --spo F --res F [--sector N] [--region N]
 * </pre>
 *
 * <h2>Exit codes</h2>
 * 0 on success, 1 when a conversion fails, 2 for an invalid command line.
 */
public final class SpexConvertCli
{
    private static final Logger log = LoggerFactory.getLogger(SpexConvertCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> COMMON_FLAGS =
            Set.of("--keep-grouping", "--badchan", "--exp-rate", "--overwrite");

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: spex-convert <command> [options]",
            "  ogip       --pha F --rmf F [--bkg F] [--arf F] [--corr F] [--out PREFIX]",
            "             [--keep-grouping] [--badchan] [--exp-rate] [--overwrite]",
            "  grating    --pha2 F --part HEG|MEG|LEG --rmf F... --arf F... [--out PREFIX]",
            "             [--no-bkg] [--no-poisson] [--keep-grouping] [--badchan] [--exp-rate] [--overwrite]",
            "  simres     --rmf F [--arf F] [--bkg F [--backscale X]] [--out PREFIX]",
            "             [--keep-grouping] [--badchan] [--exp-rate] [--overwrite]",
            "  resolution --spo F --res F [--sector N] [--region N]");

    private SpexConvertCli() {}

    public static void main(String[] args) {
        System.exit(run(args, new Slf4jConversionObservabilitySink(), TabularStoreFactory.fits()));
    }

    static int run(String[] args, ConversionObservabilitySink sink, TabularStoreFactory stores) {
        if (args.length == 0) {
            log.error(USAGE);
            return EXIT_USAGE;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        List<String> history = List.of("Command used: spex-convert " + String.join(" ", args));
        try {
            switch (args[0]) {
                case "ogip" -> ogip(rest, history, sink, stores);
                case "grating" -> grating(rest, history, sink, stores);
                case "simres" -> simres(rest, history, sink, stores);
                case "resolution" -> resolution(rest, sink, stores);
                default -> throw new UsageException("Unknown command: " + args[0]);
            }
            return EXIT_OK;
        } catch (UsageException ex) {
            log.error("{}", ex.getMessage());
            log.error(USAGE);
            return EXIT_USAGE;
        } catch (SpexException ex) {
            // already reported through the sink
            return EXIT_FAILED;
        }
    }

    private static void ogip(List<String> args, List<String> history,
                             ConversionObservabilitySink sink, TabularStoreFactory stores) {
        CommandArguments a = CommandArguments.parse(args,
                Set.of("--pha", "--rmf", "--bkg", "--arf", "--corr", "--out"), COMMON_FLAGS);
        Path pha = Path.of(a.required("--pha"));
        OgipInput input = OgipInput.of(pha, Path.of(a.required("--rmf")))
                .withBackground(a.option("--bkg").map(Path::of).orElse(null))
                .withEffectiveArea(a.option("--arf").map(Path::of).orElse(null))
                .withCorrection(a.option("--corr").map(Path::of).orElse(null));
        Path out = a.option("--out").map(Path::of).orElseGet(() -> stripExtension(pha));

        SpexConversionRuntime runtime = runtime(config(a, history).build(), sink, stores);
        report(runtime.convertOgip(List.of(input), out));
    }

    private static void grating(List<String> args, List<String> history,
                                ConversionObservabilitySink sink, TabularStoreFactory stores) {
        Set<String> flags = new HashSet<>(COMMON_FLAGS);
        flags.add("--no-bkg");
        flags.add("--no-poisson");
        CommandArguments a = CommandArguments.parse(args,
                Set.of("--pha2", "--part", "--rmf", "--arf", "--out"), flags);
        Path pha2 = Path.of(a.required("--pha2"));
        GratingPart part;
        try {
            part = GratingPart.parse(a.required("--part"));
        } catch (IllegalArgumentException ex) {
            throw new UsageException(ex.getMessage());
        }
        List<Path> rmfs = a.all("--rmf").stream().map(Path::of).collect(Collectors.toList());
        List<Path> arfs = a.all("--arf").stream().map(Path::of).collect(Collectors.toList());
        if (rmfs.isEmpty()) {
            throw new UsageException("Missing required option --rmf");
        }
        Path out = a.option("--out").map(Path::of).orElseGet(() -> Path.of(
                stripExtension(pha2) + "_" + part.name().toLowerCase(Locale.ROOT)));

        ConversionConfig config = config(a, history)
                .withSubtractBackground(!a.flag("--no-bkg"))
                .withForcePoissonErrors(!a.flag("--no-poisson"))
                .build();
        SpexConversionRuntime runtime = runtime(config, sink, stores);
        report(runtime.convertGrating(new GratingInput(pha2, part, rmfs, arfs), out));
    }

    private static void simres(List<String> args, List<String> history,
                               ConversionObservabilitySink sink, TabularStoreFactory stores) {
        CommandArguments a = CommandArguments.parse(args,
                Set.of("--rmf", "--arf", "--bkg", "--backscale", "--out"), COMMON_FLAGS);
        Path rmf = Path.of(a.required("--rmf"));
        double backscale = a.option("--backscale").map(SpexConvertCli::positiveNumber).orElse(1.0);
        if (a.option("--backscale").isPresent() && a.option("--bkg").isEmpty()) {
            throw new UsageException("--backscale requires --bkg");
        }
        SimulationInput input = SimulationInput.of(rmf)
                .withEffectiveArea(a.option("--arf").map(Path::of).orElse(null))
                .withBackground(a.option("--bkg").map(Path::of).orElse(null), backscale);
        Path out = a.option("--out").map(Path::of).orElseGet(() -> stripExtension(rmf));

        SpexConversionRuntime runtime = runtime(config(a, history).build(), sink, stores);
        report(runtime.simulate(input, out));
    }

    private static double positiveNumber(String text) {
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new UsageException("Not a number: " + text);
        }
        if (!(value > 0.0)) {
            throw new UsageException("Expected a positive number: " + text);
        }
        return value;
    }

    private static void resolution(List<String> args, ConversionObservabilitySink sink, TabularStoreFactory stores) {
        CommandArguments a = CommandArguments.parse(args,
                Set.of("--spo", "--res", "--sector", "--region"), Set.of());
        SectorRegion key;
        try {
            key = SectorRegion.of(a.intOption("--sector", 1), a.intOption("--region", 1));
        } catch (IllegalArgumentException ex) {
            throw new UsageException(ex.getMessage());
        }
        SpexConversionRuntime runtime = runtime(ConversionConfig.defaults(), sink, stores);
        ResolutionReport report = runtime.resolution(
                Path.of(a.required("--spo")), Path.of(a.required("--res")), key);

        log.info("Resolution of {}: {} model energies, R = {}",
                report.key(), report.elementCount(), String.format(Locale.ROOT, "%.3f", report.resolutionElements()));
        for (int i = 0; i < report.elementCount(); i++) {
            ResolutionElement e = report.elements().get(i);
            if (e.isDegenerate()) {
                continue;
            }
            OptimalBinning.BinWidths widths = report.optimalWidths(i);
            log.info(String.format(Locale.ROOT,
                    "E = %.5f keV  FWHM = %.5f keV  Nr = %.1f  data bin = %.5f keV  model bin = %.5f keV",
                    e.centroid(), e.fwhm(), report.expectedCounts()[i],
                    widths.dataBinWidth(), widths.modelBinWidth()));
        }
    }

    private static ConversionConfig.Builder config(CommandArguments a, List<String> history) {
        return ConversionConfig.builder()
                .withKeepGrouping(a.flag("--keep-grouping"))
                .withRemoveBadChannels(a.flag("--badchan"))
                .withWriteExpRate(a.flag("--exp-rate"))
                .withOverwrite(a.flag("--overwrite"))
                .withHistory(history);
    }

    private static SpexConversionRuntime runtime(ConversionConfig config,
                                                 ConversionObservabilitySink sink,
                                                 TabularStoreFactory stores) {
        return SpexConversionRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(sink)
                .withStoreFactory(stores)
                .build();
    }

    private static void report(SpexOutput output) {
        log.info("Wrote {} and {}", output.spectrumFile(), output.responseFile());
    }

    private static Path stripExtension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path parent = path.getParent();
        return parent == null ? Path.of(stem) : parent.resolve(stem);
    }
}
