package com.questrail.spex.io;

import com.questrail.spex.observability.ConversionObservabilitySink;
import com.questrail.spex.observability.ConversionWarningEvent;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Output file naming for SPEX files.
 */
public final class SpexFileNames
{
    public static final String SPECTRUM_EXTENSION = ".spo";
    public static final String RESPONSE_EXTENSION = ".res";

    private SpexFileNames() {}

    public static Path spectrumFile(Path path, ConversionObservabilitySink sink) {
        return withExtension(path, SPECTRUM_EXTENSION, sink);
    }

    public static Path responseFile(Path path, ConversionObservabilitySink sink) {
        return withExtension(path, RESPONSE_EXTENSION, sink);
    }

    /**
     * Returns {@code path} with the given extension. A name carrying a
     * different extension gets it replaced and a warning is reported; a name
     * without any extension gets it appended silently.
     */
    static Path withExtension(Path path, String extension, ConversionObservabilitySink sink) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(sink, "sink");
        String name = path.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(extension)) {
            return path;
        }
        int dot = name.lastIndexOf('.');
        String fixed;
        if (dot > 0) {
            fixed = name.substring(0, dot) + extension;
            sink.onWarning(ConversionWarningEvent.of(sink.clock(),
                    "File name " + name + " does not end with " + extension + "; writing " + fixed));
        } else {
            fixed = name + extension;
        }
        return path.resolveSibling(fixed);
    }
}
