package com.questrail.spex.runtime;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The spectrum and response files written for one dataset.
 */
public record SpexOutput(Path spectrumFile, Path responseFile)
{
    public SpexOutput {
        Objects.requireNonNull(spectrumFile, "spectrumFile");
        Objects.requireNonNull(responseFile, "responseFile");
    }
}
