package com.questrail.spex.runtime;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Files of one OGIP region: source spectrum and response are required.
 */
public record OgipInput(
    Path spectrum,
    Path response,
    Optional<Path> background,
    Optional<Path> effectiveArea,
    Optional<Path> correction
) {
    public OgipInput {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(background, "background");
        Objects.requireNonNull(effectiveArea, "effectiveArea");
        Objects.requireNonNull(correction, "correction");
    }

    public static OgipInput of(Path spectrum, Path response) {
        return new OgipInput(spectrum, response, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public OgipInput withBackground(Path background) {
        return new OgipInput(spectrum, response, Optional.ofNullable(background), effectiveArea, correction);
    }

    public OgipInput withEffectiveArea(Path effectiveArea) {
        return new OgipInput(spectrum, response, background, Optional.ofNullable(effectiveArea), correction);
    }

    public OgipInput withCorrection(Path correction) {
        return new OgipInput(spectrum, response, background, effectiveArea, Optional.ofNullable(correction));
    }
}
