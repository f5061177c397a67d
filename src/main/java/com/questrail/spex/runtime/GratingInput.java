package com.questrail.spex.runtime;

import com.questrail.spex.model.ogip.GratingPart;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A PHA type II file, the grating arm to extract and one response and
 * effective-area file per order, paired by position.
 */
public record GratingInput(
    Path spectrum,
    GratingPart part,
    List<Path> responses,
    List<Path> effectiveAreas
) {
    public GratingInput {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(part, "part");
        responses = List.copyOf(Objects.requireNonNull(responses, "responses"));
        effectiveAreas = List.copyOf(Objects.requireNonNull(effectiveAreas, "effectiveAreas"));
    }
}
