package com.questrail.spex.runtime;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Files for a simulation template: only the response is required. The
 * background's BACKSCAL values are divided by {@code backgroundScale}.
 */
public record SimulationInput(
    Path response,
    Optional<Path> effectiveArea,
    Optional<Path> background,
    double backgroundScale
) {
    public SimulationInput {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(effectiveArea, "effectiveArea");
        Objects.requireNonNull(background, "background");
        if (!(backgroundScale > 0.0)) {
            throw new IllegalArgumentException("backgroundScale must be positive: " + backgroundScale);
        }
    }

    public static SimulationInput of(Path response) {
        return new SimulationInput(response, Optional.empty(), Optional.empty(), 1.0);
    }

    public SimulationInput withEffectiveArea(Path effectiveArea) {
        return new SimulationInput(response, Optional.ofNullable(effectiveArea), background, backgroundScale);
    }

    public SimulationInput withBackground(Path background, double backgroundScale) {
        return new SimulationInput(response, effectiveArea, Optional.ofNullable(background), backgroundScale);
    }
}
