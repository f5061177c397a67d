package com.questrail.spex.resolution;

import com.questrail.spex.api.SectorRegion;

import java.util.List;
import java.util.Objects;

/**
 * Resolution elements of one region with the expected photon count per
 * element and the total number of resolution elements {@code R}.
 *
 * <p>{@code expectedCounts[i]} belongs to {@code elements.get(i)}.</p>
 */
public record ResolutionReport(
    SectorRegion key,
    List<ResolutionElement> elements,
    double[] expectedCounts,
    double resolutionElements
) {
    public ResolutionReport {
        Objects.requireNonNull(key, "key");
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        expectedCounts = Objects.requireNonNull(expectedCounts, "expectedCounts").clone();
        if (expectedCounts.length != elements.size()) {
            throw new IllegalArgumentException("expectedCounts has " + expectedCounts.length
                    + " entries for " + elements.size() + " elements");
        }
    }

    @Override
    public double[] expectedCounts() {
        return expectedCounts.clone();
    }

    public int elementCount() {
        return elements.size();
    }

    public OptimalBinning.BinWidths optimalWidths(int index) {
        return OptimalBinning.widths(elements.get(index), expectedCounts[index], resolutionElements);
    }

    /**
     * Optimal data bin width at {@code energy}, taken from the non-degenerate
     * element whose centroid lies closest. 0 when every element is degenerate.
     */
    public double dataBinWidthAt(double energy) {
        int best = -1;
        double distance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < elements.size(); i++) {
            ResolutionElement e = elements.get(i);
            if (e.isDegenerate()) {
                continue;
            }
            double d = Math.abs(e.centroid() - energy);
            if (d < distance) {
                distance = d;
                best = i;
            }
        }
        return best < 0 ? 0.0 : optimalWidths(best).dataBinWidth();
    }
}
