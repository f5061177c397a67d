package com.questrail.spex.model;

import com.questrail.spex.api.ArrayLengthMismatchException;
import com.questrail.spex.api.ChannelOutOfRangeException;
import com.questrail.spex.api.CheckResult;
import com.questrail.spex.api.IncompatibleMatrixException;
import com.questrail.spex.api.RegionNotFoundException;
import com.questrail.spex.api.SectorRegion;
import com.questrail.spex.mapping.Masks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ResponseMatrix
 * -----------------------------------------------------------------------------
 * Sparse, multi-component response matrix in the SPEX layout.
 *
 * <h2>Layout</h2>
 * Three flat tables, each one row per entry:
 * <ol>
 *   <li><b>components</b>: channel count, group count, sector, region and,
 *       when {@link #hasSharedComponents()}, a shared-component id</li>
 *   <li><b>groups</b>: one per non-empty model energy bin of a component:
 *       energy bounds, first/last channel (1-based), channel count and, when
 *       {@link #hasAreaScaling()}, a relative area</li>
 *   <li><b>values</b>: one per (group, channel), with a derivative when
 *       {@link #hasResponseDerivative()}</li>
 * </ol>
 * The groups of component {@code k} start at the sum of the group counts
 * of components {@code 0..k-1}; the values of group {@code g} start at the
 * sum of the channel counts of groups {@code 0..g-1}. No per-component
 * containers are kept.
 *
 * <h2>Invariants</h2>
 * Checked by {@link #check()}, which never throws:
 * <ul>
 *   <li>{@code last - first + 1 == channelCount} for every group</li>
 *   <li>{@code 1 <= first} and {@code last <= component channel count} for non-empty groups</li>
 *   <li>energy bins of positive width, lower bounds non-decreasing per component</li>
 *   <li>every response value {@code >= 0}</li>
 *   <li>{@code sum(group channel counts) == number of values}</li>
 * </ul>
 *
 * <p>Instances are immutable; every operation returns a new matrix.</p>
 */
public final class ResponseMatrix
{
    private static final ResponseMatrix EMPTY = builder().build();

    // Components
    private final int[] componentChannels;
    private final int[] componentGroups;
    private final int[] sectors;
    private final int[] regions;
    private final int[] sharedComponents;

    // Groups
    private final double[] lowEnergy;
    private final double[] highEnergy;
    private final int[] firstChannel;
    private final int[] lastChannel;
    private final int[] groupChannels;
    private final double[] relativeArea;

    // Values
    private final double[] values;
    private final double[] derivatives;

    private final boolean sharedComponentsFlag;
    private final boolean areaScaling;
    private final boolean responseDerivative;

    private ResponseMatrix(Builder b) {
        this.componentChannels = b.componentChannels;
        this.componentGroups = b.componentGroups;
        this.sectors = b.sectors;
        this.regions = b.regions;
        this.sharedComponentsFlag = b.sharedComponents != null;
        this.sharedComponents = sharedComponentsFlag ? b.sharedComponents : new int[0];
        this.lowEnergy = b.lowEnergy;
        this.highEnergy = b.highEnergy;
        this.firstChannel = b.firstChannel;
        this.lastChannel = b.lastChannel;
        this.groupChannels = b.groupChannels;
        this.areaScaling = b.relativeArea != null;
        this.relativeArea = areaScaling ? b.relativeArea : new double[0];
        this.values = b.values;
        this.responseDerivative = b.derivatives != null;
        this.derivatives = responseDerivative ? b.derivatives : new double[0];
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .components(componentChannels, componentGroups, sectors, regions)
                .groups(lowEnergy, highEnergy, firstChannel, lastChannel, groupChannels)
                .values(values);
        if (sharedComponentsFlag) {
            b.sharedComponents(sharedComponents);
        }
        if (areaScaling) {
            b.relativeAreas(relativeArea);
        }
        if (responseDerivative) {
            b.derivatives(derivatives);
        }
        return b;
    }

    public static ResponseMatrix empty() {
        return EMPTY;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public boolean isEmpty() {
        return componentChannels.length == 0;
    }

    public int componentCount() {
        return componentChannels.length;
    }

    public int groupCount() {
        return lowEnergy.length;
    }

    public int valueCount() {
        return values.length;
    }

    public boolean hasSharedComponents() {
        return sharedComponentsFlag;
    }

    public boolean hasAreaScaling() {
        return areaScaling;
    }

    public boolean hasResponseDerivative() {
        return responseDerivative;
    }

    /** Channel count per component. */
    public int[] componentChannelCounts() {
        return componentChannels.clone();
    }

    /** Group count per component. */
    public int[] componentGroupCounts() {
        return componentGroups.clone();
    }

    public int[] sectors() {
        return sectors.clone();
    }

    public int[] regions() {
        return regions.clone();
    }

    public int[] sharedComponents() {
        return sharedComponents.clone();
    }

    public double[] lowEnergies() {
        return lowEnergy.clone();
    }

    public double[] highEnergies() {
        return highEnergy.clone();
    }

    public int[] firstChannels() {
        return firstChannel.clone();
    }

    public int[] lastChannels() {
        return lastChannel.clone();
    }

    /** Channel count per group. */
    public int[] groupChannelCounts() {
        return groupChannels.clone();
    }

    public double[] relativeAreas() {
        return relativeArea.clone();
    }

    public double[] values() {
        return values.clone();
    }

    public double[] derivatives() {
        return derivatives.clone();
    }

    /**
     * Distinct (sector, region) keys in component order.
     */
    public List<SectorRegion> regionKeys() {
        Set<SectorRegion> keys = new LinkedHashSet<>();
        for (int i = 0; i < sectors.length; i++) {
            keys.add(SectorRegion.of(sectors[i], regions[i]));
        }
        return List.copyOf(keys);
    }

    /**
     * Index of the first group of each component, plus a trailing entry
     * holding the total.
     */
    public int[] componentGroupOffsets() {
        int[] offsets = new int[componentGroups.length + 1];
        for (int i = 0; i < componentGroups.length; i++) {
            offsets[i + 1] = offsets[i] + componentGroups[i];
        }
        return offsets;
    }

    /**
     * Index of the first value of each group, plus a trailing entry holding
     * the total.
     */
    public int[] groupValueOffsets() {
        int[] offsets = new int[groupChannels.length + 1];
        for (int i = 0; i < groupChannels.length; i++) {
            offsets[i + 1] = offsets[i] + groupChannels[i];
        }
        return offsets;
    }

    // ---------------------------------------------------------------------
    // Region operations
    // ---------------------------------------------------------------------

    /**
     * Masks selecting every component labelled (sector, region) together with
     * its groups and values.
     *
     * @throws RegionNotFoundException     if no component carries the key
     * @throws ArrayLengthMismatchException if the table lengths do not match
     *                                      the declared counts
     */
    public ResponseMasks regionMask(int sector, int region) {
        requireConsistentCounts();
        int[] groupOffsets = componentGroupOffsets();
        int[] valueOffsets = groupValueOffsets();

        BitSet components = new BitSet(componentChannels.length);
        BitSet groups = new BitSet(lowEnergy.length);
        BitSet valueRows = new BitSet(values.length);
        for (int k = 0; k < componentChannels.length; k++) {
            if (sectors[k] != sector || regions[k] != region) {
                continue;
            }
            components.set(k);
            int g1 = groupOffsets[k];
            int g2 = groupOffsets[k + 1];
            groups.set(g1, g2);
            valueRows.set(valueOffsets[g1], valueOffsets[g2]);
        }
        if (components.isEmpty()) {
            throw new RegionNotFoundException(sector, region);
        }
        return new ResponseMasks(components, groups, valueRows);
    }

    /**
     * The components of (sector, region), renumbered to sector 1, region 1.
     *
     * @throws ArrayLengthMismatchException if the result fails {@link #check()}
     */
    public ResponseMatrix extractRegion(int sector, int region) {
        ResponseMasks masks = regionMask(sector, region);
        ResponseMatrix extracted = select(masks.components(), masks.groups(), masks.values()).relabel(1, 1);
        extracted.check().orThrow("Extracted response sector " + sector + " region " + region);
        return extracted;
    }

    /**
     * Appends the components of (sector, region) of {@code other}, keeping
     * their labels.
     *
     * @throws IncompatibleMatrixException if the capability flags differ
     */
    public ResponseMatrix appendComponent(ResponseMatrix other, int sector, int region) {
        Objects.requireNonNull(other, "other");
        requireCompatible(other);
        ResponseMasks masks = other.regionMask(sector, region);
        return concatenate(other.select(masks.components(), masks.groups(), masks.values()));
    }

    /**
     * Appends every component of {@code other}, labelled (sector, region).
     * Used to stack grating orders as components of one region.
     *
     * @throws IncompatibleMatrixException if the capability flags differ
     */
    public ResponseMatrix appendAllComponents(ResponseMatrix other, int sector, int region) {
        Objects.requireNonNull(other, "other");
        requireCompatible(other);
        return concatenate(other.relabel(sector, region));
    }

    /**
     * Removes the components of (sector, region). When no remaining component
     * uses the region number any more, higher region numbers move down by one.
     */
    public ResponseMatrix deleteRegion(int sector, int region) {
        ResponseMasks masks = regionMask(sector, region);
        ResponseMatrix rest = select(
                Masks.complement(masks.components(), componentChannels.length),
                Masks.complement(masks.groups(), lowEnergy.length),
                Masks.complement(masks.values(), values.length));

        for (int r : rest.regions) {
            if (r == region) {
                return rest;
            }
        }
        int[] renumbered = rest.regions.clone();
        for (int i = 0; i < renumbered.length; i++) {
            if (renumbered[i] > region) {
                renumbered[i]--;
            }
        }
        return rest.toBuilder()
                .components(rest.componentChannels, rest.componentGroups, rest.sectors, renumbered)
                .build();
    }

    /**
     * Copy with every component labelled (sector, region).
     */
    public ResponseMatrix relabel(int sector, int region) {
        SectorRegion key = SectorRegion.of(sector, region);
        int[] s = new int[componentChannels.length];
        int[] r = new int[componentChannels.length];
        Arrays.fill(s, key.sector());
        Arrays.fill(r, key.region());
        return toBuilder().components(componentChannels, componentGroups, s, r).build();
    }

    // ---------------------------------------------------------------------
    // Channel operations
    // ---------------------------------------------------------------------

    /**
     * Mirrors channel numbering per component: a group covering
     * {@code [first, last]} of {@code N} channels becomes
     * {@code [N-last+1, N-first+1]} and its values are reversed.
     */
    public ResponseMatrix swapChannelOrder() {
        requireConsistentCounts();
        int[] ic1 = firstChannel.clone();
        int[] ic2 = lastChannel.clone();
        double[] resp = values.clone();
        double[] dresp = derivatives.clone();
        int[] groupOffsets = componentGroupOffsets();
        int[] valueOffsets = groupValueOffsets();

        for (int k = 0; k < componentChannels.length; k++) {
            int n = componentChannels[k];
            for (int g = groupOffsets[k]; g < groupOffsets[k + 1]; g++) {
                ic1[g] = n - lastChannel[g] + 1;
                ic2[g] = n - firstChannel[g] + 1;
                Masks.reverseRange(resp, valueOffsets[g], valueOffsets[g + 1]);
                if (responseDerivative) {
                    Masks.reverseRange(dresp, valueOffsets[g], valueOffsets[g + 1]);
                }
            }
        }
        Builder b = toBuilder()
                .groups(lowEnergy, highEnergy, ic1, ic2, groupChannels)
                .values(resp);
        if (responseDerivative) {
            b.derivatives(dresp);
        }
        return b.build();
    }

    /**
     * Adds {@code delta} to the first and last channel of every group.
     *
     * @throws ChannelOutOfRangeException if a shifted non-empty group would
     *         start below channel 1 or end above its component's channel count
     */
    public ResponseMatrix shiftChannels(int delta) {
        requireConsistentCounts();
        int[] ic1 = new int[firstChannel.length];
        int[] ic2 = new int[lastChannel.length];
        int[] groupOffsets = componentGroupOffsets();
        for (int k = 0; k < componentChannels.length; k++) {
            for (int g = groupOffsets[k]; g < groupOffsets[k + 1]; g++) {
                ic1[g] = firstChannel[g] + delta;
                ic2[g] = lastChannel[g] + delta;
                if (groupChannels[g] > 0 && (ic1[g] < 1 || ic2[g] > componentChannels[k])) {
                    throw new ChannelOutOfRangeException("Shift of " + delta + " moves group " + (g + 1)
                            + " to channels " + ic1[g] + ".." + ic2[g]
                            + " outside 1.." + componentChannels[k]);
                }
            }
        }
        return toBuilder().groups(lowEnergy, highEnergy, ic1, ic2, groupChannels).build();
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------

    public CheckResult check() {
        int nComp = componentChannels.length;
        if (componentGroups.length != nComp || sectors.length != nComp || regions.length != nComp
                || (sharedComponentsFlag && sharedComponents.length != nComp)) {
            return CheckResult.failed("Component table columns differ in length");
        }
        int nGroup = lowEnergy.length;
        if (highEnergy.length != nGroup || firstChannel.length != nGroup || lastChannel.length != nGroup
                || groupChannels.length != nGroup || (areaScaling && relativeArea.length != nGroup)) {
            return CheckResult.failed("Group table columns differ in length");
        }
        if (responseDerivative && derivatives.length != values.length) {
            return CheckResult.failed("Response derivative length " + derivatives.length
                    + " differs from response length " + values.length);
        }
        if (Masks.sum(componentGroups) != nGroup) {
            return CheckResult.failed("Sum of component group counts " + Masks.sum(componentGroups)
                    + " differs from the number of groups " + nGroup);
        }
        if (Masks.sum(groupChannels) != values.length) {
            return CheckResult.failed("Number of indexed channels " + Masks.sum(groupChannels)
                    + " not equal to response array length " + values.length);
        }

        int g = 0;
        for (int k = 0; k < nComp; k++) {
            for (int j = 0; j < componentGroups[k]; j++, g++) {
                String where = "group " + (j + 1) + " of component " + (k + 1);
                if (highEnergy[g] <= lowEnergy[g]) {
                    return CheckResult.failed("Energy bin size is not positive for " + where);
                }
                if (j > 0 && lowEnergy[g] < lowEnergy[g - 1]) {
                    return CheckResult.failed("Energy grid is not increasing for " + where);
                }
                if (groupChannels[g] < 0) {
                    return CheckResult.failed("Negative channel count for " + where);
                }
                if (lastChannel[g] - firstChannel[g] + 1 != groupChannels[g]) {
                    return CheckResult.failed("Channel range " + firstChannel[g] + ".." + lastChannel[g]
                            + " does not match channel count " + groupChannels[g] + " for " + where);
                }
                if (groupChannels[g] > 0 && firstChannel[g] < 1) {
                    return CheckResult.failed("First channel " + firstChannel[g] + " is not allowed for " + where);
                }
                if (groupChannels[g] > 0 && lastChannel[g] > componentChannels[k]) {
                    return CheckResult.failed("Last channel " + lastChannel[g]
                            + " exceeds the channel count " + componentChannels[k] + " for " + where);
                }
            }
        }
        for (int i = 0; i < values.length; i++) {
            if (!(values[i] >= 0.0)) {
                return CheckResult.failed("Negative or undefined response value at row " + (i + 1));
            }
        }
        return CheckResult.passed();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void requireConsistentCounts() {
        if (Masks.sum(componentGroups) != lowEnergy.length || Masks.sum(groupChannels) != values.length
                || componentGroups.length != componentChannels.length) {
            throw new ArrayLengthMismatchException("Response tables do not match their declared counts: "
                    + "groups " + Masks.sum(componentGroups) + "/" + lowEnergy.length
                    + ", values " + Masks.sum(groupChannels) + "/" + values.length);
        }
    }

    private void requireCompatible(ResponseMatrix other) {
        if (isEmpty()) {
            return;
        }
        List<String> differences = new ArrayList<>();
        if (sharedComponentsFlag != other.sharedComponentsFlag) {
            differences.add("shared components");
        }
        if (areaScaling != other.areaScaling) {
            differences.add("area scaling");
        }
        if (responseDerivative != other.responseDerivative) {
            differences.add("response derivative");
        }
        if (!differences.isEmpty()) {
            throw new IncompatibleMatrixException("Matrices differ in " + String.join(", ", differences));
        }
    }

    private ResponseMatrix select(BitSet comps, BitSet groups, BitSet rows) {
        Builder b = new Builder()
                .components(Masks.select(componentChannels, comps), Masks.select(componentGroups, comps),
                        Masks.select(sectors, comps), Masks.select(regions, comps))
                .groups(Masks.select(lowEnergy, groups), Masks.select(highEnergy, groups),
                        Masks.select(firstChannel, groups), Masks.select(lastChannel, groups),
                        Masks.select(groupChannels, groups))
                .values(Masks.select(values, rows));
        if (sharedComponentsFlag) {
            b.sharedComponents(Masks.select(sharedComponents, comps));
        }
        if (areaScaling) {
            b.relativeAreas(Masks.select(relativeArea, groups));
        }
        if (responseDerivative) {
            b.derivatives(Masks.select(derivatives, rows));
        }
        return b.build();
    }

    /**
     * This matrix followed by {@code tail}. An empty matrix takes the
     * capability flags of {@code tail}.
     */
    private ResponseMatrix concatenate(ResponseMatrix tail) {
        ResponseMatrix head = isEmpty() ? EMPTY.withFlagsOf(tail) : this;
        Builder b = new Builder()
                .components(Masks.concat(head.componentChannels, tail.componentChannels),
                        Masks.concat(head.componentGroups, tail.componentGroups),
                        Masks.concat(head.sectors, tail.sectors),
                        Masks.concat(head.regions, tail.regions))
                .groups(Masks.concat(head.lowEnergy, tail.lowEnergy),
                        Masks.concat(head.highEnergy, tail.highEnergy),
                        Masks.concat(head.firstChannel, tail.firstChannel),
                        Masks.concat(head.lastChannel, tail.lastChannel),
                        Masks.concat(head.groupChannels, tail.groupChannels))
                .values(Masks.concat(head.values, tail.values));
        if (tail.sharedComponentsFlag) {
            b.sharedComponents(Masks.concat(head.sharedComponents, tail.sharedComponents));
        }
        if (tail.areaScaling) {
            b.relativeAreas(Masks.concat(head.relativeArea, tail.relativeArea));
        }
        if (tail.responseDerivative) {
            b.derivatives(Masks.concat(head.derivatives, tail.derivatives));
        }
        return b.build();
    }

    private ResponseMatrix withFlagsOf(ResponseMatrix other) {
        Builder b = toBuilder();
        b.sharedComponents = other.sharedComponentsFlag ? new int[0] : null;
        b.relativeArea = other.areaScaling ? new double[0] : null;
        b.derivatives = other.responseDerivative ? new double[0] : null;
        return b.build();
    }

    @Override
    public String toString() {
        return "ResponseMatrix[components=" + componentChannels.length + ", groups=" + lowEnergy.length
                + ", values=" + values.length + "]";
    }

    /**
     * Builder for {@link ResponseMatrix}. Arrays are copied. Supplying one of
     * the optional columns turns the matching capability flag on.
     */
    public static final class Builder {
        private int[] componentChannels = new int[0];
        private int[] componentGroups = new int[0];
        private int[] sectors = new int[0];
        private int[] regions = new int[0];
        private int[] sharedComponents;
        private double[] lowEnergy = new double[0];
        private double[] highEnergy = new double[0];
        private int[] firstChannel = new int[0];
        private int[] lastChannel = new int[0];
        private int[] groupChannels = new int[0];
        private double[] relativeArea;
        private double[] values = new double[0];
        private double[] derivatives;

        private Builder() {}

        public Builder components(int[] channelCounts, int[] groupCounts, int[] sectors, int[] regions) {
            this.componentChannels = channelCounts.clone();
            this.componentGroups = groupCounts.clone();
            this.sectors = sectors.clone();
            this.regions = regions.clone();
            return this;
        }

        public Builder sharedComponents(int[] sharedComponents) {
            this.sharedComponents = sharedComponents.clone();
            return this;
        }

        public Builder groups(double[] lowEnergy, double[] highEnergy,
                              int[] firstChannel, int[] lastChannel, int[] channelCounts) {
            this.lowEnergy = lowEnergy.clone();
            this.highEnergy = highEnergy.clone();
            this.firstChannel = firstChannel.clone();
            this.lastChannel = lastChannel.clone();
            this.groupChannels = channelCounts.clone();
            return this;
        }

        public Builder relativeAreas(double[] relativeArea) {
            this.relativeArea = relativeArea.clone();
            return this;
        }

        public Builder values(double[] values) {
            this.values = values.clone();
            return this;
        }

        public Builder derivatives(double[] derivatives) {
            this.derivatives = derivatives.clone();
            return this;
        }

        public ResponseMatrix build() {
            return new ResponseMatrix(this);
        }
    }
}
