package com.questrail.spex.model;

import java.util.BitSet;
import java.util.Objects;

/**
 * Row selection of one (sector, region) inside a {@link ResponseMatrix}.
 *
 * @param components rows of the component table
 * @param groups     rows of the group table
 * @param values     rows of the value table
 */
public record ResponseMasks(BitSet components, BitSet groups, BitSet values)
{
    public ResponseMasks {
        Objects.requireNonNull(components, "components");
        Objects.requireNonNull(groups, "groups");
        Objects.requireNonNull(values, "values");
        components = (BitSet) components.clone();
        groups = (BitSet) groups.clone();
        values = (BitSet) values.clone();
    }

    @Override
    public BitSet components() {
        return (BitSet) components.clone();
    }

    @Override
    public BitSet groups() {
        return (BitSet) groups.clone();
    }

    @Override
    public BitSet values() {
        return (BitSet) values.clone();
    }
}
