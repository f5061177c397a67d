package com.questrail.spex.mapping;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Masks
 * -----------------------------------------------------------------------------
 * Array helpers shared by the region masking, concatenation and cleaning
 * code.
 *
 * <p>Masks are plain {@link BitSet}s over 0-based table rows. They are
 * computed on demand and consumed immediately; no table keeps a mask as
 * state. All helpers return fresh arrays and never modify their inputs.</p>
 */
public final class Masks
{
    private Masks() {}

    /**
     * Returns a mask with rows {@code [from, to)} set.
     */
    public static BitSet range(int from, int to) {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid row range [" + from + ", " + to + ")");
        }
        BitSet mask = new BitSet(to);
        mask.set(from, to);
        return mask;
    }

    /**
     * Returns a mask with every row of {@code [0, size)} that is not set in {@code mask}.
     */
    public static BitSet complement(BitSet mask, int size) {
        BitSet result = new BitSet(size);
        result.set(0, size);
        result.andNot(mask);
        return result;
    }

    public static BitSet of(boolean[] flags) {
        BitSet mask = new BitSet(flags.length);
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) {
                mask.set(i);
            }
        }
        return mask;
    }

    public static double[] select(double[] values, BitSet mask) {
        requireWithin(mask, values.length);
        double[] out = new double[mask.cardinality()];
        int k = 0;
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
            out[k++] = values[i];
        }
        return out;
    }

    public static int[] select(int[] values, BitSet mask) {
        requireWithin(mask, values.length);
        int[] out = new int[mask.cardinality()];
        int k = 0;
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
            out[k++] = values[i];
        }
        return out;
    }

    public static boolean[] select(boolean[] values, BitSet mask) {
        requireWithin(mask, values.length);
        boolean[] out = new boolean[mask.cardinality()];
        int k = 0;
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
            out[k++] = values[i];
        }
        return out;
    }

    public static double[] concat(double[] a, double[] b) {
        double[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    public static int[] concat(int[] a, int[] b) {
        int[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    public static boolean[] concat(boolean[] a, boolean[] b) {
        boolean[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    public static double[] reversed(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[values.length - 1 - i];
        }
        return out;
    }

    public static boolean[] reversed(boolean[] values) {
        boolean[] out = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[values.length - 1 - i];
        }
        return out;
    }

    /**
     * Reverses {@code values[from, to)} in place.
     */
    public static void reverseRange(double[] values, int from, int to) {
        for (int i = from, j = to - 1; i < j; i++, j--) {
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }

    public static int sum(int[] values) {
        return sum(values, 0, values.length);
    }

    /**
     * Sum of {@code values[from, to)}.
     */
    public static int sum(int[] values, int from, int to) {
        int total = 0;
        for (int i = from; i < to; i++) {
            total += values[i];
        }
        return total;
    }

    public static double[] filled(int length, double value) {
        double[] out = new double[length];
        Arrays.fill(out, value);
        return out;
    }

    public static boolean[] filled(int length, boolean value) {
        boolean[] out = new boolean[length];
        Arrays.fill(out, value);
        return out;
    }

    private static void requireWithin(BitSet mask, int size) {
        if (mask.length() > size) {
            throw new IndexOutOfBoundsException("mask length=" + mask.length() + ", size=" + size);
        }
    }
}
