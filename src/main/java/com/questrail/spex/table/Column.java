package com.questrail.spex.table;

import com.questrail.spex.api.FormatException;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Column
 * -----------------------------------------------------------------------------
 * A named, typed column of a {@link Table}.
 *
 * <h2>Cell representation</h2>
 * Cells are held row by row in a normalized form:
 * <ul>
 *   <li>{@link ColumnShape#SCALAR}: {@code Boolean}, {@code Long} (all integer
 *       types), {@code Double} (both floating types) or {@code String}</li>
 *   <li>{@link ColumnShape#FIXED} and {@link ColumnShape#VARIABLE}:
 *       {@code boolean[]}, {@code long[]} or {@code double[]}</li>
 * </ul>
 *
 * <h2>Coercion</h2>
 * The {@code asXxx()} accessors convert between integer and floating cells
 * where the conversion is lossless for the values a format uses (channel
 * numbers, counts). A scalar column can be read as rows of length one and a
 * vector column whose rows all hold one element can be read as scalars,
 * which is how the formats handle matrix cells stored either way.
 *
 * <p>Instances are immutable. Array arguments are copied on construction
 * and every accessor returns a fresh array.</p>
 */
public final class Column
{
    private final String name;
    private final ColumnType type;
    private final ColumnShape shape;
    private final int width;
    private final String unit;
    private final Object[] cells;

    private Column(String name, ColumnType type, ColumnShape shape, int width, String unit, Object[] cells) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.width = width;
        this.unit = unit;
        this.cells = cells;
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        if (type == ColumnType.STRING && shape != ColumnShape.SCALAR) {
            throw new IllegalArgumentException("String columns must be scalar: " + name);
        }
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static Column ofDoubles(String name, ColumnType type, double[] values) {
        requireFloating(type);
        Object[] cells = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            cells[i] = values[i];
        }
        return new Column(name, type, ColumnShape.SCALAR, 1, null, cells);
    }

    public static Column ofInts(String name, ColumnType type, int[] values) {
        requireInteger(type);
        Object[] cells = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            cells[i] = (long) values[i];
        }
        return new Column(name, type, ColumnShape.SCALAR, 1, null, cells);
    }

    public static Column ofLongs(String name, ColumnType type, long[] values) {
        requireInteger(type);
        Object[] cells = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            cells[i] = values[i];
        }
        return new Column(name, type, ColumnShape.SCALAR, 1, null, cells);
    }

    public static Column ofBooleans(String name, boolean[] values) {
        Object[] cells = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            cells[i] = values[i];
        }
        return new Column(name, ColumnType.LOGICAL, ColumnShape.SCALAR, 1, null, cells);
    }

    /**
     * String column; {@code width} is the stored character count, values
     * longer than it are rejected.
     */
    public static Column ofStrings(String name, String[] values, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be >= 1");
        }
        Object[] cells = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            String v = Objects.requireNonNullElse(values[i], "");
            if (v.length() > width) {
                throw new IllegalArgumentException("Value '" + v + "' exceeds width " + width + " of " + name);
            }
            cells[i] = v;
        }
        return new Column(name, ColumnType.STRING, ColumnShape.SCALAR, width, null, cells);
    }

    public static Column ofDoubleRows(String name, ColumnType type, double[][] rows, boolean variable) {
        requireFloating(type);
        Object[] cells = new Object[rows.length];
        for (int i = 0; i < rows.length; i++) {
            cells[i] = rows[i].clone();
        }
        return vector(name, type, cells, variable, Arrays.stream(rows).mapToInt(r -> r.length).toArray());
    }

    public static Column ofIntRows(String name, ColumnType type, int[][] rows, boolean variable) {
        requireInteger(type);
        Object[] cells = new Object[rows.length];
        int[] lengths = new int[rows.length];
        for (int i = 0; i < rows.length; i++) {
            cells[i] = Arrays.stream(rows[i]).asLongStream().toArray();
            lengths[i] = rows[i].length;
        }
        return vector(name, type, cells, variable, lengths);
    }

    public static Column ofBooleanRows(String name, boolean[][] rows, boolean variable) {
        Object[] cells = new Object[rows.length];
        int[] lengths = new int[rows.length];
        for (int i = 0; i < rows.length; i++) {
            cells[i] = rows[i].clone();
            lengths[i] = rows[i].length;
        }
        return vector(name, ColumnType.LOGICAL, cells, variable, lengths);
    }

    /**
     * Builds a column from already normalized cells. Used by store
     * implementations that decode cells themselves.
     */
    public static Column ofCells(String name, ColumnType type, ColumnShape shape, int width, Object[] cells) {
        Object[] copy = cells.clone();
        for (int i = 0; i < copy.length; i++) {
            copy[i] = checkCell(name, type, shape, copy[i]);
        }
        return new Column(name, type, shape, width, null, copy);
    }

    private static Column vector(String name, ColumnType type, Object[] cells, boolean variable, int[] lengths) {
        if (variable) {
            int max = Arrays.stream(lengths).max().orElse(0);
            return new Column(name, type, ColumnShape.VARIABLE, max, null, cells);
        }
        int width = lengths.length == 0 ? 1 : lengths[0];
        for (int length : lengths) {
            if (length != width) {
                throw new IllegalArgumentException("Fixed-width column " + name + " has rows of differing length");
            }
        }
        return new Column(name, type, ColumnShape.FIXED, width, null, cells);
    }

    private static Object checkCell(String name, ColumnType type, ColumnShape shape, Object cell) {
        Objects.requireNonNull(cell, "cell");
        boolean ok;
        if (shape == ColumnShape.SCALAR) {
            ok = switch (type) {
                case LOGICAL -> cell instanceof Boolean;
                case STRING -> cell instanceof String;
                case FLOAT, DOUBLE -> cell instanceof Double;
                default -> cell instanceof Long;
            };
            return ok ? cell : fail(name, cell);
        }
        ok = switch (type) {
            case LOGICAL -> cell instanceof boolean[];
            case FLOAT, DOUBLE -> cell instanceof double[];
            case STRING -> false;
            default -> cell instanceof long[];
        };
        return ok ? cell : fail(name, cell);
    }

    private static Object fail(String name, Object cell) {
        throw new IllegalArgumentException("Cell of type " + cell.getClass().getSimpleName()
                + " does not match column " + name);
    }

    private static void requireFloating(ColumnType type) {
        if (!type.isFloating()) {
            throw new IllegalArgumentException("Expected a floating column type, got " + type);
        }
    }

    private static void requireInteger(ColumnType type) {
        if (!type.isInteger()) {
            throw new IllegalArgumentException("Expected an integer column type, got " + type);
        }
    }

    /**
     * Returns a copy of this column carrying a physical unit.
     */
    public Column withUnit(String unit) {
        return new Column(name, type, shape, width, unit, cells);
    }

    // ---------------------------------------------------------------------
    // Metadata
    // ---------------------------------------------------------------------

    public String name() {
        return name;
    }

    public ColumnType type() {
        return type;
    }

    public ColumnShape shape() {
        return shape;
    }

    /**
     * Characters for string columns, elements per row for fixed columns and
     * the largest row for variable columns.
     */
    public int width() {
        return width;
    }

    public Optional<String> unit() {
        return Optional.ofNullable(unit);
    }

    public int rowCount() {
        return cells.length;
    }

    /**
     * Raw normalized cell; arrays are returned as stored, callers must not
     * modify them.
     */
    public Object cell(int row) {
        return cells[row];
    }

    // ---------------------------------------------------------------------
    // Coercing accessors
    // ---------------------------------------------------------------------

    public double[] asDoubles() {
        double[] out = new double[cells.length];
        for (int i = 0; i < cells.length; i++) {
            out[i] = scalarNumber(i).doubleValue();
        }
        return out;
    }

    public long[] asLongs() {
        long[] out = new long[cells.length];
        for (int i = 0; i < cells.length; i++) {
            Number n = scalarNumber(i);
            if (n instanceof Double d && d != Math.rint(d)) {
                throw new FormatException("Column " + name + " row " + i + " is not integral: " + d);
            }
            out[i] = n.longValue();
        }
        return out;
    }

    public int[] asInts() {
        long[] longs = asLongs();
        int[] out = new int[longs.length];
        for (int i = 0; i < longs.length; i++) {
            out[i] = Math.toIntExact(longs[i]);
        }
        return out;
    }

    public boolean[] asBooleans() {
        boolean[] out = new boolean[cells.length];
        for (int i = 0; i < cells.length; i++) {
            Object c = cells[i];
            if (c instanceof boolean[] arr && arr.length == 1) {
                c = arr[0];
            }
            if (c instanceof Boolean b) {
                out[i] = b;
            } else if (c instanceof Long l) {
                out[i] = l != 0;
            } else {
                throw new FormatException("Column " + name + " is not a logical column");
            }
        }
        return out;
    }

    public String[] asStrings() {
        String[] out = new String[cells.length];
        for (int i = 0; i < cells.length; i++) {
            out[i] = String.valueOf(cells[i]);
        }
        return out;
    }

    public double[][] asDoubleRows() {
        double[][] out = new double[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            Object c = cells[i];
            if (c instanceof double[] arr) {
                out[i] = arr.clone();
            } else if (c instanceof long[] arr) {
                out[i] = Arrays.stream(arr).asDoubleStream().toArray();
            } else if (c instanceof Number n) {
                out[i] = new double[] { n.doubleValue() };
            } else {
                throw new FormatException("Column " + name + " is not numeric");
            }
        }
        return out;
    }

    public int[][] asIntRows() {
        int[][] out = new int[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            Object c = cells[i];
            if (c instanceof long[] arr) {
                out[i] = Arrays.stream(arr).mapToInt(Math::toIntExact).toArray();
            } else if (c instanceof double[] arr) {
                out[i] = Arrays.stream(arr).mapToInt(d -> (int) Math.round(d)).toArray();
            } else if (c instanceof Number n) {
                out[i] = new int[] { Math.toIntExact(Math.round(n.doubleValue())) };
            } else {
                throw new FormatException("Column " + name + " is not numeric");
            }
        }
        return out;
    }

    private Number scalarNumber(int row) {
        Object c = cells[row];
        if (c instanceof double[] arr && arr.length == 1) {
            return arr[0];
        }
        if (c instanceof long[] arr && arr.length == 1) {
            return arr[0];
        }
        if (c instanceof Number n) {
            return n;
        }
        throw new FormatException("Column " + name + " row " + row + " is not a numeric scalar");
    }

    @Override
    public String toString() {
        return "Column[" + name + ", " + type + ", " + shape + ", rows=" + cells.length + "]";
    }
}
