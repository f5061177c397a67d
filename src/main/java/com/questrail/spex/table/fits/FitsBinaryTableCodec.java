package com.questrail.spex.table.fits;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.table.Column;
import com.questrail.spex.table.ColumnShape;
import com.questrail.spex.table.ColumnType;
import com.questrail.spex.table.Table;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.ArrayFuncs;

import java.lang.reflect.Array;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FitsBinaryTableCodec
 * -----------------------------------------------------------------------------
 * Converts between {@link Table} and nom.tam {@link BinaryTableHDU}s.
 *
 * <h2>Reading</h2>
 * Supported TFORM codes are {@code L B I J K E D A}, with repeat counts, and
 * the {@code P}/{@code Q} variable-length descriptors for every non-string
 * code. Bit ({@code X}) and complex ({@code C M}) columns are rejected.
 * Byte columns are unsigned.
 *
 * <p>{@code TSCALn}/{@code TZEROn} turn stored values into physical ones. An
 * integer offset with unit scale (the unsigned-integer convention) widens
 * the column to the next integer type; any other scaling yields a DOUBLE
 * column.</p>
 *
 * <h2>Writing</h2>
 * Columns are written with their declared type. VARIABLE columns always get
 * heap descriptors, even when every row happens to have the same length.
 */
final class FitsBinaryTableCodec
{
    private static final Pattern TFORM = Pattern.compile(
            "\\s*(\\d*)([LXBIJKAEDCMPQ])(?:([LXBIJKAEDCM])(?:\\((\\d+)\\))?)?.*");

    private FitsBinaryTableCodec() {}

    /**
     * Parsed TFORM value.
     */
    record TForm(int repeat, char code, boolean variable)
    {
        static TForm parse(String text) {
            if (text == null) {
                throw new FormatException("Missing TFORM");
            }
            Matcher m = TFORM.matcher(text);
            if (!m.matches()) {
                throw new FormatException("Unparsable TFORM: " + text);
            }
            int repeat = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
            char code = m.group(2).charAt(0);
            if (code == 'P' || code == 'Q') {
                if (m.group(3) == null) {
                    throw new FormatException("Variable-length TFORM without element type: " + text);
                }
                char element = checkCode(m.group(3).charAt(0), text);
                if (element == 'A') {
                    throw new FormatException("Unsupported variable-length string TFORM: " + text);
                }
                return new TForm(repeat, element, true);
            }
            return new TForm(repeat, checkCode(code, text), false);
        }

        private static char checkCode(char code, String text) {
            if (code == 'X' || code == 'C' || code == 'M') {
                throw new FormatException("Unsupported TFORM: " + text);
            }
            return code;
        }

        ColumnShape shape() {
            if (variable) {
                return ColumnShape.VARIABLE;
            }
            return code == 'A' || repeat == 1 ? ColumnShape.SCALAR : ColumnShape.FIXED;
        }
    }

    /**
     * TSCALn and TZEROn of one column.
     */
    record Scaling(double scale, double zero)
    {
        boolean identity() {
            return scale == 1.0 && zero == 0.0;
        }

        boolean integral() {
            return scale == 1.0 && zero == Math.rint(zero);
        }
    }

    // ---------------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------------

    static Table decode(String name, BinaryTableHDU hdu) throws FitsException {
        nom.tam.fits.Header raw = hdu.getHeader();
        Table.Builder table = Table.builder(name)
                .header(FitsHeaderCodec.decode(raw, FitsHeaderCodec.STRUCTURAL));
        int rows = hdu.getNRows();
        for (int c = 0; c < hdu.getNCols(); c++) {
            int n = c + 1;
            String colName = raw.getStringValue("TTYPE" + n);
            colName = colName == null || colName.isBlank() ? "COL" + n : colName.strip();
            TForm form = TForm.parse(raw.getStringValue("TFORM" + n));
            Scaling scaling = new Scaling(raw.getDoubleValue("TSCAL" + n, 1.0), raw.getDoubleValue("TZERO" + n, 0.0));
            ColumnType type = physicalType(ColumnType.fromCode(form.code()), scaling);

            Object data = hdu.getColumn(c);
            Object[] cells = new Object[rows];
            for (int r = 0; r < rows; r++) {
                Object element = data == null ? null : Array.get(data, r);
                cells[r] = switch (form.shape()) {
                    case SCALAR -> form.code() == 'A'
                            ? readString(element, colName)
                            : readScalar(first(element), form.code(), type, scaling);
                    case FIXED, VARIABLE -> readArray(element, form.code(), type, scaling);
                };
            }
            int width = switch (form.shape()) {
                case SCALAR -> form.code() == 'A' ? Math.max(1, form.repeat()) : 1;
                case FIXED -> form.repeat();
                case VARIABLE -> maxLength(cells);
            };
            Column column = Column.ofCells(colName, type, form.shape(), width, cells);
            String unit = raw.getStringValue("TUNIT" + n);
            if (unit != null && !unit.isBlank()) {
                column = column.withUnit(unit.strip());
            }
            table.column(column);
        }
        return table.build();
    }

    private static int maxLength(Object[] cells) {
        int max = 0;
        for (Object cell : cells) {
            max = Math.max(max, Array.getLength(cell));
        }
        return max;
    }

    static ColumnType physicalType(ColumnType stored, Scaling scaling) {
        if (scaling.identity() || stored == ColumnType.LOGICAL || stored == ColumnType.STRING) {
            return stored;
        }
        if (stored.isInteger() && scaling.integral()) {
            return switch (stored) {
                case BYTE -> ColumnType.SHORT;
                case SHORT -> ColumnType.INT;
                default -> ColumnType.LONG;
            };
        }
        return ColumnType.DOUBLE;
    }

    private static Object first(Object element) {
        if (element != null && element.getClass().isArray()) {
            return Array.getLength(element) == 0 ? null : Array.get(element, 0);
        }
        return element;
    }

    private static String readString(Object element, String column) {
        if (element == null) {
            return "";
        }
        if (!(element instanceof String s)) {
            throw new FormatException("Column " + column + " holds " + element.getClass().getSimpleName()
                    + " instead of strings");
        }
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == ' ' || s.charAt(end - 1) == '\0')) {
            end--;
        }
        return s.substring(0, end);
    }

    private static Object readScalar(Object element, char code, ColumnType type, Scaling scaling) {
        if (type == ColumnType.LOGICAL) {
            return element instanceof Boolean b && b;
        }
        if (element == null) {
            return type.isFloating() ? (Object) 0.0 : (Object) 0L;
        }
        Number value = element instanceof Byte b ? (Number) (b & 0xFF) : (Number) element;
        boolean stored = element instanceof Byte || storedClass(code).isInstance(element);
        if (type.isFloating()) {
            double v = value.doubleValue();
            return stored && !scaling.identity() ? scaling.zero() + scaling.scale() * v : v;
        }
        long v = value.longValue();
        return stored && !scaling.identity() ? v + (long) scaling.zero() : v;
    }

    private static Object readArray(Object element, char code, ColumnType type, Scaling scaling) {
        if (element == null) {
            return switch (type) {
                case LOGICAL -> new boolean[0];
                case FLOAT, DOUBLE -> new double[0];
                default -> new long[0];
            };
        }
        Object flat = element instanceof Object[] ? ArrayFuncs.flatten(element) : element;
        int length = Array.getLength(flat);
        switch (type) {
            case LOGICAL -> {
                boolean[] out = new boolean[length];
                for (int i = 0; i < length; i++) {
                    out[i] = (Boolean) readScalar(Array.get(flat, i), code, type, scaling);
                }
                return out;
            }
            case FLOAT, DOUBLE -> {
                double[] out = new double[length];
                for (int i = 0; i < length; i++) {
                    out[i] = (Double) readScalar(Array.get(flat, i), code, type, scaling);
                }
                return out;
            }
            default -> {
                long[] out = new long[length];
                for (int i = 0; i < length; i++) {
                    out[i] = (Long) readScalar(Array.get(flat, i), code, type, scaling);
                }
                return out;
            }
        }
    }

    private static Class<?> storedClass(char code) {
        return switch (code) {
            case 'B' -> Byte.class;
            case 'I' -> Short.class;
            case 'J' -> Integer.class;
            case 'K' -> Long.class;
            case 'E' -> Float.class;
            case 'D' -> Double.class;
            case 'L' -> Boolean.class;
            default -> String.class;
        };
    }

    // ---------------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------------

    static BinaryTableHDU encode(Table table) throws FitsException {
        BinaryTable data = new BinaryTable();
        for (Column column : table.columns()) {
            Object values = columnData(column);
            if (column.shape() == ColumnShape.VARIABLE) {
                data.addVariableSizeColumn(values);
            } else {
                data.addColumn(values);
            }
        }
        BinaryTableHDU hdu = (BinaryTableHDU) Fits.makeHDU(data);
        nom.tam.fits.Header header = hdu.getHeader();
        for (int c = 0; c < table.columns().size(); c++) {
            Column column = table.columns().get(c);
            hdu.setColumnName(c, column.name(), null);
            if (column.unit().isPresent()) {
                header.addValue("TUNIT" + (c + 1), column.unit().get(), null);
            }
        }
        header.addValue("EXTNAME", table.name(), null);
        FitsHeaderCodec.encode(table.header(), header);
        return hdu;
    }

    private static Object columnData(Column column) {
        int rows = column.rowCount();
        if (column.type() == ColumnType.STRING) {
            int width = Math.max(1, column.width());
            String[] out = new String[rows];
            String[] values = column.asStrings();
            for (int r = 0; r < rows; r++) {
                width = Math.max(width, values[r].length());
            }
            for (int r = 0; r < rows; r++) {
                out[r] = String.format(Locale.ROOT, "%-" + width + "s", values[r]);
            }
            return out;
        }
        if (column.shape() == ColumnShape.SCALAR) {
            Object out = Array.newInstance(elementClass(column.type()), rows);
            for (int r = 0; r < rows; r++) {
                setElement(out, r, column.cell(r), column);
            }
            return out;
        }
        Object out = Array.newInstance(elementClass(column.type()).arrayType(), rows);
        for (int r = 0; r < rows; r++) {
            Object cell = column.cell(r);
            int length = Array.getLength(cell);
            Object row = Array.newInstance(elementClass(column.type()), length);
            for (int i = 0; i < length; i++) {
                setElement(row, i, Array.get(cell, i), column);
            }
            Array.set(out, r, row);
        }
        return out;
    }

    private static Class<?> elementClass(ColumnType type) {
        return switch (type) {
            case LOGICAL -> boolean.class;
            case BYTE -> byte.class;
            case SHORT -> short.class;
            case INT -> int.class;
            case LONG -> long.class;
            case FLOAT -> float.class;
            case DOUBLE -> double.class;
            case STRING -> String.class;
        };
    }

    private static void setElement(Object array, int index, Object value, Column column) {
        switch (column.type()) {
            case LOGICAL -> Array.setBoolean(array, index, (Boolean) value);
            case BYTE -> Array.setByte(array, index, (byte) checkRange(value, 0, 255, column));
            case SHORT -> Array.setShort(array, index, (short) checkRange(value, Short.MIN_VALUE, Short.MAX_VALUE, column));
            case INT -> Array.setInt(array, index, (int) checkRange(value, Integer.MIN_VALUE, Integer.MAX_VALUE, column));
            case LONG -> Array.setLong(array, index, (Long) value);
            case FLOAT -> Array.setFloat(array, index, ((Double) value).floatValue());
            case DOUBLE -> Array.setDouble(array, index, (Double) value);
            case STRING -> Array.set(array, index, value);
        }
    }

    private static long checkRange(Object value, long min, long max, Column column) {
        long v = (Long) value;
        if (v < min || v > max) {
            throw new FormatException("Value " + v + " does not fit " + column.type() + " column " + column.name());
        }
        return v;
    }
}
