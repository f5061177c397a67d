package com.questrail.spex.table;

import com.questrail.spex.api.FormatException;

import java.util.*;

/**
 * A named table: a {@link Header} and an ordered list of equally long
 * {@link Column}s.
 *
 * <p>Column lookup is case-insensitive. {@link #column(String)} fails with
 * {@link FormatException} because a missing required column is a malformed
 * input; {@link #findColumn(String)} is for optional columns.</p>
 */
public final class Table
{
    private final String name;
    private final Header header;
    private final List<Column> columns;
    private final Map<String, Column> byName;
    private final int rowCount;

    public Table(String name, Header header, List<Column> columns) {
        this.name = Objects.requireNonNull(name, "name").trim().toUpperCase(Locale.ROOT);
        this.header = Objects.requireNonNull(header, "header");
        this.columns = List.copyOf(columns);

        Map<String, Column> tmp = new LinkedHashMap<>();
        int rows = -1;
        for (Column c : this.columns) {
            if (tmp.put(c.name().toUpperCase(Locale.ROOT), c) != null) {
                throw new IllegalArgumentException("Duplicate column " + c.name() + " in table " + name);
            }
            if (rows >= 0 && c.rowCount() != rows) {
                throw new IllegalArgumentException("Column " + c.name() + " has " + c.rowCount()
                        + " rows, expected " + rows + " in table " + name);
            }
            rows = c.rowCount();
        }
        this.byName = Collections.unmodifiableMap(tmp);
        this.rowCount = Math.max(rows, 0);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Header header() {
        return header;
    }

    public List<Column> columns() {
        return columns;
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean hasColumn(String columnName) {
        return byName.containsKey(columnName.toUpperCase(Locale.ROOT));
    }

    public Optional<Column> findColumn(String columnName) {
        return Optional.ofNullable(byName.get(columnName.toUpperCase(Locale.ROOT)));
    }

    public Column column(String columnName) {
        return findColumn(columnName).orElseThrow(
                () -> new FormatException("Table " + name + " has no column " + columnName));
    }

    /**
     * First present column among the given aliases.
     */
    public Optional<Column> findAnyColumn(String... aliases) {
        for (String alias : aliases) {
            Optional<Column> c = findColumn(alias);
            if (c.isPresent()) {
                return c;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Table[" + name + ", rows=" + rowCount + ", columns=" + byName.keySet() + "]";
    }

    public static final class Builder {
        private final String name;
        private Header header = Header.empty();
        private final List<Column> columns = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder header(Header header) {
            this.header = header;
            return this;
        }

        public Builder column(Column column) {
            columns.add(Objects.requireNonNull(column, "column"));
            return this;
        }

        public Table build() {
            return new Table(name, header, columns);
        }
    }
}
