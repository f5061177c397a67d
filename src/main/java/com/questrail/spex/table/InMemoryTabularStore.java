package com.questrail.spex.table;

import com.questrail.spex.api.FormatException;

import java.util.*;

/**
 * Heap-only {@link TabularStore}.
 *
 * <p>Used for tests and for chaining conversions without touching disk.
 * Closing makes the store unusable.</p>
 */
public final class InMemoryTabularStore implements TabularStore
{
    private final Map<String, Table> tables = new LinkedHashMap<>();
    private boolean closed;

    @Override
    public List<String> tableNames() {
        ensureOpen();
        return List.copyOf(tables.keySet());
    }

    @Override
    public Table read(String tableName) {
        ensureOpen();
        Table t = tables.get(tableName.trim().toUpperCase(Locale.ROOT));
        if (t == null) {
            throw new FormatException("No table named " + tableName);
        }
        return t;
    }

    @Override
    public void write(Table table) {
        ensureOpen();
        Objects.requireNonNull(table, "table");
        tables.put(table.name(), table);
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store is closed");
        }
    }
}
