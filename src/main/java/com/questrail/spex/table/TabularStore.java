package com.questrail.spex.table;

import java.io.Closeable;
import java.util.List;
import java.util.Locale;

/**
 * TabularStore
 * -----------------------------------------------------------------------------
 * Named tables with typed columns and scalar headers.
 *
 * <p>This is the only boundary between the conversion code and files. The
 * format mappers depend on table and column names and on header keywords,
 * never on byte offsets.</p>
 *
 * <h2>Lifecycle</h2>
 * A store is opened, read from and/or written to, then closed. Stores that
 * persist to a file do so no later than {@link #close()}; failures there are
 * reported as {@link com.questrail.spex.api.FormatException}.
 */
public interface TabularStore extends Closeable
{
    /**
     * Table names in store order, upper case.
     */
    List<String> tableNames();

    default boolean contains(String tableName) {
        return tableNames().contains(tableName.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @throws com.questrail.spex.api.FormatException if no such table exists
     */
    Table read(String tableName);

    /**
     * Adds a table, replacing one of the same name.
     */
    void write(Table table);

    @Override
    void close();
}
