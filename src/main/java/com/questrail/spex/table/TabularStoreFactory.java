package com.questrail.spex.table;

import com.questrail.spex.table.fits.FitsTabularStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Opens stores for reading and creates stores for writing.
 *
 * <p>{@link #fits()} is the production factory; tests substitute one backed
 * by {@link InMemoryTabularStore}.</p>
 */
public interface TabularStoreFactory
{
    /**
     * @throws com.questrail.spex.api.FormatException if the file cannot be read
     */
    TabularStore open(Path path);

    /**
     * @throws com.questrail.spex.api.FormatException if the file exists and
     *         {@code overwrite} is false
     */
    TabularStore create(Path path, boolean overwrite, List<String> history);

    /**
     * Whether {@code path} already holds a file that {@link #create} would
     * refuse without overwrite.
     */
    boolean exists(Path path);

    static TabularStoreFactory fits() {
        return new TabularStoreFactory() {
            @Override
            public TabularStore open(Path path) {
                return FitsTabularStore.open(path);
            }

            @Override
            public TabularStore create(Path path, boolean overwrite, List<String> history) {
                return FitsTabularStore.create(path, overwrite, history);
            }

            @Override
            public boolean exists(Path path) {
                return Files.exists(path);
            }
        };
    }
}
