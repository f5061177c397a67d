package com.questrail.spex.table.fits;

import com.questrail.spex.api.FormatException;
import com.questrail.spex.table.Header;
import com.questrail.spex.table.Table;
import com.questrail.spex.table.TabularStore;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * FitsTabularStore
 * -----------------------------------------------------------------------------
 * {@link TabularStore} backed by a FITS file, read and written with nom.tam
 * FITS.
 *
 * <h2>Reading</h2>
 * {@link #open(Path)} decodes every {@code BINTABLE} extension of the file
 * up front, keyed by {@code EXTNAME}. Other extension types are skipped.
 * Gzip-compressed files are recognised by nom.tam.
 *
 * <h2>Writing</h2>
 * {@link #create(Path, boolean, List)} returns an empty store whose tables
 * are written, in order, when the store is closed. The file starts with an
 * empty primary HDU carrying {@code CREATOR}, {@code ORIGIN} and the
 * supplied {@code HISTORY} lines.
 *
 * <p>nom.tam types never leave this package.</p>
 */
public final class FitsTabularStore implements TabularStore
{
    public static final String CREATOR = "spex-convert";
    public static final String ORIGIN = "SRON Netherlands Institute for Space Research";

    private final Path path;
    private final boolean writable;
    private final Header primaryHeader;
    private final Map<String, Table> tables = new LinkedHashMap<>();
    private boolean closed;

    private FitsTabularStore(Path path, boolean writable, Header primaryHeader) {
        this.path = path;
        this.writable = writable;
        this.primaryHeader = primaryHeader;
    }

    /**
     * Opens an existing FITS file for reading.
     *
     * @throws FormatException if the file cannot be read or is not valid FITS
     */
    public static FitsTabularStore open(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new FormatException("Cannot read FITS file " + path + ": no such file");
        }
        try (Fits fits = new Fits(path.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length == 0) {
                throw new FormatException(path + " is not a FITS file");
            }
            Header primary = FitsHeaderCodec.decode(hdus[0].getHeader(), null);
            if (!primary.getBoolean("SIMPLE").orElse(false)) {
                throw new FormatException(path + " is not a FITS file (SIMPLE != T)");
            }

            FitsTabularStore store = new FitsTabularStore(path, false, primary);
            for (int hdu = 1; hdu < hdus.length; hdu++) {
                if (!(hdus[hdu] instanceof BinaryTableHDU table)) {
                    continue;
                }
                String extname = table.getHeader().getStringValue("EXTNAME");
                String name = (extname == null || extname.isBlank() ? "HDU" + hdu : extname.strip())
                        .toUpperCase(Locale.ROOT);
                if (!store.tables.containsKey(name)) {
                    store.tables.put(name, FitsBinaryTableCodec.decode(name, table));
                }
            }
            return store;
        } catch (IOException | IllegalArgumentException | IllegalStateException ex) {
            throw new FormatException("Malformed FITS file " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Creates a store that writes {@code path} on close.
     *
     * @throws FormatException if the file exists and {@code overwrite} is false
     */
    public static FitsTabularStore create(Path path, boolean overwrite, List<String> history) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(history, "history");
        if (Files.exists(path) && !overwrite) {
            throw new FormatException("File " + path + " already exists; enable overwrite to replace it");
        }
        Header.Builder primary = Header.builder()
                .put("SIMPLE", true)
                .put("BITPIX", 8L)
                .put("NAXIS", 0L)
                .put("EXTEND", true)
                .put("CREATOR", CREATOR)
                .put("ORIGIN", ORIGIN);
        history.forEach(primary::addHistory);
        return new FitsTabularStore(path, true, primary.build());
    }

    public Path path() {
        return path;
    }

    public Header primaryHeader() {
        return primaryHeader;
    }

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
            throw new FormatException("No table named " + tableName + " in " + path);
        }
        return t;
    }

    @Override
    public void write(Table table) {
        ensureOpen();
        if (!writable) {
            throw new IllegalStateException("FITS store " + path + " is open for reading only");
        }
        Objects.requireNonNull(table, "table");
        tables.put(table.name(), table);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!writable) {
            return;
        }
        try (Fits fits = new Fits()) {
            BasicHDU<?> primary = BasicHDU.getDummyHDU();
            FitsHeaderCodec.encode(primaryHeader, primary.getHeader());
            fits.addHDU(primary);
            for (Table table : tables.values()) {
                fits.addHDU(FitsBinaryTableCodec.encode(table));
            }
            Files.deleteIfExists(path);
            fits.write(path.toFile());
        } catch (FitsException | IOException ex) {
            throw new FormatException("Cannot write FITS file " + path + ": " + ex.getMessage(), ex);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store " + path + " is closed");
        }
    }
}
